package com.evfinder.domain.ports;

import com.evfinder.domain.model.BankrollLedger;

import java.util.Optional;

/**
 * Port for the durable copy of the bankroll ledger.
 * Implementations must replace the record atomically: readers see either the old or the new ledger.
 */
public interface LedgerRepository {

    /**
     * Loads the stored ledger.
     *
     * @return The ledger, or empty when none was ever saved
     * @throws LedgerPersistenceException if the record exists but cannot be read
     */
    Optional<BankrollLedger> load();

    /**
     * Replaces the stored ledger.
     *
     * @param ledger The full ledger to store
     * @throws LedgerPersistenceException if the write fails; the previous record stays in place
     */
    void save(BankrollLedger ledger);
}
