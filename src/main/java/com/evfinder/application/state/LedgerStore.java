package com.evfinder.application.state;

import com.evfinder.domain.model.BankrollLedger;
import com.evfinder.domain.ports.LedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Serializes access to the ledger record.
 *
 * Every mutation loads the durable record, applies the change and saves it under the write lock.
 * A failed save leaves nothing behind in memory, so the stored record stays authoritative.
 * The first access stores a fresh ledger so its creation time stays fixed.
 */
public class LedgerStore {

    private static final Logger logger = LoggerFactory.getLogger(LedgerStore.class);

    private final LedgerRepository repository;
    private final Clock clock;
    private final BigDecimal defaultInitialBankroll;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LedgerStore(LedgerRepository repository, Clock clock, BigDecimal defaultInitialBankroll) {
        this.repository = repository;
        this.clock = clock;
        this.defaultInitialBankroll = defaultInitialBankroll;
    }

    /**
     * A consistent copy of the ledger. Changes made to it are never stored.
     */
    public BankrollLedger snapshot() {
        lock.readLock().lock();
        try {
            Optional<BankrollLedger> stored = repository.load();
            if (stored.isPresent()) {
                return stored.get();
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            return loadOrInitialize();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies a mutation to a freshly loaded ledger and stores it if anything changed.
     *
     * @param mutation Change to apply; its return value is handed back to the caller
     * @throws com.evfinder.domain.ports.LedgerPersistenceException if the ledger cannot be stored
     */
    public <T> T update(Function<BankrollLedger, T> mutation) {
        lock.writeLock().lock();
        try {
            BankrollLedger ledger = loadOrInitialize();
            T result = mutation.apply(ledger);
            if (ledger.isModified()) {
                ledger.setLastUpdated(clock.instant());
                repository.save(ledger);
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the whole ledger with an empty one holding {@code initialBankroll}.
     */
    public BankrollLedger replace(BigDecimal initialBankroll) {
        lock.writeLock().lock();
        try {
            BankrollLedger ledger = BankrollLedger.fresh(initialBankroll, clock.instant());
            repository.save(ledger);
            logger.info("Ledger reset with initial bankroll {}", ledger.getInitialBankroll());
            return ledger;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Loads the stored ledger, storing a fresh one first when there is none. Write lock held.
     */
    private BankrollLedger loadOrInitialize() {
        Optional<BankrollLedger> stored = repository.load();
        if (stored.isPresent()) {
            return stored.get();
        }
        BankrollLedger ledger = BankrollLedger.fresh(defaultInitialBankroll, clock.instant());
        repository.save(ledger);
        logger.info("Created ledger with initial bankroll {}", ledger.getInitialBankroll());
        return ledger;
    }
}
