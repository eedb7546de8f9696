package com.evfinder.application.usecase;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.domain.model.BankrollSummary;
import com.evfinder.domain.service.BankrollSummaryProjection;
import com.evfinder.domain.service.StakingRules;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Use case for reading the bankroll statistics and starting over.
 */
@Service
public class BankrollSummaryUseCase {

    private final LedgerStore ledgerStore;
    private final BankrollSummaryProjection projection;
    private final StakingRules rules;

    public BankrollSummaryUseCase(LedgerStore ledgerStore, BankrollSummaryProjection projection, StakingRules rules) {
        this.ledgerStore = ledgerStore;
        this.projection = projection;
        this.rules = rules;
    }

    public BankrollSummary getSummary() {
        return projection.summarize(ledgerStore.snapshot());
    }

    /**
     * Discards every bet and restarts from a fresh bankroll.
     *
     * @param amount New initial bankroll, or null for the configured default
     * @throws IllegalArgumentException if the amount is not positive
     */
    public BankrollSummary reset(BigDecimal amount) {
        BigDecimal initial = amount == null ? rules.initialBankroll() : amount;
        if (initial.signum() <= 0) {
            throw new IllegalArgumentException("Initial bankroll must be positive, got " + initial);
        }
        return projection.summarize(ledgerStore.replace(initial));
    }
}
