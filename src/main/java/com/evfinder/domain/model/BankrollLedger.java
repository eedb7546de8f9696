package com.evfinder.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Virtual bankroll and every bet placed against it.
 *
 * All bankroll movements go through {@link #addPendingBet} and {@link #settle}: one debit at
 * placement, at most one credit at settlement. Instances are loaded fresh for each mutation
 * and are never shared between threads.
 */
public class BankrollLedger {

    private BigDecimal initialBankroll;
    private BigDecimal currentBankroll;
    private BigDecimal totalStaked = Money.ZERO;
    private BigDecimal totalReturned = Money.ZERO;
    private Instant createdAt;
    private Instant lastUpdated;
    private List<Bet> bets = new ArrayList<>();

    private boolean modified;

    /**
     * Creates an empty ledger holding {@code initialBankroll}.
     */
    public static BankrollLedger fresh(BigDecimal initialBankroll, Instant now) {
        BankrollLedger ledger = new BankrollLedger();
        ledger.initialBankroll = Money.round(initialBankroll);
        ledger.currentBankroll = Money.round(initialBankroll);
        ledger.totalStaked = Money.ZERO;
        ledger.totalReturned = Money.ZERO;
        ledger.createdAt = now;
        ledger.lastUpdated = now;
        return ledger;
    }

    public Optional<Bet> findBet(String betId) {
        if (betId == null) {
            return Optional.empty();
        }
        return bets.stream().filter(bet -> betId.equals(bet.getBetId())).findFirst();
    }

    /** Placement keys (match id, selection, market) of every bet, settled or not. */
    public Set<ValueBet.PlacementKey> placementKeys() {
        Set<ValueBet.PlacementKey> keys = new LinkedHashSet<>();
        for (Bet bet : bets) {
            keys.add(bet.placementKey());
        }
        return keys;
    }

    public List<Bet> pendingBets() {
        return bets.stream().filter(Bet::isPending).toList();
    }

    /**
     * Appends a pending bet and debits its stake from the bankroll.
     */
    public void addPendingBet(Bet bet) {
        if (bet.getStatus() != BetStatus.PENDING) {
            throw new IllegalArgumentException("Only pending bets can be placed, got " + bet.getStatus());
        }
        if (bet.getStake() == null || bet.getStake().signum() <= 0) {
            throw new IllegalArgumentException("Bet " + bet.getBetId() + " has no stake");
        }
        bets.add(bet);
        currentBankroll = Money.round(currentBankroll.subtract(bet.getStake()));
        totalStaked = Money.round(totalStaked.add(bet.getStake()));
        modified = true;
    }

    /**
     * Moves a pending bet of this ledger to a terminal state and applies the matching credit.
     * Won: payout credited to bankroll and total returned. Void: stake refunded. Lost: nothing.
     *
     * @return false when the bet is no longer pending (nothing changes)
     */
    public boolean settle(Bet bet, BetStatus outcome, String resultInfo, Instant settledAt) {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("Settlement outcome must be won, lost or void");
        }
        if (!bets.contains(bet)) {
            throw new IllegalArgumentException("Bet " + bet.getBetId() + " does not belong to this ledger");
        }
        if (!bet.isPending()) {
            return false;
        }

        BigDecimal stake = bet.getStake();
        switch (outcome) {
            case WON -> {
                BigDecimal payout = Money.payout(stake, bet.getTargetOdds());
                bet.setProfit(Money.round(payout.subtract(stake)));
                currentBankroll = Money.round(currentBankroll.add(payout));
                totalReturned = Money.round(totalReturned.add(payout));
            }
            case LOST -> bet.setProfit(Money.round(stake.negate()));
            case VOID -> {
                bet.setProfit(Money.ZERO);
                currentBankroll = Money.round(currentBankroll.add(stake));
            }
            default -> throw new IllegalStateException("Unexpected outcome " + outcome);
        }
        bet.setStatus(outcome);
        bet.setSettledAt(settledAt);
        bet.setResultInfo(resultInfo);
        modified = true;
        return true;
    }

    /** True once any mutation happened since this instance was loaded. */
    @JsonIgnore
    public boolean isModified() {
        return modified;
    }

    public BigDecimal getInitialBankroll() {
        return initialBankroll;
    }

    public void setInitialBankroll(BigDecimal initialBankroll) {
        this.initialBankroll = initialBankroll;
    }

    public BigDecimal getCurrentBankroll() {
        return currentBankroll;
    }

    public void setCurrentBankroll(BigDecimal currentBankroll) {
        this.currentBankroll = currentBankroll;
    }

    public BigDecimal getTotalStaked() {
        return totalStaked;
    }

    public void setTotalStaked(BigDecimal totalStaked) {
        this.totalStaked = totalStaked;
    }

    public BigDecimal getTotalReturned() {
        return totalReturned;
    }

    public void setTotalReturned(BigDecimal totalReturned) {
        this.totalReturned = totalReturned;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public List<Bet> getBets() {
        return bets;
    }

    public void setBets(List<Bet> bets) {
        this.bets = bets == null ? new ArrayList<>() : bets;
    }
}
