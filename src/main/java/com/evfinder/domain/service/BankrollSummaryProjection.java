package com.evfinder.domain.service;

import com.evfinder.domain.model.BankrollLedger;
import com.evfinder.domain.model.BankrollSummary;
import com.evfinder.domain.model.Bet;
import com.evfinder.domain.model.Money;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only statistics over a ledger snapshot.
 */
public class BankrollSummaryProjection {

    public static final int DEFAULT_RECENT_LIMIT = 50;

    private final int recentLimit;

    public BankrollSummaryProjection() {
        this(DEFAULT_RECENT_LIMIT);
    }

    public BankrollSummaryProjection(int recentLimit) {
        this.recentLimit = recentLimit;
    }

    public BankrollSummary summarize(BankrollLedger ledger) {
        List<Bet> bets = ledger.getBets();

        int pending = 0;
        int won = 0;
        int lost = 0;
        int voided = 0;
        List<Bet> settled = new ArrayList<>();
        for (Bet bet : bets) {
            switch (bet.getStatus()) {
                case PENDING -> pending++;
                case WON -> {
                    won++;
                    settled.add(bet);
                }
                case LOST -> {
                    lost++;
                    settled.add(bet);
                }
                case VOID -> voided++;
            }
        }

        BigDecimal totalProfit = Money.ZERO;
        BigDecimal settledStakes = Money.ZERO;
        for (Bet bet : settled) {
            totalProfit = totalProfit.add(Money.round(bet.getProfit()));
            settledStakes = settledStakes.add(Money.round(bet.getStake()));
        }

        double winRate = settled.isEmpty() ? 0 : percent(won, settled.size());
        double roi = settledStakes.signum() > 0
            ? totalProfit.multiply(BigDecimal.valueOf(100)).divide(settledStakes, 1, RoundingMode.HALF_UP).doubleValue()
            : 0;

        return new BankrollSummary(
            ledger.getInitialBankroll(),
            ledger.getCurrentBankroll(),
            ledger.getTotalStaked(),
            Money.round(ledger.getTotalReturned()),
            Money.round(totalProfit),
            bets.size(),
            pending,
            won,
            lost,
            voided,
            winRate,
            roi,
            profitHistory(settled, ledger.getInitialBankroll()),
            recentBets(bets),
            ledger.getCreatedAt()
        );
    }

    private List<BankrollSummary.ProfitPoint> profitHistory(List<Bet> settled, BigDecimal initialBankroll) {
        List<Bet> ordered = new ArrayList<>(settled);
        ordered.sort(Comparator.comparing(Bet::getSettledAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));

        List<BankrollSummary.ProfitPoint> history = new ArrayList<>();
        BigDecimal cumulative = Money.ZERO;
        for (Bet bet : ordered) {
            cumulative = Money.round(cumulative.add(Money.round(bet.getProfit())));
            history.add(new BankrollSummary.ProfitPoint(
                bet.getSettledAt(),
                cumulative,
                Money.round(Money.round(initialBankroll).add(cumulative)),
                bet.getBetId()
            ));
        }
        return history;
    }

    private List<Bet> recentBets(List<Bet> bets) {
        return bets.stream()
            .sorted(Comparator.comparing(Bet::getPlacedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
            .limit(recentLimit)
            .toList();
    }

    private static double percent(int part, int whole) {
        return BigDecimal.valueOf(part * 100L)
            .divide(BigDecimal.valueOf(whole), 1, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
