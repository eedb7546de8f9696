package com.evfinder.application.usecase;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.domain.model.BankrollLedger;
import com.evfinder.domain.model.Bet;
import com.evfinder.domain.model.BetReport;
import com.evfinder.domain.model.BetStatus;
import com.evfinder.domain.model.MatchResult;
import com.evfinder.domain.model.ResultStatus;
import com.evfinder.domain.model.SettlementResult;
import com.evfinder.domain.ports.MatchResultResolver;
import com.evfinder.domain.service.BetResultEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Use case for settling pending bets from match results.
 *
 * Results are looked up against a ledger snapshot without holding the ledger lock; the outcomes
 * are then applied in one write, only to bets that are still pending at that point.
 */
@Service
public class SettleBetsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SettleBetsUseCase.class);

    private static final int MAX_ERROR_LENGTH = 60;

    private final LedgerStore ledgerStore;
    private final MatchResultResolver resultResolver;
    private final BetResultEvaluator evaluator;
    private final SettlementSettings settings;
    private final Clock clock;

    public SettleBetsUseCase(LedgerStore ledgerStore, MatchResultResolver resultResolver,
                             BetResultEvaluator evaluator, SettlementSettings settings, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.resultResolver = resultResolver;
        this.evaluator = evaluator;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Checks every pending bet and settles those with a usable result.
     *
     * @param force When true, a report is returned for each bet examined
     * @return Settled bets, the number still pending and, in force mode, per-bet reports
     */
    public SettlementResult execute(boolean force) {
        Instant now = clock.instant();
        List<Verdict> verdicts = new ArrayList<>();
        for (Bet bet : ledgerStore.snapshot().pendingBets()) {
            verdicts.add(examine(bet, now));
        }

        if (verdicts.isEmpty()) {
            return new SettlementResult(0, 0, List.of(), List.of());
        }

        SettlementResult result = ledgerStore.update(ledger -> apply(ledger, verdicts, now, force));
        if (result.settled() > 0 || result.stillPending() > 0) {
            logger.info("Settlement finished: {} settled, {} still pending", result.settled(), result.stillPending());
        }
        return result;
    }

    private Verdict examine(Bet bet, Instant now) {
        Instant start = bet.getStartTime();
        if (start != null && start.isAfter(now)) {
            Duration remaining = Duration.between(now, start);
            return Verdict.pending(bet, "not_started",
                String.format("Kick-off in %dh%02d", remaining.toHours(), remaining.toMinutesPart()));
        }
        if (start != null && start.isAfter(now.minus(settings.inProgressWindow()))) {
            return Verdict.pending(bet, "in_progress",
                "Match in progress (" + Duration.between(start, now).toMinutes() + " min)");
        }

        MatchResult result;
        try {
            result = resultResolver.resolve(bet.getMatchId(), bet.getHome(), bet.getAway(), start, bet.getSport());
        } catch (Exception e) {
            logger.warn("Result lookup failed for bet {} ({}): {}", bet.getBetId(), bet.matchLabel(), e.getMessage());
            return Verdict.pending(bet, "error", "Lookup failed: " + abbreviate(String.valueOf(e.getMessage())));
        }

        if (result == null) {
            return Verdict.pending(bet, "no_result", "Result not available yet");
        }
        if (result.status() == ResultStatus.LIVE) {
            return Verdict.pending(bet, "in_progress", "Match in progress");
        }
        if (result.status() == ResultStatus.CANCELLED) {
            return Verdict.settle(bet, BetStatus.VOID, "cancelled");
        }

        return switch (evaluator.evaluate(bet, result)) {
            case WON -> Verdict.settle(bet, BetStatus.WON, result.score());
            case LOST -> Verdict.settle(bet, BetStatus.LOST, result.score());
            case INDETERMINATE -> Verdict.pending(bet, "no_result", "Score not available to settle this market");
        };
    }

    private SettlementResult apply(BankrollLedger ledger, List<Verdict> verdicts, Instant now, boolean force) {
        List<Bet> settled = new ArrayList<>();
        List<BetReport> reports = new ArrayList<>();
        int stillPending = 0;

        for (Verdict verdict : verdicts) {
            if (verdict.outcome() == null) {
                stillPending++;
                if (force) {
                    reports.add(report(verdict.bet(), verdict.reason(), verdict.message()));
                }
                continue;
            }

            // The bet may have been settled by someone else while results were looked up
            Optional<Bet> current = ledger.findBet(verdict.bet().getBetId()).filter(Bet::isPending);
            if (current.isEmpty()) {
                continue;
            }

            Bet bet = current.get();
            ledger.settle(bet, verdict.outcome(), verdict.resultInfo(), now);
            settled.add(bet);
            logger.info("Bet {} on {} settled as {} ({})", bet.getBetId(), bet.matchLabel(), bet.getStatus(),
                bet.getResultInfo());
            if (force) {
                reports.add(report(bet, bet.getStatus().getKey(), settledMessage(bet)));
            }
        }

        return new SettlementResult(settled.size(), stillPending, settled, reports);
    }

    private static String settledMessage(Bet bet) {
        return switch (bet.getStatus()) {
            case WON -> "Won. Score: " + bet.getResultInfo() + ", +" + bet.getProfit();
            case LOST -> "Lost. Score: " + bet.getResultInfo() + ", " + bet.getProfit();
            default -> "Match cancelled, stake refunded";
        };
    }

    private static BetReport report(Bet bet, String reason, String message) {
        return new BetReport(bet.getBetId(), bet.matchLabel(), bet.getBetOn(), reason, message);
    }

    private static String abbreviate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    /**
     * Decision taken for one bet outside the lock. A null outcome means the bet stays pending.
     */
    private record Verdict(Bet bet, BetStatus outcome, String resultInfo, String reason, String message) {

        static Verdict pending(Bet bet, String reason, String message) {
            return new Verdict(bet, null, null, reason, message);
        }

        static Verdict settle(Bet bet, BetStatus outcome, String resultInfo) {
            return new Verdict(bet, outcome, resultInfo, null, null);
        }
    }
}
