package com.evfinder.application.usecase;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.domain.model.Bet;
import com.evfinder.domain.model.BetStatus;
import com.evfinder.domain.model.ManualSettlementResult;
import com.evfinder.domain.service.BankrollSummaryProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Use case for settling a bet by hand when no result source can.
 */
@Service
public class SettleBetManuallyUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SettleBetManuallyUseCase.class);

    private final LedgerStore ledgerStore;
    private final BankrollSummaryProjection projection;
    private final Clock clock;

    public SettleBetManuallyUseCase(LedgerStore ledgerStore, BankrollSummaryProjection projection, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.projection = projection;
        this.clock = clock;
    }

    /**
     * Settles one pending bet.
     *
     * @param betId  Id of the bet
     * @param result "won", "lost" or "void", any case
     * @param score  Optional final score, recorded as the result info
     * @return success with the updated summary, or a refusal explaining why nothing changed
     */
    public ManualSettlementResult execute(String betId, String result, String score) {
        BetStatus outcome = BetStatus.fromKey(result);
        if (outcome == null || !outcome.isTerminal()) {
            return ManualSettlementResult.refused("Invalid result '" + result + "': expected won, lost or void");
        }

        return ledgerStore.update(ledger -> {
            Optional<Bet> found = ledger.findBet(betId);
            if (found.isEmpty()) {
                return ManualSettlementResult.refused("Bet " + betId + " not found");
            }
            Bet bet = found.get();
            if (!bet.isPending()) {
                return ManualSettlementResult.refused("Bet " + betId + " already settled (" + bet.getStatus() + ")");
            }

            String resultInfo = score == null || score.isBlank() ? "manual" : score.trim();
            ledger.settle(bet, outcome, resultInfo, clock.instant());
            logger.info("Bet {} on {} settled manually as {}", betId, bet.matchLabel(), outcome);
            return new ManualSettlementResult(true, "Bet " + betId + " settled as " + outcome, projection.summarize(ledger));
        });
    }
}
