package com.evfinder.application.usecase;

import com.evfinder.application.state.LedgerStore;
import com.evfinder.domain.model.BankrollLedger;
import com.evfinder.domain.model.Bet;
import com.evfinder.domain.model.KellySizing;
import com.evfinder.domain.model.PlacementResult;
import com.evfinder.domain.model.ValueBet;
import com.evfinder.domain.service.KellyCalculator;
import com.evfinder.domain.service.StakingRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Use case for staking detected value bets on the virtual bankroll.
 */
@Service
public class PlaceBetsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(PlaceBetsUseCase.class);

    private final LedgerStore ledgerStore;
    private final KellyCalculator kellyCalculator;
    private final StakingRules rules;
    private final Clock clock;

    public PlaceBetsUseCase(LedgerStore ledgerStore, KellyCalculator kellyCalculator, StakingRules rules, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.kellyCalculator = kellyCalculator;
        this.rules = rules;
        this.clock = clock;
    }

    /**
     * Places a pending bet for each eligible candidate.
     *
     * A candidate is skipped when it has no match id, was already bet on (same match, selection and
     * market), falls short of the EV or bookmaker-count minimums, or sizes to no stake. Stakes are
     * computed against the bankroll as it was at the start of the batch.
     *
     * @param candidates Value bets, usually sorted by EV descending
     * @return Counts and the bets placed
     */
    public PlacementResult execute(List<ValueBet> candidates) {
        if (!rules.autoBet()) {
            logger.info("Auto-bet disabled, {} candidates ignored", candidates.size());
            return PlacementResult.allSkipped(candidates.size());
        }
        if (candidates.isEmpty()) {
            return PlacementResult.allSkipped(0);
        }

        PlacementResult result = ledgerStore.update(ledger -> placeAll(ledger, candidates));
        logger.info("Placement finished: {} placed, {} skipped", result.placed(), result.skipped());
        return result;
    }

    private PlacementResult placeAll(BankrollLedger ledger, List<ValueBet> candidates) {
        Set<ValueBet.PlacementKey> taken = ledger.placementKeys();
        BigDecimal batchBankroll = ledger.getCurrentBankroll();

        List<Bet> placed = new ArrayList<>();
        int skipped = 0;

        for (ValueBet candidate : candidates) {
            try {
                if (candidate.matchId() == null || candidate.matchId().isBlank()) {
                    skipped++;
                    continue;
                }
                ValueBet.PlacementKey key = candidate.placementKey();
                if (taken.contains(key)) {
                    skipped++;
                    continue;
                }
                if (candidate.evPercent() < rules.minEvToBet() || candidate.numBooks() < rules.minBooksToBet()) {
                    skipped++;
                    continue;
                }

                KellySizing sizing = kellyCalculator.size(candidate.targetOdds(), candidate.fairProbPct(), batchBankroll);
                if (!sizing.hasStake() || sizing.stake().compareTo(ledger.getCurrentBankroll()) > 0) {
                    skipped++;
                    continue;
                }

                Bet bet = Bet.pending(newBetId(), clock.instant(), candidate, sizing);
                ledger.addPendingBet(bet);
                taken.add(key);
                placed.add(bet);
                logger.info("Placed bet {} on {} ({}) @ {} stake {}",
                    bet.getBetId(), bet.matchLabel(), bet.getBetOn(), bet.getTargetOdds(), bet.getStake());
            } catch (RuntimeException e) {
                logger.warn("Skipping candidate {}: {}", candidate.detectionKey(), e.getMessage());
                skipped++;
            }
        }

        return new PlacementResult(placed.size(), skipped, placed);
    }

    private static String newBetId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
