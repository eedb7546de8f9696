package com.evfinder.application.usecase;

import com.evfinder.domain.model.MarketEvent;
import com.evfinder.domain.model.ReferenceEvent;
import com.evfinder.domain.model.ValueBet;
import com.evfinder.domain.service.ValueBetDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Use case for comparing target prices with the reference consensus.
 */
@Service
public class DetectValueBetsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(DetectValueBetsUseCase.class);

    private final ValueBetDetector detector;
    private final DetectionSettings settings;

    public DetectValueBetsUseCase(ValueBetDetector detector, DetectionSettings settings) {
        this.detector = detector;
        this.settings = settings;
    }

    /**
     * Detects value bets above the configured EV threshold.
     *
     * @param targets    Target bookmaker events
     * @param references Reference events for the same sport
     * @return Value bets sorted by EV descending
     */
    public List<ValueBet> execute(List<? extends MarketEvent> targets, List<ReferenceEvent> references) {
        return execute(targets, references, settings.minEvThreshold());
    }

    public List<ValueBet> execute(List<? extends MarketEvent> targets, List<ReferenceEvent> references, double minEv) {
        List<ValueBet> valueBets = detector.detect(targets, references, minEv);
        logger.debug("Detected {} value bets from {} target and {} reference events",
            valueBets.size(), targets.size(), references.size());
        return valueBets;
    }
}
