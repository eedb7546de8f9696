package com.evfinder.application.usecase;

import com.evfinder.application.state.RefreshState;
import com.evfinder.application.state.RefreshStats;
import com.evfinder.domain.model.MarketEvent;
import com.evfinder.domain.model.PlacementResult;
import com.evfinder.domain.model.ReferenceEvent;
import com.evfinder.domain.model.SettlementResult;
import com.evfinder.domain.model.ValueBet;
import com.evfinder.domain.ports.ReferenceOddsGateway;
import com.evfinder.domain.ports.TargetOddsGateway;
import com.evfinder.domain.service.ValueBetDetector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Use case for the full refresh cycle: fetch odds, detect value bets, settle and place bets.
 */
@Service
public class RefreshValueBetsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RefreshValueBetsUseCase.class);

    private final List<TargetOddsGateway> targetGateways;
    private final ReferenceOddsGateway referenceGateway;
    private final DetectValueBetsUseCase detectValueBets;
    private final SettleBetsUseCase settleBets;
    private final PlaceBetsUseCase placeBets;
    private final RefreshState state;
    private final DetectionSettings settings;
    private final ExecutorService fetchExecutor;
    private final ExecutorService refreshExecutor;

    public RefreshValueBetsUseCase(List<TargetOddsGateway> targetGateways, ReferenceOddsGateway referenceGateway,
                                   DetectValueBetsUseCase detectValueBets, SettleBetsUseCase settleBets,
                                   PlaceBetsUseCase placeBets, RefreshState state, DetectionSettings settings) {
        this.targetGateways = targetGateways;
        this.referenceGateway = referenceGateway;
        this.detectValueBets = detectValueBets;
        this.settleBets = settleBets;
        this.placeBets = placeBets;
        this.state = state;
        this.settings = settings;
        this.fetchExecutor = Executors.newFixedThreadPool(Math.max(targetGateways.size(), 2));
        this.refreshExecutor = Executors.newSingleThreadExecutor();
    }

    /**
     * Starts a refresh in the background.
     *
     * @return false if a refresh is already running or could not be scheduled
     */
    public boolean startAsync() {
        if (!state.tryBegin()) {
            return false;
        }
        try {
            refreshExecutor.submit(this::run);
        } catch (RejectedExecutionException e) {
            logger.error("Refresh could not be scheduled", e);
            state.fail("Refresh could not be scheduled");
            return false;
        }
        return true;
    }

    /**
     * Runs a refresh on the calling thread.
     *
     * @return false if a refresh is already running
     */
    public boolean execute() {
        if (!state.tryBegin()) {
            return false;
        }
        run();
        return true;
    }

    /**
     * Starts a background refresh when the last detected list is older than the cache duration.
     */
    public void refreshIfStale() {
        if (state.isStale(settings.cacheDuration())) {
            startAsync();
        }
    }

    @PreDestroy
    public void shutdown() {
        refreshExecutor.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    private void run() {
        try {
            state.log("Fetching target odds from " + targetGateways.size() + " providers...");
            state.progress(10);
            List<MarketEvent> targetEvents = fetchTargetEvents();
            state.log(targetEvents.size() + " target events fetched");
            state.progress(25);

            Map<String, List<MarketEvent>> bySport = new LinkedHashMap<>();
            for (MarketEvent event : targetEvents) {
                if (event.getSportKey() != null && !event.getSportKey().isBlank()) {
                    bySport.computeIfAbsent(event.getSportKey(), key -> new ArrayList<>()).add(event);
                }
            }

            List<ValueBet> detected = new ArrayList<>();
            int index = 0;
            for (Map.Entry<String, List<MarketEvent>> sport : bySport.entrySet()) {
                state.progress(25 + 60 * index / bySport.size());
                index++;
                detected.addAll(detectForSport(sport.getKey(), sport.getValue()));
            }

            state.progress(90);
            state.log("Sorting results...");
            detected.sort(Comparator.comparingDouble(ValueBet::evPercent).reversed());
            List<ValueBet> valueBets = ValueBetDetector.deduplicate(detected);

            state.progress(92);
            state.log("Checking pending bets...");
            settlePending();

            state.progress(95);
            state.log("Placing new bets (Kelly)...");
            placeNew(valueBets);

            state.complete(valueBets, stats(valueBets, targetEvents.size()));
            state.log("Done: " + valueBets.size() + " value bets found");
            logger.info("Refresh completed: {} value bets from {} target events", valueBets.size(), targetEvents.size());
        } catch (Exception e) {
            logger.error("Refresh failed", e);
            state.log("Error: " + e.getMessage());
            state.fail(String.valueOf(e.getMessage()));
        } finally {
            if (state.isLoading()) {
                logger.error("Refresh ended without completing");
                state.fail("Refresh ended unexpectedly");
            }
        }
    }

    private List<MarketEvent> fetchTargetEvents() {
        List<CompletableFuture<List<MarketEvent>>> futures = targetGateways.stream()
            .map(gateway -> CompletableFuture.supplyAsync(() -> fetchFrom(gateway), fetchExecutor))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<MarketEvent> events = new ArrayList<>();
        for (CompletableFuture<List<MarketEvent>> future : futures) {
            events.addAll(future.join());
        }
        return events;
    }

    private List<MarketEvent> fetchFrom(TargetOddsGateway gateway) {
        String providerName = gateway.getProviderName();
        try {
            List<MarketEvent> events = gateway.fetchTargetEvents();
            logger.info("Provider {} returned {} events", providerName, events.size());
            return events;
        } catch (Exception e) {
            logger.error("Provider {} failed", providerName, e);
            state.log(providerName + ": fetch failed (" + e.getMessage() + ")");
            return List.of();
        }
    }

    private List<ValueBet> detectForSport(String sportKey, List<MarketEvent> events) {
        String label = events.get(0).getSport() != null ? events.get(0).getSport() : sportKey;
        state.log("Comparing " + label + " (" + events.size() + " target events)...");
        try {
            List<ReferenceEvent> references = referenceGateway.fetchReferenceEvents(sportKey, settings.referenceMarkets());
            if (references == null || references.isEmpty()) {
                state.log(label + ": no reference data");
                return List.of();
            }
            state.log(label + ": " + references.size() + " reference events");

            List<ValueBet> valueBets = detectValueBets.execute(events, references);
            state.log(valueBets.isEmpty() ? label + ": no value bets" : label + ": " + valueBets.size() + " value bets");
            return valueBets;
        } catch (Exception e) {
            logger.warn("Detection failed for sport {}", sportKey, e);
            state.log(label + ": reference lookup failed (" + e.getMessage() + ")");
            return List.of();
        }
    }

    private void settlePending() {
        try {
            SettlementResult result = settleBets.execute(false);
            if (result.settled() > 0) {
                state.log(result.settled() + " bets settled");
            }
            if (result.stillPending() > 0) {
                state.log(result.stillPending() + " bets still pending");
            }
        } catch (Exception e) {
            logger.error("Settlement step failed", e);
            state.log("Settlement error: " + e.getMessage());
        }
    }

    private void placeNew(List<ValueBet> valueBets) {
        try {
            PlacementResult result = placeBets.execute(valueBets);
            state.log(result.placed() > 0 ? result.placed() + " new bets placed" : "No new bets to place");
        } catch (Exception e) {
            logger.error("Placement step failed", e);
            state.log("Placement error: " + e.getMessage());
        }
    }

    static RefreshStats stats(List<ValueBet> valueBets, int totalEvents) {
        Map<String, Integer> bySport = new LinkedHashMap<>();
        double evSum = 0;
        for (ValueBet valueBet : valueBets) {
            bySport.merge(valueBet.sport(), 1, Integer::sum);
            evSum += valueBet.evPercent();
        }

        double avgEv = valueBets.isEmpty() ? 0
            : BigDecimal.valueOf(evSum / valueBets.size()).setScale(2, RoundingMode.HALF_UP).doubleValue();

        String topSport = "-";
        int topCount = 0;
        for (Map.Entry<String, Integer> entry : bySport.entrySet()) {
            if (entry.getValue() > topCount) {
                topCount = entry.getValue();
                topSport = entry.getKey();
            }
        }
        return new RefreshStats(valueBets.size(), totalEvents, avgEv, Collections.unmodifiableMap(bySport), topSport);
    }
}
