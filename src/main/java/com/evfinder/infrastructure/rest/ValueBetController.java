package com.evfinder.infrastructure.rest;

import com.evfinder.application.state.RefreshState;
import com.evfinder.application.state.RefreshStats;
import com.evfinder.application.state.RefreshStatus;
import com.evfinder.application.usecase.ListValueBetsUseCase;
import com.evfinder.application.usecase.RefreshValueBetsUseCase;
import com.evfinder.application.usecase.ValueBetFilter;
import com.evfinder.domain.model.ValueBet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for value bets and the refresh cycle.
 */
@RestController
@RequestMapping("/api")
public class ValueBetController {

    private static final Logger logger = LoggerFactory.getLogger(ValueBetController.class);

    private final ListValueBetsUseCase listValueBets;
    private final RefreshValueBetsUseCase refreshValueBets;
    private final RefreshState refreshState;

    public ValueBetController(ListValueBetsUseCase listValueBets, RefreshValueBetsUseCase refreshValueBets,
                              RefreshState refreshState) {
        this.listValueBets = listValueBets;
        this.refreshValueBets = refreshValueBets;
        this.refreshState = refreshState;
    }

    /**
     * GET /api/valuebets?sport=&min_ev=&min_odds=&max_odds=
     *
     * @return The filtered value bets with the refresh status
     */
    @GetMapping("/valuebets")
    public ValueBetsResponse valueBets(
            @RequestParam(name = "sport", required = false) String sport,
            @RequestParam(name = "min_ev", required = false) Double minEv,
            @RequestParam(name = "min_odds", required = false) Double minOdds,
            @RequestParam(name = "max_odds", required = false) Double maxOdds) {
        List<ValueBet> bets = listValueBets.execute(new ValueBetFilter(sport, minEv, minOdds, maxOdds));
        RefreshState.Snapshot status = refreshState.snapshot();
        return new ValueBetsResponse(bets, status.status(), status.lastUpdate(), status.error(), status.stats(),
            status.logs(), status.progress());
    }

    /**
     * POST /api/refresh
     *
     * @return 202 when a refresh was started, 409 when one is already running,
     *         503 when it could not be scheduled
     */
    @PostMapping("/refresh")
    public ResponseEntity<Map<String, String>> refresh() {
        if (!refreshValueBets.startAsync()) {
            if (!refreshState.isLoading()) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("message", "Refresh could not be started"));
            }
            logger.info("Refresh requested while one is already running");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", "Refresh already running"));
        }
        return ResponseEntity.accepted().body(Map.of("message", "Refresh started"));
    }

    /**
     * GET /api/status
     */
    @GetMapping("/status")
    public RefreshState.Snapshot status() {
        return refreshState.snapshot();
    }

    public record ValueBetsResponse(
        List<ValueBet> bets,
        RefreshStatus status,
        Instant lastUpdate,
        String error,
        RefreshStats stats,
        List<RefreshState.LogEntry> logs,
        int progress
    ) {
    }
}
