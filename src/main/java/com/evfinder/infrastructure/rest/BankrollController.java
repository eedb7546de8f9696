package com.evfinder.infrastructure.rest;

import com.evfinder.application.usecase.BankrollSummaryUseCase;
import com.evfinder.application.usecase.SettleBetManuallyUseCase;
import com.evfinder.application.usecase.SettleBetsUseCase;
import com.evfinder.domain.model.BankrollSummary;
import com.evfinder.domain.model.ManualSettlementResult;
import com.evfinder.domain.model.SettlementResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

/**
 * REST controller for the virtual bankroll.
 */
@RestController
@RequestMapping("/api/bankroll")
public class BankrollController {

    private static final Logger logger = LoggerFactory.getLogger(BankrollController.class);

    private final BankrollSummaryUseCase bankrollSummary;
    private final SettleBetsUseCase settleBets;
    private final SettleBetManuallyUseCase settleBetManually;

    public BankrollController(BankrollSummaryUseCase bankrollSummary, SettleBetsUseCase settleBets,
                              SettleBetManuallyUseCase settleBetManually) {
        this.bankrollSummary = bankrollSummary;
        this.settleBets = settleBets;
        this.settleBetManually = settleBetManually;
    }

    @GetMapping
    public BankrollSummary summary() {
        return bankrollSummary.getSummary();
    }

    /**
     * POST /api/bankroll/settle
     *
     * Checks every pending bet now and reports what happened to each one.
     */
    @PostMapping("/settle")
    public SettlementResult settle() {
        logger.info("Received request to settle pending bets");
        return settleBets.execute(true);
    }

    /**
     * POST /api/bankroll/settle-manual with {"bet_id": ..., "result": "won|lost|void", "score": ...}
     */
    @PostMapping("/settle-manual")
    public ResponseEntity<ManualSettlementResult> settleManual(@RequestBody(required = false) ManualSettlementRequest request) {
        if (request == null || isBlank(request.betId()) || isBlank(request.result())) {
            return ResponseEntity.badRequest().body(ManualSettlementResult.refused("bet_id and result are required"));
        }
        return ResponseEntity.ok(settleBetManually.execute(request.betId(), request.result(), request.score()));
    }

    /**
     * POST /api/bankroll/reset with an optional {"amount": ...}
     */
    @PostMapping("/reset")
    public ResetResponse reset(@RequestBody(required = false) ResetRequest request) {
        BigDecimal amount = request == null ? null : request.amount();
        logger.info("Resetting bankroll (amount: {})", amount == null ? "default" : amount);
        return new ResetResponse("Bankroll reset", bankrollSummary.reset(amount));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record ManualSettlementRequest(String betId, String result, String score) {
    }

    public record ResetRequest(BigDecimal amount) {
    }

    public record ResetResponse(String message, BankrollSummary summary) {
    }
}
