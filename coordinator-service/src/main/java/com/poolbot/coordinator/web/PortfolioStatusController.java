package com.poolbot.coordinator.web;

import com.poolbot.portfolio.manager.PortfolioManager;
import com.poolbot.portfolio.model.AllocationEvent;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.PortfolioHealth;
import com.poolbot.portfolio.model.PortfolioSummary;
import com.poolbot.portfolio.model.RiskMetrics;
import com.poolbot.portfolio.sync.HeartbeatInfo;
import com.poolbot.portfolio.sync.SyncStats;
import com.poolbot.portfolio.sync.SynchronizationManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Status of the shared pool as seen by this process, plus the endpoints its bot reports through.
 */
@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
@Slf4j
public class PortfolioStatusController {

    private final @NonNull PortfolioManager portfolio;
    private final @NonNull SynchronizationManager sync;

    @GetMapping("/health")
    public ResponseEntity<PortfolioHealth> health() {
        return ResponseEntity.ok(portfolio.getPortfolioHealth());
    }

    @GetMapping("/summary")
    public ResponseEntity<PortfolioSummary> summary() {
        return ResponseEntity.ok(portfolio.getSummary());
    }

    @GetMapping("/risk")
    public ResponseEntity<RiskMetrics> risk() {
        return ResponseEntity.ok(portfolio.getRiskMetrics());
    }

    @GetMapping("/allocations")
    public ResponseEntity<Map<String, BotAllocation>> allocations() {
        return ResponseEntity.ok(portfolio.getAllAllocations());
    }

    @GetMapping("/allocations/{botId}")
    public ResponseEntity<BotAllocation> allocation(@PathVariable String botId) {
        return ResponseEntity.ok(portfolio.getBotAllocation(botId));
    }

    @GetMapping("/history")
    public ResponseEntity<List<AllocationEvent>> history(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(portfolio.getHistory(limit));
    }

    @GetMapping("/sync")
    public ResponseEntity<SyncStatusResponse> syncStatus() {
        return ResponseEntity.ok(new SyncStatusResponse(
                sync.botId(),
                sync.isRunning(),
                sync.isHealthy(),
                sync.getSyncStats(),
                sync.getActiveHeartbeats()
        ));
    }

    /**
     * Report this bot's position. Goes through the risk checks before it is applied.
     */
    @PostMapping("/position")
    public ResponseEntity<BotAllocation> position(@Valid @RequestBody PositionRequest request) {
        BotAllocation updated = portfolio.updatePosition(sync.botId(), request.positionValue(),
                request.averagePrice(), request.leverage());
        log.info("Position reported for {}: value={}, leverage={}x", sync.botId(),
                request.positionValue().toPlainString(), request.leverage());
        return ResponseEntity.ok(updated);
    }

    @PostMapping("/position/close")
    public ResponseEntity<BotAllocation> closePosition() {
        return ResponseEntity.ok(portfolio.closePosition(sync.botId()));
    }

    /**
     * Book realized profit for this bot. Sharing follows the pool policy unless the request says otherwise.
     */
    @PostMapping("/profit")
    public ResponseEntity<BotAllocation> profit(@Valid @RequestBody ProfitRequest request) {
        boolean share = request.shareProfit() == null ? portfolio.config().profitSharingEnabled() : request.shareProfit();
        return ResponseEntity.ok(sync.recordProfit(request.profit(), share));
    }

    @PostMapping("/rebalance")
    public ResponseEntity<RebalanceResponse> rebalance() {
        return ResponseEntity.ok(new RebalanceResponse(sync.triggerRebalance()));
    }

    public record PositionRequest(
            @NotNull @Positive BigDecimal positionValue,
            @PositiveOrZero BigDecimal averagePrice,
            @Positive double leverage
    ) {
    }

    public record ProfitRequest(
            @NotNull BigDecimal profit,
            Boolean shareProfit
    ) {
    }

    public record RebalanceResponse(
            int adjustments
    ) {
    }

    public record SyncStatusResponse(
            String botId,
            boolean running,
            boolean healthy,
            SyncStats stats,
            Map<String, HeartbeatInfo> heartbeats
    ) {
    }
}
