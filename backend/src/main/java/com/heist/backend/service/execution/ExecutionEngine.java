package com.heist.backend.service.execution;

import com.heist.backend.config.ExecutionProperties;
import com.heist.backend.dto.EngineStatistics;
import com.heist.backend.event.PositionClosedEvent;
import com.heist.backend.exception.CollaboratorException;
import com.heist.backend.model.Chain;
import com.heist.backend.model.ExitReason;
import com.heist.backend.model.Position;
import com.heist.backend.model.PositionSnapshot;
import com.heist.backend.model.TradeStatus;
import com.heist.backend.service.CollaboratorGuard;
import com.heist.backend.service.MetricsService;
import com.heist.backend.service.execution.TradeResult.FailureKind;
import com.heist.backend.util.MoneyUtils;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns every position from the buy request to the closed history.
 * <p>
 * The open map, in-flight buy count and closing set share one lock. Wallet calls are
 * made outside it, so a slot is reserved before a buy leaves the lock and a
 * position is flagged before its sell does.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private static final String WALLET = "wallet";

    private final ExecutionProperties properties;
    private final PositionSizingService sizingService;
    private final RiskGatekeeper riskGatekeeper;
    private final ExitPriorityEngine exitPriorityEngine;
    private final TradeStateMachine stateMachine;
    private final WalletPort walletPort;
    private final CollaboratorGuard collaboratorGuard;
    private final CircuitBreaker walletCircuitBreaker;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsService metricsService;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, Position> openPositions = new LinkedHashMap<>();
    private final Deque<PositionSnapshot> closedPositions = new ArrayDeque<>();
    private final Set<String> closing = new HashSet<>();
    private int pendingBuys;
    private long totalTrades;
    private long winningTrades;
    private long losingTrades;
    private long failedBuys;
    private long lateFills;
    private long unresolvedLateFills;
    private BigDecimal totalPnlUsd = MoneyUtils.ZERO;

    public ExecutionEngine(ExecutionProperties properties,
                           PositionSizingService sizingService,
                           RiskGatekeeper riskGatekeeper,
                           ExitPriorityEngine exitPriorityEngine,
                           TradeStateMachine stateMachine,
                           WalletPort walletPort,
                           CollaboratorGuard collaboratorGuard,
                           CircuitBreaker walletCircuitBreaker,
                           ApplicationEventPublisher eventPublisher,
                           MetricsService metricsService,
                           Clock clock) {
        if (!properties.isDryRun()) {
            throw new IllegalStateException("Live execution needs a signing wallet; set execution.dry-run=true");
        }
        this.properties = properties;
        this.sizingService = sizingService;
        this.riskGatekeeper = riskGatekeeper;
        this.exitPriorityEngine = exitPriorityEngine;
        this.stateMachine = stateMachine;
        this.walletPort = walletPort;
        this.collaboratorGuard = collaboratorGuard;
        this.walletCircuitBreaker = walletCircuitBreaker;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    @PostConstruct
    void registerGauges() {
        metricsService.registerGauge("positions_open", this::openCount);
        metricsService.registerGauge("buys_pending", () -> {
            synchronized (lock) {
                return pendingBuys;
            }
        });
    }

    /**
     * Opens a position. {@code amountUsd} may be null, in which case the sizing
     * service picks the amount.
     */
    public TradeResult buy(String address, String chain, String symbol, BigDecimal amountUsd) {
        int openAtReservation;
        synchronized (lock) {
            openAtReservation = openPositions.size();
            RiskGatekeeper.GuardDecision decision = riskGatekeeper.evaluate(openAtReservation + pendingBuys);
            if (!decision.allowed()) {
                return reject(FailureKind.CAPACITY, decision.reason());
            }
            if (address == null || address.isBlank()) {
                return reject(FailureKind.VALIDATION, "Missing token address");
            }
            if (Chain.fromTag(chain).isEmpty()) {
                return reject(FailureKind.VALIDATION, "Unsupported chain: " + chain);
            }
            pendingBuys++;
        }

        Chain target = Chain.fromTag(chain).orElseThrow();
        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .address(address)
                .chain(target.tag())
                .symbol(symbol == null || symbol.isBlank() ? "UNKNOWN" : symbol)
                .status(TradeStatus.PENDING)
                .build();
        try {
            BigDecimal balance = collaboratorGuard.call(WALLET, walletCircuitBreaker, walletPort::balanceUsd);
            BigDecimal amount = amountUsd != null
                    ? MoneyUtils.scale(amountUsd)
                    : sizingService.positionSize(balance, openAtReservation);
            // sized amounts may sit below the minimum once the open-position reduction applies
            boolean belowMinimum = amountUsd != null && amount.doubleValue() < sizingService.limits().minTradeUsd();
            if (amount.signum() <= 0 || belowMinimum) {
                stateMachine.transition(position, TradeStatus.CANCELLED, "amount below minimum");
                return reject(FailureKind.CAPACITY, "Trade amount $" + amount + " below minimum $"
                        + sizingService.limits().minTradeUsd());
            }
            if (amount.compareTo(balance) > 0) {
                stateMachine.transition(position, TradeStatus.CANCELLED, "insufficient balance");
                return reject(FailureKind.CAPACITY, "Insufficient balance $" + balance + " for $" + amount);
            }

            log.info("🎯 Executing BUY: {} on {} amount=${}", position.getSymbol(), target.tag(), amount);
            stateMachine.transition(position, TradeStatus.EXECUTING, "submitting buy");
            WalletPort.Fill fill = collaboratorGuard.call(WALLET, walletCircuitBreaker,
                    () -> walletPort.buy(address, target, amount), late -> unwindLateFill(position, target, late));

            PositionSnapshot snapshot;
            synchronized (lock) {
                position.setEntryTime(clock.instant());
                position.setEntryPrice(MoneyUtils.price(fill.price()));
                position.setEntryAmountUsd(amount);
                position.setTokenAmount(fill.tokenAmount());
                position.setEntryTxRef(fill.txRef());
                position.updatePrice(fill.price());
                stateMachine.transition(position, TradeStatus.OPEN, "buy filled");
                openPositions.put(position.getId(), position);
                totalTrades++;
                snapshot = position.snapshot();
            }
            sizingService.recordTradeOpened();
            metricsService.recordTradeOpened();
            log.info("✅ BUY executed: {} | Price: {} | Tokens: {} | tx={}",
                    snapshot.getSymbol(), snapshot.getEntryPrice().toPlainString(), snapshot.getTokenAmount(),
                    snapshot.getEntryTxRef());
            return TradeResult.success(snapshot, "Position opened");
        } catch (CollaboratorException e) {
            failBuy(position, FailureKind.TRANSIENT, e.getMessage());
            log.warn("❌ BUY failed for {}: {}", address, e.getMessage());
            return TradeResult.failure(FailureKind.TRANSIENT, position.snapshot(), e.getMessage());
        } catch (IllegalStateException e) {
            log.error("❌ BUY invariant broken for {}", address, e);
            failBuy(position, FailureKind.INVARIANT, e.getMessage());
            return TradeResult.failure(FailureKind.INVARIANT, position.snapshot(), e.getMessage());
        } finally {
            synchronized (lock) {
                pendingBuys--;
            }
        }
    }

    /**
     * Closes an open position. On a wallet failure the position stays open for the next tick.
     */
    public TradeResult sell(String positionId, ExitReason exitReason) {
        ExitReason reason = exitReason == null ? ExitReason.MANUAL : exitReason;
        Position position;
        synchronized (lock) {
            position = openPositions.get(positionId);
            if (position == null) {
                log.error("Sell requested for unknown position {}", positionId);
                return reject(FailureKind.INVARIANT, "Position " + positionId + " not found");
            }
            if (!closing.add(positionId)) {
                log.error("Sell requested for position {} already being closed", positionId);
                return reject(FailureKind.INVARIANT, "Position " + positionId + " is already closing");
            }
        }
        try {
            PositionSnapshot before;
            synchronized (lock) {
                before = position.snapshot();
            }
            log.info("🎯 Executing SELL: {} | Reason: {} | P&L: {}%", before.getSymbol(), reason, before.getPnlPct());
            WalletPort.Fill fill = collaboratorGuard.call(WALLET, walletCircuitBreaker, () -> walletPort.sell(before));

            PositionSnapshot closed;
            boolean win;
            synchronized (lock) {
                Instant now = clock.instant();
                position.setExitTime(now);
                position.setExitPrice(MoneyUtils.price(fill.price()));
                position.setExitAmountUsd(MoneyUtils.scale(fill.amountUsd()));
                position.setExitTxRef(fill.txRef());
                position.setExitReason(reason);
                position.setPnlUsd(MoneyUtils.subtract(fill.amountUsd(), position.getEntryAmountUsd()));
                position.setPnlPct(MoneyUtils.percentChange(fill.amountUsd(), position.getEntryAmountUsd()));
                stateMachine.transition(position, TradeStatus.CLOSED, reason.name());
                openPositions.remove(positionId);
                closed = position.snapshot();
                appendClosed(closed);
                win = closed.getPnlUsd().signum() > 0;
                if (win) {
                    winningTrades++;
                } else {
                    losingTrades++;
                }
                totalPnlUsd = MoneyUtils.add(totalPnlUsd, closed.getPnlUsd());
            }
            sizingService.recordTradeResult(closed.getPnlPct().doubleValue() / 100.0);
            metricsService.recordTradeClosed(reason.name(), win);
            log.info("✅ SELL executed: {} | P&L: ${} ({}%)", closed.getSymbol(), closed.getPnlUsd(), closed.getPnlPct());
            eventPublisher.publishEvent(new PositionClosedEvent(closed, closed.getExitTime()));
            return TradeResult.success(closed, "Position closed: " + reason);
        } catch (CollaboratorException e) {
            log.warn("❌ SELL failed for {}: {}", positionId, e.getMessage());
            metricsService.recordTradeRejected(FailureKind.TRANSIENT.name());
            return TradeResult.failure(FailureKind.TRANSIENT, snapshotOf(position), e.getMessage());
        } catch (IllegalStateException e) {
            log.error("❌ SELL invariant broken for {}", positionId, e);
            return TradeResult.failure(FailureKind.INVARIANT, snapshotOf(position), e.getMessage());
        } finally {
            synchronized (lock) {
                closing.remove(positionId);
            }
        }
    }

    /**
     * One monitoring pass: reprice every position that was open at the start of the
     * pass and close those whose exit rules fire. A failed quote skips that position only.
     */
    public MonitorSummary monitorPositions() {
        List<String> ids;
        synchronized (lock) {
            ids = new ArrayList<>(openPositions.keySet());
        }
        ExitPriorityEngine.ExitThresholds thresholds = exitPriorityEngine.thresholds();
        int evaluated = 0;
        int closed = 0;
        int failures = 0;
        for (String id : ids) {
            PositionSnapshot snapshot;
            synchronized (lock) {
                Position position = openPositions.get(id);
                if (position == null || closing.contains(id)) {
                    continue;
                }
                snapshot = position.snapshot();
            }
            BigDecimal price;
            try {
                price = collaboratorGuard.call("wallet-quote", walletCircuitBreaker, () -> walletPort.quote(snapshot));
            } catch (CollaboratorException e) {
                log.warn("Price update failed for {}: {}", id, e.getMessage());
                failures++;
                continue;
            }
            ExitPriorityEngine.ExitDecision decision;
            synchronized (lock) {
                Position position = openPositions.get(id);
                if (position == null || closing.contains(id)) {
                    continue;
                }
                position.updatePrice(price);
                decision = exitPriorityEngine.evaluate(position, clock.instant(), thresholds);
            }
            evaluated++;
            if (decision.shouldExit()) {
                log.info("🚪 Exit triggered for {}: {} ({})", id, decision.reason(), decision.reasonDetail());
                TradeResult result = sell(id, decision.reason());
                if (result.success()) {
                    closed++;
                } else {
                    failures++;
                }
            }
        }
        return new MonitorSummary(ids.size(), evaluated, closed, failures);
    }

    public List<PositionSnapshot> openPositions() {
        synchronized (lock) {
            return openPositions.values().stream().map(Position::snapshot).toList();
        }
    }

    public List<PositionSnapshot> closedPositions() {
        synchronized (lock) {
            return List.copyOf(closedPositions);
        }
    }

    public Optional<PositionSnapshot> position(String positionId) {
        synchronized (lock) {
            Position open = openPositions.get(positionId);
            if (open != null) {
                return Optional.of(open.snapshot());
            }
            return closedPositions.stream().filter(p -> p.getId().equals(positionId)).findFirst();
        }
    }

    public int openCount() {
        synchronized (lock) {
            return openPositions.size();
        }
    }

    public void resetDailyStats() {
        sizingService.resetDaily();
    }

    public EngineStatistics statistics() {
        BigDecimal balance = null;
        try {
            balance = collaboratorGuard.call(WALLET, walletCircuitBreaker, walletPort::balanceUsd);
        } catch (CollaboratorException e) {
            log.debug("Balance unavailable for statistics: {}", e.getMessage());
        }
        synchronized (lock) {
            long decided = winningTrades + losingTrades;
            return EngineStatistics.builder()
                    .totalTrades(totalTrades)
                    .winningTrades(winningTrades)
                    .losingTrades(losingTrades)
                    .winRatePct(decided > 0 ? winningTrades * 100.0 / decided : 0.0)
                    .totalPnlUsd(totalPnlUsd)
                    .openPositions(openPositions.size())
                    .closedPositions(closedPositions.size())
                    .pendingBuys(pendingBuys)
                    .failedBuys(failedBuys)
                    .lateFills(lateFills)
                    .unresolvedLateFills(unresolvedLateFills)
                    .walletBalanceUsd(balance)
                    .dryRun(properties.isDryRun())
                    .build();
        }
    }

    private void appendClosed(PositionSnapshot snapshot) {
        closedPositions.addLast(snapshot);
        while (closedPositions.size() > properties.getClosedHistoryLimit()) {
            closedPositions.removeFirst();
        }
    }

    private void failBuy(Position position, FailureKind kind, String reason) {
        synchronized (lock) {
            failedBuys++;
            if (position.getStatus().canTransitionTo(TradeStatus.FAILED)) {
                stateMachine.transition(position, TradeStatus.FAILED, reason);
            }
        }
        metricsService.recordTradeRejected(kind.name());
    }

    /**
     * A buy that timed out was already marked FAILED; when its fill still arrives the
     * tokens are sold straight back so the wallet matches the position book.
     */
    void unwindLateFill(Position position, Chain chain, WalletPort.Fill fill) {
        synchronized (lock) {
            lateFills++;
        }
        PositionSnapshot orphan = PositionSnapshot.builder()
                .id(position.getId())
                .address(position.getAddress())
                .chain(chain.tag())
                .symbol(position.getSymbol())
                .entryPrice(MoneyUtils.price(fill.price()))
                .currentPrice(MoneyUtils.price(fill.price()))
                .entryAmountUsd(MoneyUtils.scale(fill.amountUsd()))
                .tokenAmount(fill.tokenAmount())
                .entryTxRef(fill.txRef())
                .status(TradeStatus.FAILED)
                .build();
        log.warn("⚠️ Late fill for failed buy {} tx={}, selling {} tokens back",
                position.getId(), fill.txRef(), fill.tokenAmount());
        try {
            WalletPort.Fill unwind = collaboratorGuard.call(WALLET, walletCircuitBreaker, () -> walletPort.sell(orphan));
            log.info("↩️ Late fill unwound for {} tx={}", position.getId(), unwind.txRef());
        } catch (CollaboratorException e) {
            synchronized (lock) {
                unresolvedLateFills++;
            }
            log.error("❌ Late fill for {} could not be unwound, wallet holds {} tokens of {}: {}",
                    position.getId(), fill.tokenAmount(), position.getAddress(), e.getMessage());
        }
    }

    private PositionSnapshot snapshotOf(Position position) {
        synchronized (lock) {
            return position.snapshot();
        }
    }

    private TradeResult reject(FailureKind kind, String message) {
        log.warn("⚠️ Trade refused ({}): {}", kind, message);
        metricsService.recordTradeRejected(kind.name());
        return TradeResult.failure(kind, message);
    }

    public record MonitorSummary(int open, int evaluated, int closed, int failures) {
    }
}
