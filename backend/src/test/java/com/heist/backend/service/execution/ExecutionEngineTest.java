package com.heist.backend.service.execution;

import com.heist.backend.config.ExecutionProperties;
import com.heist.backend.dto.EngineStatistics;
import com.heist.backend.event.PositionClosedEvent;
import com.heist.backend.model.Chain;
import com.heist.backend.model.ExitReason;
import com.heist.backend.model.PositionSnapshot;
import com.heist.backend.model.TradeStatus;
import com.heist.backend.service.CollaboratorGuard;
import com.heist.backend.service.MetricsService;
import com.heist.backend.util.MoneyUtils;
import com.heist.backend.util.MutableClock;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionEngineTest {

    private static final String ETH = "0x6982508145454Ce325dDbE47a25d4ec3d2311933";

    private final List<Object> events = new ArrayList<>();
    private ExecutionProperties properties;
    private FakeWallet wallet;
    private MutableClock clock;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new ExecutionProperties();
        wallet = new FakeWallet();
        clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
        engine = engine(properties);
    }

    @Test
    void buyOpensPosition() {
        TradeResult result = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100"));

        assertThat(result.success()).isTrue();
        PositionSnapshot position = result.position();
        assertThat(position.getStatus()).isEqualTo(TradeStatus.OPEN);
        assertThat(position.getEntryAmountUsd()).isEqualByComparingTo("100");
        assertThat(position.getTokenAmount()).isEqualByComparingTo("100");
        assertThat(position.getEntryTime()).isEqualTo(clock.instant());
        assertThat(engine.openCount()).isEqualTo(1);
        assertThat(engine.position(position.getId())).isPresent();
    }

    @Test
    void sizingPicksAmountWhenNoneGiven() {
        TradeResult result = engine.buy(ETH, "ethereum", null, null);

        assertThat(result.position().getEntryAmountUsd()).isEqualByComparingTo("150");
        assertThat(result.position().getSymbol()).isEqualTo("UNKNOWN");
    }

    @Test
    void refusesBuyAtPositionCeilingWithoutSideEffects() {
        for (int i = 0; i < 4; i++) {
            assertThat(engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("50")).success()).isTrue();
        }

        TradeResult fifth = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("50"));

        assertThat(fifth.success()).isFalse();
        assertThat(fifth.failureKind()).isEqualTo(TradeResult.FailureKind.CAPACITY);
        assertThat(engine.openCount()).isEqualTo(4);
        assertThat(wallet.buys.get()).isEqualTo(4);
        assertThat(engine.statistics().getTotalTrades()).isEqualTo(4);
    }

    @Test
    void sizedBuyBelowMinimumStillTradesOnSmallWallet() {
        wallet.setBalance("30");

        TradeResult first = engine.buy(ETH, "ethereum", "A", null);
        TradeResult second = engine.buy(ETH, "ethereum", "B", null);

        assertThat(first.position().getEntryAmountUsd()).isEqualByComparingTo("5");
        assertThat(second.success()).isTrue();
        assertThat(second.position().getEntryAmountUsd()).isEqualByComparingTo("4.5");
        assertThat(engine.openCount()).isEqualTo(2);
    }

    @Test
    void concurrentBuysNeverOvershootTheCeiling() throws Exception {
        wallet.buyGate = new CountDownLatch(1);
        ExecutorService callers = Executors.newFixedThreadPool(10);
        try {
            List<Future<TradeResult>> results = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                results.add(callers.submit(() -> engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("50"))));
            }
            assertThat(wallet.buyEntered.tryAcquire(4, 5, TimeUnit.SECONDS)).isTrue();
            wallet.buyGate.countDown();

            int opened = 0;
            for (Future<TradeResult> result : results) {
                if (result.get(5, TimeUnit.SECONDS).success()) {
                    opened++;
                }
            }

            assertThat(opened).isEqualTo(4);
            assertThat(engine.openCount()).isEqualTo(4);
            assertThat(wallet.buys.get()).isEqualTo(4);
            assertThat(engine.statistics().getPendingBuys()).isZero();
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void secondSellOfAClosingPositionIsAnInvariantFailure() throws Exception {
        String id = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100")).position().getId();
        wallet.sellGate = new CountDownLatch(1);
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            Future<TradeResult> first = caller.submit(() -> engine.sell(id, ExitReason.MANUAL));
            assertThat(wallet.sellEntered.tryAcquire(5, TimeUnit.SECONDS)).isTrue();

            TradeResult second = engine.sell(id, ExitReason.STOP_LOSS);
            wallet.sellGate.countDown();

            assertThat(second.success()).isFalse();
            assertThat(second.failureKind()).isEqualTo(TradeResult.FailureKind.INVARIANT);
            assertThat(first.get(5, TimeUnit.SECONDS).success()).isTrue();
            assertThat(engine.closedPositions()).extracting(PositionSnapshot::getExitReason)
                    .containsExactly(ExitReason.MANUAL);
            assertThat(wallet.sells.get()).isEqualTo(1);
        } finally {
            caller.shutdownNow();
        }
    }

    @Test
    void lateFillAfterTimeoutIsSoldBack() throws Exception {
        ExecutorService pool = Executors.newCachedThreadPool();
        try {
            MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
            engine = engine(properties, new CollaboratorGuard(TimeLimiter.of(Duration.ofMillis(100)), pool, metricsService));
            wallet.buyGate = new CountDownLatch(1);

            TradeResult result = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100"));
            assertThat(result.failureKind()).isEqualTo(TradeResult.FailureKind.TRANSIENT);
            assertThat(result.position().getStatus()).isEqualTo(TradeStatus.FAILED);

            wallet.buyGate.countDown();
            assertThat(wallet.sellDone.tryAcquire(5, TimeUnit.SECONDS)).isTrue();

            assertThat(wallet.buys.get()).isEqualTo(1);
            assertThat(wallet.sells.get()).isEqualTo(1);
            assertThat(wallet.balanceUsd()).isEqualByComparingTo("1000");
            assertThat(engine.openCount()).isZero();
            assertThat(engine.statistics().getLateFills()).isEqualTo(1);
            assertThat(engine.statistics().getUnresolvedLateFills()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unsupportedChainIsAValidationFailure() {
        TradeResult result = engine.buy(ETH, "bsc", "PEPE", new BigDecimal("50"));

        assertThat(result.failureKind()).isEqualTo(TradeResult.FailureKind.VALIDATION);
        assertThat(wallet.buys.get()).isZero();
    }

    @Test
    void amountBelowMinimumIsRefused() {
        TradeResult result = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("1"));

        assertThat(result.failureKind()).isEqualTo(TradeResult.FailureKind.CAPACITY);
        assertThat(wallet.buys.get()).isZero();
    }

    @Test
    void walletFailureFailsTheBuy() {
        wallet.failBuy = true;

        TradeResult result = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100"));

        assertThat(result.failureKind()).isEqualTo(TradeResult.FailureKind.TRANSIENT);
        assertThat(result.position().getStatus()).isEqualTo(TradeStatus.FAILED);
        assertThat(engine.openCount()).isZero();
        assertThat(engine.statistics().getFailedBuys()).isEqualTo(1);
        assertThat(engine.statistics().getPendingBuys()).isZero();
    }

    @Test
    void sellingUnknownPositionIsAnInvariantFailure() {
        TradeResult result = engine.sell("missing", ExitReason.MANUAL);

        assertThat(result.success()).isFalse();
        assertThat(result.failureKind()).isEqualTo(TradeResult.FailureKind.INVARIANT);
    }

    @Test
    void manualSellClosesAndRecordsOutcome() {
        String id = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100")).position().getId();
        wallet.quote = new BigDecimal("0.8");

        TradeResult result = engine.sell(id, null);

        assertThat(result.success()).isTrue();
        assertThat(result.position().getExitReason()).isEqualTo(ExitReason.MANUAL);
        assertThat(result.position().getPnlUsd()).isEqualByComparingTo("-20");
        assertThat(result.position().getPnlPct()).isEqualByComparingTo("-20");
        assertThat(engine.openCount()).isZero();
        assertThat(engine.closedPositions()).hasSize(1);
        EngineStatistics stats = engine.statistics();
        assertThat(stats.getLosingTrades()).isEqualTo(1);
        assertThat(stats.getWinRatePct()).isZero();
        assertThat(events).hasSize(1).first().isInstanceOf(PositionClosedEvent.class);
    }

    @Test
    void failedSellLeavesPositionOpen() {
        String id = engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100")).position().getId();
        wallet.failSell = true;

        TradeResult result = engine.sell(id, ExitReason.STOP_LOSS);

        assertThat(result.failureKind()).isEqualTo(TradeResult.FailureKind.TRANSIENT);
        assertThat(engine.openCount()).isEqualTo(1);
        assertThat(engine.position(id).orElseThrow().getStatus()).isEqualTo(TradeStatus.OPEN);
        assertThat(events).isEmpty();
    }

    @Test
    void monitorClosesPositionAtProfitTarget() {
        engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100"));
        wallet.quote = new BigDecimal("6");

        ExecutionEngine.MonitorSummary summary = engine.monitorPositions();

        assertThat(summary.closed()).isEqualTo(1);
        assertThat(engine.openCount()).isZero();
        PositionSnapshot closed = engine.closedPositions().get(0);
        assertThat(closed.getExitReason()).isEqualTo(ExitReason.PROFIT_TARGET);
        assertThat(closed.getPnlPct()).isEqualByComparingTo("500");
        assertThat(engine.statistics().getWinningTrades()).isEqualTo(1);
        assertThat(engine.statistics().getWinRatePct()).isEqualTo(100.0);
    }

    @Test
    void monitorHoldsWhileRulesAreQuiet() {
        engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100"));
        wallet.quote = new BigDecimal("1.2");

        ExecutionEngine.MonitorSummary summary = engine.monitorPositions();

        assertThat(summary.evaluated()).isEqualTo(1);
        assertThat(summary.closed()).isZero();
        assertThat(engine.openPositions().get(0).getPnlPct()).isEqualByComparingTo("20");
    }

    @Test
    void monitorClosesOnHoldTime() {
        engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100"));
        clock.advance(Duration.ofHours(25));

        engine.monitorPositions();

        assertThat(engine.closedPositions()).extracting(PositionSnapshot::getExitReason)
                .containsExactly(ExitReason.MAX_HOLD_TIME);
    }

    @Test
    void failedQuoteSkipsOnlyThatPosition() {
        engine.buy(ETH, "ethereum", "PEPE", new BigDecimal("100"));
        wallet.failQuote = true;

        ExecutionEngine.MonitorSummary summary = engine.monitorPositions();

        assertThat(summary.failures()).isEqualTo(1);
        assertThat(summary.evaluated()).isZero();
        assertThat(engine.openCount()).isEqualTo(1);
    }

    @Test
    void closedHistoryIsBounded() {
        properties.setClosedHistoryLimit(2);
        for (int i = 0; i < 3; i++) {
            String id = engine.buy(ETH, "ethereum", "T" + i, new BigDecimal("50")).position().getId();
            engine.sell(id, ExitReason.MANUAL);
        }

        assertThat(engine.closedPositions()).extracting(PositionSnapshot::getSymbol).containsExactly("T1", "T2");
    }

    @Test
    void liveModeIsRefused() {
        ExecutionProperties live = new ExecutionProperties();
        live.setDryRun(false);

        assertThatThrownBy(() -> engine(live)).isInstanceOf(IllegalStateException.class);
    }

    private ExecutionEngine engine(ExecutionProperties executionProperties) {
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
        return engine(executionProperties,
                new CollaboratorGuard(TimeLimiter.of(Duration.ofSeconds(2)), Runnable::run, metricsService));
    }

    private ExecutionEngine engine(ExecutionProperties executionProperties, CollaboratorGuard guard) {
        MetricsService metricsService = new MetricsService(new SimpleMeterRegistry());
        PositionSizingService sizingService = new PositionSizingService(executionProperties);
        return new ExecutionEngine(executionProperties, sizingService, new RiskGatekeeper(sizingService),
                new ExitPriorityEngine(executionProperties, sizingService), new TradeStateMachine(), wallet, guard,
                CircuitBreaker.ofDefaults("wallet-test"), events::add, metricsService, clock);
    }

    private static void await(CountDownLatch gate) {
        if (gate == null) {
            return;
        }
        try {
            if (!gate.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("gate never opened");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static final class FakeWallet implements WalletPort {
        private volatile BigDecimal quote = BigDecimal.ONE;
        private volatile boolean failBuy;
        private volatile boolean failSell;
        private volatile boolean failQuote;
        private volatile CountDownLatch buyGate;
        private volatile CountDownLatch sellGate;
        private final AtomicInteger buys = new AtomicInteger();
        private final AtomicInteger sells = new AtomicInteger();
        private final Semaphore buyEntered = new Semaphore(0);
        private final Semaphore sellEntered = new Semaphore(0);
        private final Semaphore sellDone = new Semaphore(0);
        private BigDecimal balance = new BigDecimal("1000");

        @Override
        public Fill buy(String address, Chain chain, BigDecimal amountUsd) {
            if (failBuy) {
                throw new RuntimeException("rpc unavailable");
            }
            buyEntered.release();
            await(buyGate);
            int n = buys.incrementAndGet();
            synchronized (this) {
                balance = balance.subtract(amountUsd);
            }
            return new Fill(BigDecimal.ONE, amountUsd, amountUsd, "0xTEST_" + n);
        }

        @Override
        public Fill sell(PositionSnapshot position) {
            if (failSell) {
                throw new RuntimeException("rpc unavailable");
            }
            sellEntered.release();
            await(sellGate);
            BigDecimal proceeds = MoneyUtils.multiply(position.getTokenAmount(), quote);
            sells.incrementAndGet();
            synchronized (this) {
                balance = balance.add(proceeds);
            }
            sellDone.release();
            return new Fill(quote, position.getTokenAmount(), proceeds, "0xTEST_SELL");
        }

        @Override
        public BigDecimal quote(PositionSnapshot position) {
            if (failQuote) {
                throw new RuntimeException("quote unavailable");
            }
            return quote;
        }

        @Override
        public synchronized BigDecimal balanceUsd() {
            return balance;
        }

        synchronized void setBalance(String usd) {
            balance = new BigDecimal(usd);
        }
    }
}
