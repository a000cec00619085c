package com.heist.backend.service;

import com.heist.backend.exception.CollaboratorException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a collaborator call on the collaborator pool under a timeout and a circuit
 * breaker. Every way the call can go wrong surfaces as {@link CollaboratorException}.
 */
@Slf4j
@Service
public class CollaboratorGuard {

    private final TimeLimiter timeLimiter;
    private final Executor executor;
    private final MetricsService metricsService;

    public CollaboratorGuard(TimeLimiter collaboratorTimeLimiter,
                             @Qualifier("collaboratorExecutor") Executor executor,
                             MetricsService metricsService) {
        this.timeLimiter = collaboratorTimeLimiter;
        this.executor = executor;
        this.metricsService = metricsService;
    }

    public <T> T call(String collaborator, CircuitBreaker circuitBreaker, Supplier<T> supplier) {
        return call(collaborator, circuitBreaker, supplier, null);
    }

    /**
     * As {@link #call(String, CircuitBreaker, Supplier)}. When the call times out but the
     * collaborator still answers afterwards, {@code lateResult} receives that answer on the
     * collaborator pool. The worker thread is not interrupted by a timeout.
     */
    public <T> T call(String collaborator, CircuitBreaker circuitBreaker, Supplier<T> supplier,
                      Consumer<T> lateResult) {
        Supplier<T> decorated = CircuitBreaker.decorateSupplier(circuitBreaker,
                () -> callWithTimeout(collaborator, supplier, lateResult));
        try {
            return decorated.get();
        } catch (CallNotPermittedException e) {
            metricsService.recordCollaboratorFailure(collaborator);
            throw new CollaboratorException(collaborator, collaborator + " circuit open", e);
        } catch (CollaboratorException e) {
            metricsService.recordCollaboratorFailure(collaborator);
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordCollaboratorFailure(collaborator);
            throw new CollaboratorException(collaborator, collaborator + " call failed: " + e.getMessage(), e);
        }
    }

    private <T> T callWithTimeout(String collaborator, Supplier<T> supplier, Consumer<T> lateResult) {
        AtomicReference<CompletableFuture<T>> running = new AtomicReference<>();
        // the limiter cancels the view it is handed; the running call keeps its own future
        Callable<T> limited = TimeLimiter.decorateFutureSupplier(timeLimiter, () -> {
            CompletableFuture<T> future = CompletableFuture.supplyAsync(supplier, executor);
            running.set(future);
            return future.thenApply(Function.identity());
        });
        try {
            return limited.call();
        } catch (TimeoutException e) {
            log.warn("Collaborator {} timed out after {}", collaborator,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            CompletableFuture<T> future = running.get();
            if (lateResult != null && future != null) {
                future.thenAccept(result -> {
                    log.warn("Collaborator {} answered after its timeout", collaborator);
                    lateResult.accept(result);
                });
            }
            throw new CollaboratorException(collaborator, collaborator + " timed out", e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException(collaborator, collaborator + " call failed: " + e.getMessage(), e);
        }
    }
}
