package com.skycaster.common.bulkhead;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bulkhead pattern implementation for resource isolation.
 * Every named compartment owns its thread pool, permits and timeout, so a
 * slow or failing dependency can only exhaust its own compartment.
 */
@Slf4j
public class BulkheadService {

    private final BulkheadConfiguration.BulkheadProperties properties;
    private final Map<String, Compartment> compartments = new ConcurrentHashMap<>();

    public BulkheadService(BulkheadConfiguration.BulkheadProperties properties) {
        this.properties = properties;
    }

    /**
     * Execute an operation inside the named compartment.
     * The returned future always completes normally; failures, rejections
     * and timeouts are reported through the {@link BulkheadResult}.
     */
    public <T> CompletableFuture<BulkheadResult<T>> execute(String compartmentName,
                                                            Supplier<T> operation,
                                                            String operationId) {
        Compartment compartment = compartments.computeIfAbsent(compartmentName, this::createCompartment);
        return executeWithBulkhead(operation, operationId, compartment);
    }

    /**
     * Check if a compartment currently has free permits
     */
    public boolean hasCapacity(String compartmentName) {
        Compartment compartment = compartments.get(compartmentName);
        return compartment == null || compartment.semaphore.availablePermits() > 0;
    }

    /**
     * Get resource utilization percentage for a compartment
     */
    public double getUtilization(String compartmentName) {
        Compartment compartment = compartments.get(compartmentName);
        if (compartment == null) {
            return 0.0;
        }
        int inUse = compartment.permits - compartment.semaphore.availablePermits();
        return (double) inUse / compartment.permits * 100.0;
    }

    private <T> CompletableFuture<BulkheadResult<T>> executeWithBulkhead(
            Supplier<T> operation,
            String operationId,
            Compartment compartment) {

        long startTime = System.currentTimeMillis();
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();

        return CompletableFuture.supplyAsync(() -> {
            if (callerMdc != null) {
                MDC.setContextMap(callerMdc);
            }
            boolean acquired = false;
            try {
                acquired = compartment.semaphore.tryAcquire(compartment.timeoutSeconds, TimeUnit.SECONDS);

                if (!acquired) {
                    log.warn("Resource exhausted for {}: operation {}", compartment.name, operationId);
                    return BulkheadResult.<T>builder()
                        .success(false)
                        .rejected(true)
                        .compartment(compartment.name)
                        .operationId(operationId)
                        .error("Bulkhead rejected: resource pool exhausted")
                        .executionTime(System.currentTimeMillis() - startTime)
                        .build();
                }

                log.debug("Executing {} operation: {}", compartment.name, operationId);

                T result = operation.get();

                long executionTime = System.currentTimeMillis() - startTime;
                log.debug("Completed {} operation: {} in {}ms", compartment.name, operationId, executionTime);

                return BulkheadResult.<T>builder()
                    .success(true)
                    .result(result)
                    .compartment(compartment.name)
                    .operationId(operationId)
                    .executionTime(executionTime)
                    .build();

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Operation interrupted: {} for {}", operationId, compartment.name, e);

                return BulkheadResult.<T>builder()
                    .success(false)
                    .compartment(compartment.name)
                    .operationId(operationId)
                    .error("Operation interrupted: " + e.getMessage())
                    .executionTime(System.currentTimeMillis() - startTime)
                    .build();

            } catch (Exception e) {
                log.error("Operation failed: {} for {}", operationId, compartment.name, e);

                return BulkheadResult.<T>builder()
                    .success(false)
                    .compartment(compartment.name)
                    .operationId(operationId)
                    .error("Operation failed: " + e.getMessage())
                    .executionTime(System.currentTimeMillis() - startTime)
                    .build();

            } finally {
                if (acquired) {
                    compartment.semaphore.release();
                }
                MDC.clear();
            }
        }, compartment.executor).orTimeout(compartment.timeoutSeconds, TimeUnit.SECONDS)
        .exceptionally(throwable -> {
            Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause() : throwable;
            boolean timedOut = cause instanceof TimeoutException;
            log.warn("{} for {} operation: {}", timedOut ? "Timeout" : "Error", compartment.name, operationId);

            return BulkheadResult.<T>builder()
                .success(false)
                .compartment(compartment.name)
                .operationId(operationId)
                .error(timedOut
                    ? "Timed out after " + compartment.timeoutSeconds + "s"
                    : "Error: " + cause.getMessage())
                .executionTime(System.currentTimeMillis() - startTime)
                .timeout(timedOut)
                .build();
        });
    }

    private Compartment createCompartment(String name) {
        BulkheadConfiguration.BulkheadProperties.Compartment settings = properties.forCompartment(name);
        log.info("Creating bulkhead compartment {} (pool={}, permits={}, timeout={}s)",
            name, settings.getPoolSize(), settings.getPermits(), settings.getTimeoutSeconds());
        return new Compartment(name,
            createExecutorService(name, settings.getPoolSize()),
            settings.getPermits(),
            settings.getTimeoutSeconds());
    }

    private ExecutorService createExecutorService(String threadNamePrefix, int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(poolSize, r -> {
            Thread thread = new Thread(r);
            thread.setName("bulkhead-" + threadNamePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Shutdown all executor services gracefully
     */
    public void shutdown() {
        log.info("Shutting down bulkhead executor services");
        compartments.values().forEach(this::shutdownExecutor);
    }

    private void shutdownExecutor(Compartment compartment) {
        compartment.executor.shutdown();
        try {
            if (!compartment.executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Executor {} did not terminate within 30 seconds, forcing shutdown", compartment.name);
                compartment.executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            compartment.executor.shutdownNow();
        }
    }

    private static final class Compartment {
        private final String name;
        private final ExecutorService executor;
        private final Semaphore semaphore;
        private final int permits;
        private final int timeoutSeconds;

        private Compartment(String name, ExecutorService executor, int permits, int timeoutSeconds) {
            this.name = name;
            this.executor = executor;
            this.semaphore = new Semaphore(permits);
            this.permits = permits;
            this.timeoutSeconds = timeoutSeconds;
        }
    }
}
