package com.polysearch.search.engine;

import com.polysearch.search.provider.ProviderBinding;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one call per provider binding in parallel and waits for every call to settle.
 *
 * <p>Each binding's timeout is measured from the moment the batch is launched. A call that fails or
 * runs past its timeout settles as a non-successful outcome and its task is cancelled; siblings are
 * unaffected. Outcomes come back in binding order.
 */
public class ProviderInvoker {
    private static final Logger log = LoggerFactory.getLogger(ProviderInvoker.class);

    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    public ProviderInvoker(ExecutorService executor) {
        this(executor, null);
    }

    public ProviderInvoker(ExecutorService executor, MeterRegistry meterRegistry) {
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public static ExecutorService defaultExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "polysearch-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }

    public <T> List<ProviderCallOutcome<T>> invokeAll(
            List<ProviderBinding> bindings,
            String operation,
            Function<ProviderBinding, T> call,
            String traceId
    ) {
        long batchStart = System.nanoTime();
        List<Future<T>> futures = new ArrayList<>(bindings.size());
        for (ProviderBinding binding : bindings) {
            futures.add(executor.submit(() -> call.apply(binding)));
        }

        List<ProviderCallOutcome<T>> outcomes = new ArrayList<>(bindings.size());
        boolean interrupted = false;
        for (int i = 0; i < bindings.size(); i++) {
            ProviderBinding binding = bindings.get(i);
            Future<T> future = futures.get(i);
            if (interrupted) {
                future.cancel(true);
                outcomes.add(new ProviderCallOutcome<>(binding, null, ProviderCallOutcome.Status.ERROR, elapsedMillis(batchStart)));
                continue;
            }
            try {
                T value;
                if (binding.hasTimeout()) {
                    long deadline = batchStart + TimeUnit.MILLISECONDS.toNanos(binding.timeoutMs());
                    value = future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } else {
                    value = future.get();
                }
                outcomes.add(new ProviderCallOutcome<>(binding, value, ProviderCallOutcome.Status.SUCCESS, elapsedMillis(batchStart)));
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn(
                        "trace_id={} provider={} operation={} outcome=TIMEOUT timeout_ms={}",
                        traceId,
                        binding.name(),
                        operation,
                        binding.timeoutMs()
                );
                incrementCounter("provider_timeout_total", binding.name());
                outcomes.add(new ProviderCallOutcome<>(binding, null, ProviderCallOutcome.Status.TIMEOUT, elapsedMillis(batchStart)));
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                log.warn(
                        "trace_id={} provider={} operation={} outcome=ERROR cause={}",
                        traceId,
                        binding.name(),
                        operation,
                        cause.toString()
                );
                incrementCounter("provider_error_total", binding.name());
                outcomes.add(new ProviderCallOutcome<>(binding, null, ProviderCallOutcome.Status.ERROR, elapsedMillis(batchStart)));
            } catch (CancellationException ex) {
                log.warn("trace_id={} provider={} operation={} outcome=ERROR cause=cancelled", traceId, binding.name(), operation);
                incrementCounter("provider_error_total", binding.name());
                outcomes.add(new ProviderCallOutcome<>(binding, null, ProviderCallOutcome.Status.ERROR, elapsedMillis(batchStart)));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                log.warn("trace_id={} provider={} operation={} outcome=ERROR cause=interrupted", traceId, binding.name(), operation);
                outcomes.add(new ProviderCallOutcome<>(binding, null, ProviderCallOutcome.Status.ERROR, elapsedMillis(batchStart)));
            }
        }
        return outcomes;
    }

    private void incrementCounter(String metricName, String provider) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, "provider", provider).increment();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
