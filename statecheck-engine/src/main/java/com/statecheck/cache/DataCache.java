package com.statecheck.cache;

import com.statecheck.device.ConnectionTimeoutException;
import com.statecheck.device.SignalFactory;
import com.statecheck.device.SignalHandle;
import com.statecheck.model.ReduceMethod;
import com.statecheck.tool.Tool;
import com.statecheck.tool.ToolResult;
import com.statecheck.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Single point of truth for "current value of X" during one preparation-and-execution session.
 *
 * <p>Requests sharing a key (signal plus reduction window, or an equal tool specification) share
 * one underlying fetch; every waiter observes the same value or the same failure. Values are kept
 * until the next execution pass begins, failed fetches are evicted so a later request retries.
 *
 * <p>A pass that directly follows {@link #markFilled()} reuses the filled values instead of
 * fetching again.
 */
public class DataCache {
    private static final Logger log = LoggerFactory.getLogger(DataCache.class);

    private final SignalFactory signalFactory;
    private final ScheduledExecutorService scheduler;
    private final Executor toolExecutor;
    private final Duration readTimeout;
    private final Duration sampleInterval;

    private final Map<String, SignalHandle> signals = new ConcurrentHashMap<>();
    private final Map<SignalDataKey, CompletableFuture<Object>> signalData = new ConcurrentHashMap<>();
    private final Map<Tool, CompletableFuture<ToolResult>> toolData = new ConcurrentHashMap<>();
    private final AtomicBoolean filled = new AtomicBoolean();

    /**
     * Create a data cache whose tools run on the polling scheduler.
     */
    public DataCache(
            SignalFactory signalFactory,
            ScheduledExecutorService scheduler,
            Duration readTimeout,
            Duration sampleInterval
    ) {
        this(signalFactory, scheduler, scheduler, readTimeout, sampleInterval);
    }

    /**
     * Create a data cache.
     *
     * @param signalFactory creates signals for raw PV names
     * @param scheduler schedules polling for reduced reads
     * @param toolExecutor runs blocking tool work
     * @param readTimeout maximum time for a single signal read
     * @param sampleInterval polling interval for reduced reads
     */
    public DataCache(
            SignalFactory signalFactory,
            ScheduledExecutorService scheduler,
            Executor toolExecutor,
            Duration readTimeout,
            Duration sampleInterval
    ) {
        this.signalFactory = Objects.requireNonNull(signalFactory, "signalFactory");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor");
        this.readTimeout = Objects.requireNonNull(readTimeout, "readTimeout");
        this.sampleInterval = Objects.requireNonNull(sampleInterval, "sampleInterval");
    }

    /**
     * Returns the signal for a PV name, creating it on first use.
     *
     * @param pvName PV name
     * @return the signal
     */
    public SignalHandle signal(String pvName) {
        return signals.computeIfAbsent(pvName, signalFactory::create);
    }

    /**
     * Gets signal data, reduced over a time window when a period is given.
     *
     * @param signal signal to read
     * @param reducePeriod window in seconds, or {@code null} for a single read
     * @param reduceMethod reduction applied to the window's samples
     * @param string read the value as a string
     * @return value; fails with {@link ConnectionTimeoutException} if the signal cannot be read in time
     */
    public CompletableFuture<Object> getSignalData(
            SignalHandle signal,
            Double reducePeriod,
            ReduceMethod reduceMethod,
            boolean string
    ) {
        Objects.requireNonNull(signal, "signal");
        Double period = reducePeriod != null && reducePeriod > 0 ? reducePeriod : null;
        ReduceMethod method = period == null ? null : (reduceMethod != null ? reduceMethod : ReduceMethod.AVERAGE);

        SignalDataKey key = new SignalDataKey(signal, period, method, string);
        return singleFlight(signalData, key, () -> {
            log.debug("Fetching signal data: signal={}, reduce_period={}, reduce_method={}, string={}",
                    signal.getName(), period, method, string);
            if (period == null) {
                return readOnce(signal, string);
            }
            return readReduced(signal, period, method, string);
        });
    }

    /**
     * Runs a tool, or joins a run already in flight for an equal tool.
     *
     * @param tool tool specification
     * @return the tool's result bundle
     */
    public CompletableFuture<ToolResult> getToolData(Tool tool) {
        Objects.requireNonNull(tool, "tool");
        return singleFlight(toolData, tool, () -> {
            log.debug("Running tool: {}", tool);
            return tool.run(toolExecutor);
        });
    }

    /**
     * Starts an execution pass. Values from the previous pass are dropped, unless the cache was
     * filled since then.
     */
    public void beginPass() {
        if (filled.compareAndSet(true, false)) {
            log.debug("Reusing filled cache: signals={}, tools={}", signalData.size(), toolData.size());
            return;
        }
        clear();
    }

    /**
     * Marks the current values as filled, so the next {@link #beginPass()} keeps them.
     */
    public void markFilled() {
        filled.set(true);
    }

    /**
     * Drops every retained value so the next request fetches again.
     */
    public void clear() {
        signalData.clear();
        toolData.clear();
    }

    private <K, V> CompletableFuture<V> singleFlight(
            Map<K, CompletableFuture<V>> entries,
            K key,
            Supplier<CompletableFuture<V>> fetcher
    ) {
        CompletableFuture<V> created = new CompletableFuture<>();
        CompletableFuture<V> existing = entries.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }

        CompletableFuture<V> fetch;
        try {
            fetch = fetcher.get();
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        if (fetch == null) {
            fetch = CompletableFuture.failedFuture(new IllegalStateException("fetch returned no future for " + key));
        }

        fetch.whenComplete((value, ex) -> {
            if (ex != null) {
                // evict before completing so a retry after the failure starts a new fetch
                entries.remove(key, created);
                created.completeExceptionally(Futures.unwrap(ex));
            } else {
                created.complete(value);
            }
        });
        return created;
    }

    private CompletableFuture<Object> readOnce(SignalHandle signal, boolean string) {
        CompletableFuture<Object> read = signal.read(string);
        if (read == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Signal returned no read: " + signal.getName()));
        }

        return read.copy()
                .orTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((value, ex) -> {
                    if (ex == null) {
                        return value;
                    }
                    Throwable cause = Futures.unwrap(ex);
                    if (cause instanceof TimeoutException) {
                        throw new ConnectionTimeoutException(
                                "Timed out after " + readTimeout.toMillis() + " ms reading " + signal.getName(), cause);
                    }
                    throw new CompletionException(cause);
                });
    }

    private CompletableFuture<Object> readReduced(SignalHandle signal, double period, ReduceMethod method, boolean string) {
        CompletableFuture<Object> out = new CompletableFuture<>();
        List<Object> samples = Collections.synchronizedList(new ArrayList<>());
        long deadline = System.nanoTime() + (long) (period * 1_000_000_000L);
        poll(signal, string, method, samples, deadline, out);
        return out;
    }

    private void poll(
            SignalHandle signal,
            boolean string,
            ReduceMethod method,
            List<Object> samples,
            long deadline,
            CompletableFuture<Object> out
    ) {
        readOnce(signal, string).whenComplete((value, ex) -> {
            if (ex != null) {
                out.completeExceptionally(Futures.unwrap(ex));
                return;
            }
            samples.add(value);

            if (System.nanoTime() >= deadline) {
                try {
                    out.complete(reduce(samples, method, string));
                } catch (RuntimeException e) {
                    out.completeExceptionally(e);
                }
                return;
            }

            try {
                scheduler.schedule(
                        () -> poll(signal, string, method, samples, deadline, out),
                        sampleInterval.toMillis(),
                        TimeUnit.MILLISECONDS
                );
            } catch (RejectedExecutionException e) {
                out.completeExceptionally(e);
            }
        });
    }

    private static Object reduce(List<Object> samples, ReduceMethod method, boolean string) {
        List<Object> present;
        synchronized (samples) {
            present = samples.stream().filter(Objects::nonNull).toList();
        }
        if (present.isEmpty()) {
            return null;
        }
        if (string || method == ReduceMethod.LATEST) {
            return present.get(present.size() - 1);
        }

        List<Double> numbers = new ArrayList<>(present.size());
        for (Object sample : present) {
            if (!(sample instanceof Number n)) {
                throw new IllegalArgumentException("Cannot reduce non-numeric sample of type "
                        + sample.getClass().getSimpleName() + " with " + method.toJson());
            }
            numbers.add(n.doubleValue());
        }
        return method.reduce(numbers);
    }

    private record SignalDataKey(SignalHandle signal, Double reducePeriod, ReduceMethod reduceMethod, boolean string) {
    }
}
