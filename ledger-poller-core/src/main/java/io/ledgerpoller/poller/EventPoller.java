package io.ledgerpoller.poller;

import io.ledgerpoller.EventFilter;
import io.ledgerpoller.LedgerEvent;
import io.ledgerpoller.cursor.CursorStore;
import io.ledgerpoller.spi.EventPage;
import io.ledgerpoller.spi.EventQueryClient;
import io.ledgerpoller.spi.EventQueryException;
import io.ledgerpoller.spi.MetricsExporter;
import io.ledgerpoller.spi.SortOrder;
import io.ledgerpoller.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls a ledger's event-query endpoint on a fixed cadence and delivers only events not seen
 * before, in chronological order.
 *
 * <p>Each fetch cycle queries every filter concurrently for the latest {@value #PAGE_SIZE}
 * events, keeps those the {@link CursorStore} classifies as new, records them, and hands the
 * merged set to the {@link EventBatchListener} as one batch sorted by event time. A query that
 * fails only empties that filter's share of the cycle; the failure goes to the
 * {@link PollerErrorHandler}. A second schedule evicts remembered ids every five minutes so
 * memory stays bounded by {@code maxStoredEvents} per filter.
 *
 * <p>Lifecycle: {@link #start()} and {@link #stop()} move between running and stopped and may be
 * repeated; redundant calls are logged and ignored. {@link #close()} stops the poller for good
 * and releases its threads. Stopping does not abort a fetch cycle already in flight; that
 * cycle completes its queries but its results are discarded.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see EventPoller.Builder
 * @see CursorStore
 */
public final class EventPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventPoller.class.getName());

    /** Number of events requested per filter in each fetch cycle. */
    public static final int PAGE_SIZE = 50;

    /** Period of the eviction schedule. */
    public static final long EVICTION_INTERVAL_MS = TimeUnit.MINUTES.toMillis(5);

    private final EventQueryClient client;
    private final List<EventFilter> filters;
    private final Map<String, EventFilter> filtersByKey;
    private final long intervalMs;
    private final long memoryWindowMs;
    private final int maxStoredEvents;
    private final long queryTimeoutMs;
    private final EventBatchListener onNewEvents;
    private final PollerErrorHandler onError;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final long startTime;
    private final CursorStore cursorStore;
    private final ExecutorService queryExecutor;
    private final Object cycleLock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private final Set<String> queriesInFlight = ConcurrentHashMap.newKeySet();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;
    private ScheduledFuture<?> evictionTask;
    private volatile boolean polling;
    private volatile boolean closed;

    private EventPoller(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "client");
        Objects.requireNonNull(builder.filters, "filters");
        if (builder.filters.isEmpty()) {
            throw new IllegalArgumentException("filters must not be empty");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.memoryWindowMs < 0L) {
            throw new IllegalArgumentException("memoryWindowMs must be >= 0");
        }
        if (builder.maxStoredEvents < 0) {
            throw new IllegalArgumentException("maxStoredEvents must be >= 0");
        }
        if (builder.queryTimeoutMs <= 0L) {
            throw new IllegalArgumentException("queryTimeoutMs must be > 0");
        }

        this.filters = List.copyOf(builder.filters);
        Map<String, EventFilter> byKey = new LinkedHashMap<>();
        for (EventFilter filter : filters) {
            byKey.putIfAbsent(Objects.requireNonNull(filter.canonicalForm(), "canonicalForm"), filter);
        }
        this.filtersByKey = Collections.unmodifiableMap(byKey);

        this.intervalMs = builder.intervalMs;
        this.memoryWindowMs = builder.memoryWindowMs;
        this.maxStoredEvents = builder.maxStoredEvents;
        this.queryTimeoutMs = builder.queryTimeoutMs;
        this.onNewEvents = builder.onNewEvents != null ? builder.onNewEvents : EventBatchListener.NOOP;
        this.onError = builder.onError != null ? builder.onError : PollerErrorHandler.LOGGING;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.startTime = builder.startFromNow ? clock.millis() : 0L;
        this.cursorStore = new CursorStore(filtersByKey.keySet(), startTime);
        // Grows on demand: a hung query holds its thread, and the one-query-per-filter
        // guard in fetchAll bounds the thread count by the number of filters
        this.queryExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("ledger-poller-query-"));

        logger.log(Level.INFO, "EventPoller initialized at {0} for {1} filter(s)",
                new Object[]{Instant.ofEpochMilli(startTime), filtersByKey.size()});
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts polling: runs one fetch cycle right away, then the next {@code intervalMs} after
     * each cycle completes, and evicts remembered ids every five minutes. A slow cycle delays
     * the next one; missed cycles are not made up. Logs a warning and does nothing if already running.
     *
     * @throws IllegalStateException if the poller has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("EventPoller has been closed");
        }
        if (polling) {
            logger.warning("EventPoller is already running");
            return;
        }
        polling = true;
        long runGeneration = generation.incrementAndGet();
        logger.info("Starting EventPoller...");

        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("ledger-poller-scheduler-"));
        pollTask = scheduler.scheduleWithFixedDelay(
                () -> runPollCycle(runGeneration), 0L, intervalMs, TimeUnit.MILLISECONDS);
        evictionTask = scheduler.scheduleWithFixedDelay(
                this::evictOnce, EVICTION_INTERVAL_MS, EVICTION_INTERVAL_MS, TimeUnit.MILLISECONDS);

        logger.log(Level.INFO, "EventPoller started, polling every {0} ms", intervalMs);
    }

    /**
     * Cancels both schedules and returns without waiting for a fetch cycle in flight. Logs a
     * warning and does nothing if not running.
     */
    public synchronized void stop() {
        if (!polling) {
            logger.warning("EventPoller is not running");
            return;
        }
        cancelSchedules();
        polling = false;
        logger.info("EventPoller stopped");
    }

    /**
     * Executes a single fetch cycle on the calling thread. Called by the schedule, but may
     * also be invoked directly, e.g. for testing. Never throws: failures go to the error handler.
     */
    public void pollOnce() {
        runPollCycle(generation.get());
    }

    /**
     * Executes a single eviction cycle on the calling thread. Called by the schedule, but may
     * also be invoked directly.
     */
    public void evictOnce() {
        if (closed) {
            return;
        }
        try {
            int evicted = cursorStore.evict(clock.millis(), memoryWindowMs, maxStoredEvents);
            long tracked = cursorStore.trackedIdCount();
            metrics.incrementEvicted(evicted);
            metrics.recordTrackedIds(tracked);
            logger.log(Level.FINE, "Evicted {0} event ids, {1} events tracked", new Object[]{evicted, tracked});
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Eviction cycle failed", t);
        }
    }

    /**
     * Returns a snapshot of the poller's state. Has no side effects.
     */
    public PollerStatus getStatus() {
        return new PollerStatus(polling, filters, intervalMs, startTime, cursorStore.trackedIdCount());
    }

    public boolean isPolling() {
        return polling;
    }

    CursorStore cursorStore() {
        return cursorStore;
    }

    private void runPollCycle(long runGeneration) {
        if (closed) {
            return;
        }
        synchronized (cycleLock) {
            try {
                metrics.incrementPollCycles();
                List<FilterOutcome> outcomes = fetchAll();
                if (generation.get() != runGeneration) {
                    logger.fine("Discarding results of a fetch cycle that outlived its run");
                    return;
                }

                long now = clock.millis();
                List<LedgerEvent> batch = new ArrayList<>();
                for (FilterOutcome outcome : outcomes) {
                    if (outcome.failure() != null) {
                        reportQueryFailure(outcome);
                        continue;
                    }
                    for (LedgerEvent event : outcome.newEvents()) {
                        cursorStore.record(outcome.filterKey(), event, now);
                    }
                    batch.addAll(outcome.newEvents());
                }
                metrics.recordTrackedIds(cursorStore.trackedIdCount());

                if (!batch.isEmpty()) {
                    deliver(batch);
                }
            } catch (Throwable t) {
                reportError(t);
            }
        }
    }

    private List<FilterOutcome> fetchAll() {
        List<CompletableFuture<FilterOutcome>> pending = new ArrayList<>(filtersByKey.size());
        for (Map.Entry<String, EventFilter> entry : filtersByKey.entrySet()) {
            String filterKey = entry.getKey();
            EventFilter filter = entry.getValue();
            if (!queriesInFlight.add(filterKey)) {
                pending.add(CompletableFuture.completedFuture(FilterOutcome.failed(filterKey,
                        new EventQueryException("Previous event query for filter " + filterKey
                                + " is still running; skipped this cycle"))));
                continue;
            }
            CompletableFuture<FilterOutcome> query;
            try {
                query = CompletableFuture.supplyAsync(() -> {
                    try {
                        return fetchNewEvents(filterKey, filter);
                    } finally {
                        queriesInFlight.remove(filterKey);
                    }
                }, queryExecutor);
            } catch (RejectedExecutionException e) {
                queriesInFlight.remove(filterKey);
                throw e;
            }
            pending.add(query
                    .orTimeout(queryTimeoutMs, TimeUnit.MILLISECONDS)
                    .exceptionally(t -> FilterOutcome.failed(filterKey, describeFailure(filterKey, t))));
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();

        List<FilterOutcome> outcomes = new ArrayList<>(pending.size());
        for (CompletableFuture<FilterOutcome> future : pending) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    private FilterOutcome fetchNewEvents(String filterKey, EventFilter filter) {
        EventPage page;
        try {
            page = client.queryEvents(filter, null, PAGE_SIZE, SortOrder.DESCENDING);
        } catch (RuntimeException e) {
            return FilterOutcome.failed(filterKey, e);
        }
        if (page == null || page.data().isEmpty()) {
            return FilterOutcome.succeeded(filterKey, List.of());
        }

        Set<String> taken = new HashSet<>();
        List<LedgerEvent> fresh = new ArrayList<>();
        for (LedgerEvent event : page.data()) {
            if (cursorStore.isNew(filterKey, event) && taken.add(event.id().key())) {
                fresh.add(event);
            }
        }
        return FilterOutcome.succeeded(filterKey, fresh);
    }

    private Throwable describeFailure(String filterKey, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new EventQueryException(
                    "Event query for filter " + filterKey + " timed out after " + queryTimeoutMs + " ms", cause);
        }
        return cause;
    }

    private void deliver(List<LedgerEvent> batch) {
        // List.sort is stable: same-time events keep the order the ledger returned them in
        batch.sort(Comparator.comparingLong(LedgerEvent::timestampMs));
        logger.log(Level.INFO, "Found {0} new events", batch.size());
        metrics.incrementEventsDelivered(batch.size());
        metrics.incrementBatchesDelivered();
        try {
            onNewEvents.onNewEvents(Collections.unmodifiableList(batch));
        } catch (RuntimeException e) {
            metrics.incrementCallbackFailures();
            reportError(e);
        }
    }

    private void reportQueryFailure(FilterOutcome outcome) {
        metrics.incrementQueryFailures();
        logger.log(Level.WARNING, "Event query failed for filter {0}: {1}",
                new Object[]{outcome.filterKey(), outcome.failure()});
        reportError(outcome.failure());
    }

    private void reportError(Throwable error) {
        try {
            onError.onError(error);
        } catch (Throwable handlerFailure) {
            handlerFailure.addSuppressed(error);
            logger.log(Level.SEVERE, "Error handler failed", handlerFailure);
        }
    }

    private void cancelSchedules() {
        generation.incrementAndGet();
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (evictionTask != null) {
            evictionTask.cancel(false);
            evictionTask = null;
        }
        if (scheduler != null) {
            // shutdown() rather than shutdownNow(): a cycle in flight runs to completion
            scheduler.shutdown();
            scheduler = null;
        }
    }

    /**
     * Stops the poller if running and shuts down its query threads. A closed poller cannot be
     * restarted.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (polling) {
            cancelSchedules();
            polling = false;
            logger.info("EventPoller stopped");
        }
        queryExecutor.shutdownNow();
        try {
            queryExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record FilterOutcome(String filterKey, List<LedgerEvent> newEvents, Throwable failure) {

        static FilterOutcome succeeded(String filterKey, List<LedgerEvent> newEvents) {
            return new FilterOutcome(filterKey, newEvents, null);
        }

        static FilterOutcome failed(String filterKey, Throwable failure) {
            return new FilterOutcome(filterKey, List.of(), failure);
        }
    }

    /**
     * Builder for {@link EventPoller}.
     */
    public static final class Builder {
        private EventQueryClient client;
        private List<EventFilter> filters;
        private long intervalMs = 5000;
        private EventBatchListener onNewEvents;
        private PollerErrorHandler onError;
        private boolean startFromNow = true;
        private long memoryWindowMs = TimeUnit.HOURS.toMillis(1);
        private int maxStoredEvents = 1000;
        private long queryTimeoutMs = TimeUnit.SECONDS.toMillis(30);
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the client used to query the ledger.
         *
         * <p><b>Required.</b>
         *
         * @param client the ledger query client
         * @return this builder
         */
        public Builder client(EventQueryClient client) {
            this.client = client;
            return this;
        }

        /**
         * Sets the filters to watch. Filters with the same canonical form share one cursor.
         *
         * <p><b>Required.</b> Must not be empty.
         *
         * @param filters the filters
         * @return this builder
         */
        public Builder filters(List<? extends EventFilter> filters) {
            this.filters = filters == null ? null : new ArrayList<>(filters);
            return this;
        }

        /**
         * Varargs form of {@link #filters(List)}.
         *
         * @param filters the filters
         * @return this builder
         */
        public Builder filters(EventFilter... filters) {
            return filters(filters == null ? null : Arrays.asList(filters));
        }

        /**
         * Sets the fetch interval in milliseconds.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         *
         * @param intervalMs fetch interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the callback receiving each batch of new events.
         *
         * <p>Optional. Defaults to {@link EventBatchListener#NOOP}.
         *
         * @param onNewEvents the batch listener
         * @return this builder
         */
        public Builder onNewEvents(EventBatchListener onNewEvents) {
            this.onNewEvents = onNewEvents;
            return this;
        }

        /**
         * Sets the callback receiving query and delivery failures.
         *
         * <p>Optional. Defaults to {@link PollerErrorHandler#LOGGING}.
         *
         * @param onError the error handler
         * @return this builder
         */
        public Builder onError(PollerErrorHandler onError) {
            this.onError = onError;
            return this;
        }

        /**
         * Chooses the initial watermark. {@code true} ignores events older than the poller's
         * construction; {@code false} accepts anything the first query returns.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param startFromNow whether to start at the current time instead of the epoch
         * @return this builder
         */
        public Builder startFromNow(boolean startFromNow) {
            this.startFromNow = startFromNow;
            return this;
        }

        /**
         * Sets how long a delivered event id is remembered for duplicate suppression.
         *
         * <p>Optional. Defaults to one hour. Must be &ge; 0.
         *
         * @param memoryWindowMs memory window in milliseconds
         * @return this builder
         */
        public Builder memoryWindowMs(long memoryWindowMs) {
            this.memoryWindowMs = memoryWindowMs;
            return this;
        }

        /**
         * Sets the maximum number of event ids remembered per filter after each eviction.
         *
         * <p>Optional. Defaults to {@code 1000}. Must be &ge; 0.
         *
         * @param maxStoredEvents maximum ids per filter
         * @return this builder
         */
        public Builder maxStoredEvents(int maxStoredEvents) {
            this.maxStoredEvents = maxStoredEvents;
            return this;
        }

        /**
         * Sets how long a fetch cycle waits for one filter's query before reporting it as failed.
         * The query itself is not cancelled.
         *
         * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
         *
         * @param queryTimeoutMs per-query wait in milliseconds
         * @return this builder
         */
        public Builder queryTimeoutMs(long queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock used for the initial watermark and id recording times.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the poller. Call {@link EventPoller#start()} to begin polling.
         *
         * @return a new {@link EventPoller}
         * @throws NullPointerException     if {@code client} or {@code filters} is null, or a filter is null
         * @throws IllegalArgumentException if {@code filters} is empty, {@code intervalMs <= 0},
         *                                  {@code memoryWindowMs < 0}, {@code maxStoredEvents < 0}
         *                                  or {@code queryTimeoutMs <= 0}
         */
        public EventPoller build() {
            return new EventPoller(this);
        }
    }
}
