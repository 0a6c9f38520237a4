package com.connection.finder.api;

import com.connection.finder.aggregate.AggregationStats;
import com.connection.finder.aggregate.PeopleAggregator;
import com.connection.finder.cache.CacheConfig;
import com.connection.finder.cache.CaffeineSearchCache;
import com.connection.finder.cache.NoOpSearchCache;
import com.connection.finder.cache.SearchCache;
import com.connection.finder.cache.SearchCacheKey;
import com.connection.finder.categorize.DefaultCategoryRules;
import com.connection.finder.categorize.PersonCategorizer;
import com.connection.finder.config.FinderConfig;
import com.connection.finder.core.model.CanonicalPerson;
import com.connection.finder.core.model.PersonCategory;
import com.connection.finder.core.model.PersonRecord;
import com.connection.finder.health.HealthCheckRegistry;
import com.connection.finder.health.HealthPolicy;
import com.connection.finder.health.SourceHealthCheck;
import com.connection.finder.health.SourceHealthTracker;
import com.connection.finder.identity.IdentityKeyBuilder;
import com.connection.finder.logging.LogContext;
import com.connection.finder.merge.MergeRules;
import com.connection.finder.metrics.MetricsService;
import com.connection.finder.metrics.NoOpMetricsService;
import com.connection.finder.rules.CompanyNameNormalizer;
import com.connection.finder.rules.CompanySuffixRules;
import com.connection.finder.rules.ParentCompanyMapping;
import com.connection.finder.source.ProviderOutcome;
import com.connection.finder.source.ProviderUnavailableException;
import com.connection.finder.source.SourceConfig;
import com.connection.finder.source.SourceProvider;
import com.connection.finder.source.SourceQuery;
import com.connection.finder.tracing.NoOpTracingService;
import com.connection.finder.tracing.Span;
import com.connection.finder.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a people search out to every eligible source, merges what comes back into
 * canonical identities, categorizes and ranks them.
 *
 * <p>A search proceeds as follows:</p>
 * <ol>
 *   <li>Sources are ordered by priority (then id). Sources disabled by configuration, not
 *       configured, or disabled by health are reported and never invoked.</li>
 *   <li>Eligible sources are dispatched in order, at most {@code maxConcurrency} at a time,
 *       each under its own timeout. A failing or slow source only affects its own report
 *       and health.</li>
 *   <li>Before each dispatch, if the result budget is already met, the remaining sources
 *       are skipped. Calls already in flight still complete and merge.</li>
 *   <li>When the search deadline expires, the search is closed: late results are discarded
 *       and the result is flagged partial.</li>
 *   <li>All identities are categorized against the target title, ranked by confidence
 *       (then number of sources, then name) and truncated to the budget.</li>
 * </ol>
 *
 * <p>Instances are thread-safe and should be closed to release their worker threads.</p>
 */
public class ConnectionFinder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionFinder.class);

    static final Comparator<CanonicalPerson> RANKING = Comparator
            .comparingDouble(CanonicalPerson::getConfidence).reversed()
            .thenComparing(Comparator.comparingInt((CanonicalPerson p) -> p.getSources().size()).reversed())
            .thenComparing(CanonicalPerson::getName, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(CanonicalPerson::getNormalizedCompany);

    private final List<RegisteredSource> sources;
    private final FinderOptions options;
    private final SourceHealthTracker healthTracker;
    private final CompanyNameNormalizer normalizer;
    private final IdentityKeyBuilder keyBuilder;
    private final MergeRules mergeRules;
    private final PersonCategorizer categorizer;
    private final SearchCache cache;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ConnectionFinder(Builder builder, List<RegisteredSource> sources, SourceHealthTracker healthTracker,
                             CompanyNameNormalizer normalizer, SearchCache cache) {
        this.sources = List.copyOf(sources);
        this.options = builder.options;
        this.healthTracker = healthTracker;
        this.normalizer = normalizer;
        this.keyBuilder = new IdentityKeyBuilder(normalizer);
        this.mergeRules = builder.mergeRules;
        this.categorizer = builder.categorizer;
        this.cache = cache;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.executor = Executors.newCachedThreadPool(new WorkerThreadFactory());
        for (RegisteredSource source : this.sources) {
            healthTracker.register(source.id());
        }
        log.info("ConnectionFinder initialized: {} sources, options={}", this.sources.size(), options);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SearchResult search(String company, String title, int resultBudget) {
        return search(new SearchRequest(company, title, resultBudget));
    }

    /**
     * Runs a search.
     *
     * @throws NoEligibleSourcesException if no source could be invoked, or every invoked
     *                                    source reported itself unavailable
     */
    public SearchResult search(SearchRequest request) {
        Objects.requireNonNull(request, "request is required");
        if (closed.get()) {
            throw new IllegalStateException("ConnectionFinder is closed");
        }

        long started = System.nanoTime();
        String correlationId = LogContext.generateCorrelationId();
        String normalizedCompany = normalizer.normalize(request.company());
        SearchCacheKey cacheKey = SearchCacheKey.of(normalizedCompany, request.title(), request.resultBudget());

        try (LogContext ctx = LogContext.forSearch(correlationId, request.company());
             Span span = tracing.startSpan("finder.search",
                     Map.of("company", normalizedCompany, "correlationId", correlationId))) {
            span.setAttribute("budget", request.resultBudget());

            Optional<SearchResult> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                span.addEvent("cache.hit");
                span.setStatus(Span.SpanStatus.OK);
                log.debug("Serving '{}' from cache", normalizedCompany);
                return cached.get().asCachedFor(request);
            }
            metrics.recordCacheMiss();

            try {
                SearchResult result = execute(request, correlationId, started, span);
                if (!result.isPartial()) {
                    cache.put(cacheKey, result);
                }
                span.setAttribute("results", result.size());
                span.setAttribute("partial", result.isPartial());
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private SearchResult execute(SearchRequest request, String correlationId, long started, Span span) {
        FanOutSession session = new FanOutSession(new PeopleAggregator(keyBuilder, mergeRules), sources.size());
        List<Integer> eligible = selectEligible(session);
        if (eligible.isEmpty()) {
            List<ProviderReport> reports = session.reports();
            log.warn("No eligible sources for '{}': {}", request.company(), reports);
            throw new NoEligibleSourcesException("No eligible sources among " + sources.size() + " registered", reports);
        }

        log.info("Searching '{}' (title='{}', budget={}) across {} of {} sources",
                request.company(), request.title(), request.resultBudget(), eligible.size(), sources.size());

        long deadline = started + options.getSearchDeadline().toNanos();
        SourceQuery query = new SourceQuery(request.company(), request.title(),
                options.providerLimitFor(request.resultBudget()));
        Semaphore permits = new Semaphore(options.getMaxConcurrency());
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();
        List<Integer> dispatched = new ArrayList<>();
        boolean partial = false;

        for (int i = 0; i < eligible.size(); i++) {
            int slot = eligible.get(i);
            if (!acquire(permits, deadline)) {
                span.addEvent("deadline.reached");
                partial = true;
                log.warn("Search deadline reached before dispatching {} sources", eligible.size() - i);
                skipRemaining(session, eligible.subList(i, eligible.size()), ProviderOutcome.SKIPPED_DEADLINE,
                        "Search deadline reached");
                break;
            }
            // Checked after the permit so that every call settled so far is counted
            if (session.size() >= request.resultBudget()) {
                permits.release();
                span.addEvent("budget.reached");
                log.debug("Budget of {} reached, skipping {} remaining sources",
                        request.resultBudget(), eligible.size() - i);
                skipRemaining(session, eligible.subList(i, eligible.size()), ProviderOutcome.SKIPPED_BUDGET,
                        "Result budget reached");
                break;
            }
            inFlight.add(dispatch(slot, query, session, correlationId, permits));
            dispatched.add(slot);
        }

        if (!awaitAll(inFlight, deadline)) {
            span.addEvent("deadline.reached");
            partial = true;
        }
        session.close(slot -> new ProviderReport(sources.get(slot).id(), ProviderOutcome.ABANDONED, 0,
                Duration.ofNanos(System.nanoTime() - started), "Search deadline reached"));

        List<ProviderReport> reports = session.reports();
        if (!dispatched.isEmpty() && dispatched.stream()
                .allMatch(slot -> reportFor(reports, sources.get(slot).id()) == ProviderOutcome.UNAVAILABLE)) {
            log.warn("Every dispatched source reported itself unavailable for '{}'", request.company());
            throw new NoEligibleSourcesException("Every dispatched source is unavailable", reports);
        }

        return finish(request, session, reports, partial, started);
    }

    private List<Integer> selectEligible(FanOutSession session) {
        List<Integer> eligible = new ArrayList<>();
        for (int slot = 0; slot < sources.size(); slot++) {
            RegisteredSource source = sources.get(slot);
            if (!source.config().isEnabled()) {
                session.report(slot, ProviderReport.skipped(source.id(),
                        ProviderOutcome.SKIPPED_DISABLED_BY_CONFIG, "Disabled by configuration"));
            } else if (!isConfigured(source)) {
                session.report(slot, ProviderReport.skipped(source.id(),
                        ProviderOutcome.SKIPPED_NOT_CONFIGURED, "Not configured"));
            } else if (!healthTracker.isAvailable(source.id())) {
                session.report(slot, ProviderReport.skipped(source.id(),
                        ProviderOutcome.SKIPPED_DISABLED_BY_HEALTH, "Disabled after repeated failures"));
            } else {
                eligible.add(slot);
            }
        }
        return eligible;
    }

    private static boolean isConfigured(RegisteredSource source) {
        try {
            return source.provider().isConfigured();
        } catch (RuntimeException e) {
            log.warn("Source '{}' configuration check failed: {}", source.id(), e.getMessage());
            return false;
        }
    }

    private void skipRemaining(FanOutSession session, List<Integer> slots, ProviderOutcome outcome, String message) {
        for (int slot : slots) {
            session.report(slot, ProviderReport.skipped(sources.get(slot).id(), outcome, message));
            metrics.recordProviderCall(sources.get(slot).id(), outcome, Duration.ZERO);
        }
    }

    private static boolean acquire(Semaphore permits, long deadline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            return false;
        }
        try {
            return permits.tryAcquire(remaining, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Waits for every settled call until the deadline.
     *
     * @return false if the deadline expired first
     */
    private static boolean awaitAll(List<CompletableFuture<Void>> inFlight, long deadline) {
        if (inFlight.isEmpty()) {
            return true;
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]));
        try {
            all.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Search deadline reached with {} calls still running",
                    inFlight.stream().filter(f -> !f.isDone()).count());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("Unexpected failure while settling provider calls", e.getCause());
            return true;
        }
    }

    /**
     * Starts one provider call. The returned future completes once the call has been
     * settled (merged, reported, health updated) and its permit released.
     */
    private CompletableFuture<Void> dispatch(int slot, SourceQuery query, FanOutSession session,
                                             String correlationId, Semaphore permits) {
        RegisteredSource source = sources.get(slot);
        Duration timeout = source.config().getTimeout() != null
                ? source.config().getTimeout() : options.getProviderTimeout();
        long callStarted = System.nanoTime();

        CompletableFuture<List<PersonRecord>> call = new CompletableFuture<>();
        Future<?> running;
        try {
            running = executor.submit(() -> invoke(source, query, correlationId, call));
        } catch (RejectedExecutionException e) {
            running = CompletableFuture.completedFuture(null);
            call.completeExceptionally(new ProviderUnavailableException(source.id(), "Finder is shutting down"));
        }
        Future<?> task = running;

        return call.orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS)
                .handle((records, error) -> {
                    try {
                        settle(slot, source, records, unwrap(error),
                                Duration.ofNanos(System.nanoTime() - callStarted), session, task);
                    } finally {
                        permits.release();
                    }
                    return null;
                });
    }

    private void invoke(RegisteredSource source, SourceQuery query, String correlationId,
                        CompletableFuture<List<PersonRecord>> call) {
        try (LogContext ctx = LogContext.forProvider(correlationId, source.id());
             Span span = tracing.startSpan("finder.provider", Map.of("source", source.id()))) {
            try {
                List<PersonRecord> records = source.provider().search(query);
                List<PersonRecord> result = records != null ? records : List.of();
                span.setAttribute("records", result.size());
                span.setStatus(Span.SpanStatus.OK);
                call.complete(result);
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                call.completeExceptionally(e);
            } catch (Error e) {
                call.completeExceptionally(e);
                throw e;
            }
        }
    }

    private void settle(int slot, RegisteredSource source, List<PersonRecord> records, Throwable error,
                        Duration latency, FanOutSession session, Future<?> running) {
        String id = source.id();
        ProviderReport report;
        if (error == null) {
            ProviderOutcome outcome = records.isEmpty() ? ProviderOutcome.EMPTY : ProviderOutcome.SUCCESS;
            report = new ProviderReport(id, outcome, records.size(), latency, null);
            healthTracker.recordSuccess(id, latency);
            if (!session.deliver(slot, records, report)) {
                log.info("Discarding {} records from '{}' that arrived after the search deadline", records.size(), id);
                metrics.recordProviderCall(id, ProviderOutcome.ABANDONED, latency);
                return;
            }
            log.debug("Source '{}' returned {} records in {} ms", id, records.size(), latency.toMillis());
        } else if (error instanceof TimeoutException) {
            running.cancel(true);
            healthTracker.recordFailure(id, latency);
            report = new ProviderReport(id, ProviderOutcome.TIMED_OUT, 0, latency,
                    "Timed out after " + latency.toMillis() + " ms");
            log.warn("Source '{}' timed out after {} ms", id, latency.toMillis());
            session.report(slot, report);
        } else if (error instanceof ProviderUnavailableException) {
            report = new ProviderReport(id, ProviderOutcome.UNAVAILABLE, 0, latency, error.getMessage());
            log.info("Source '{}' unavailable: {}", id, error.getMessage());
            session.report(slot, report);
        } else {
            healthTracker.recordFailure(id, latency);
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            report = new ProviderReport(id, ProviderOutcome.FAILED, 0, latency, message);
            log.warn("Source '{}' failed: {}", id, message);
            log.debug("Source '{}' failure detail", id, error);
            session.report(slot, report);
        }
        metrics.recordProviderCall(id, report.outcome(), latency);
    }

    private SearchResult finish(SearchRequest request, FanOutSession session, List<ProviderReport> reports,
                                boolean partial, long started) {
        PeopleAggregator aggregator = session.aggregator();
        List<CanonicalPerson> people = aggregator.all();
        AggregationStats aggregation = aggregator.stats();

        categorizer.categorizeAll(people, request.title());
        Map<PersonCategory, Integer> categoryCounts = PersonCategorizer.countByCategory(people);
        people.sort(RANKING);
        List<CanonicalPerson> ranked = people.size() > request.resultBudget()
                ? people.subList(0, request.resultBudget()) : people;

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        SearchStats stats = new SearchStats(
                aggregation.totalUnique(),
                aggregation.multiSourceMatches(),
                aggregation.bySource(),
                aggregation.droppedRecords(),
                aggregation.mergedRecords(),
                categoryCounts,
                reports,
                healthTracker.snapshot(),
                partial,
                false,
                elapsed);

        metrics.incrementRecordsDropped(aggregation.droppedRecords());
        metrics.incrementIdentitiesMerged(aggregation.mergedRecords());
        metrics.recordResultCount(ranked.size());
        metrics.recordSearchDuration(elapsed, partial);

        log.info("Search for '{}' finished in {} ms: {} unique, {} multi-source, {} returned{}",
                request.company(), elapsed.toMillis(), aggregation.totalUnique(),
                aggregation.multiSourceMatches(), ranked.size(), partial ? " (partial)" : "");
        return new SearchResult(request, ranked, stats);
    }

    private static ProviderOutcome reportFor(List<ProviderReport> reports, String sourceId) {
        for (ProviderReport report : reports) {
            if (report.sourceId().equals(sourceId)) {
                return report.outcome();
            }
        }
        return null;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public SourceHealthTracker getHealthTracker() {
        return healthTracker;
    }

    public SearchCache getCache() {
        return cache;
    }

    public FinderOptions getOptions() {
        return options;
    }

    public CompanyNameNormalizer getNormalizer() {
        return normalizer;
    }

    /**
     * Configuration of every registered source, in dispatch order.
     */
    public List<SourceConfig> getSources() {
        return sources.stream().map(RegisteredSource::config).toList();
    }

    /**
     * Manually re-enables a source and drops cached searches, which may lack its results.
     */
    public void resetSource(String sourceId) {
        healthTracker.reset(sourceId);
        cache.invalidateAll();
    }

    /**
     * Health checks covering this finder's sources.
     */
    public HealthCheckRegistry healthChecks() {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new SourceHealthCheck(healthTracker));
        return registry;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("ConnectionFinder closed");
    }

    private record RegisteredSource(SourceProvider provider, SourceConfig config) {
        String id() {
            return config.getId();
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger FINDERS = new AtomicInteger();

        private final int finder = FINDERS.incrementAndGet();
        private final AtomicInteger threads = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "connection-finder-" + finder + "-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private final Map<String, SourceProvider> providers = new LinkedHashMap<>();
        private final Map<String, SourceConfig> sourceConfigs = new LinkedHashMap<>();
        private FinderOptions options = FinderOptions.defaults();
        private SourceHealthTracker healthTracker;
        private HealthPolicy healthPolicy;
        private CompanyNameNormalizer normalizer;
        private ParentCompanyMapping extraParents = ParentCompanyMapping.empty();
        private MergeRules mergeRules = MergeRules.defaults();
        private PersonCategorizer categorizer = DefaultCategoryRules.createDefaultCategorizer();
        private SearchCache cache;
        private CacheConfig cacheConfig;
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();

        private Builder() {
        }

        /**
         * Registers a provider with default configuration, unless a configuration for its
         * id has been supplied.
         */
        public Builder source(SourceProvider provider) {
            Objects.requireNonNull(provider, "provider is required");
            registerProvider(provider);
            return this;
        }

        public Builder source(SourceProvider provider, SourceConfig config) {
            Objects.requireNonNull(provider, "provider is required");
            Objects.requireNonNull(config, "config is required");
            if (!provider.id().equals(config.getId())) {
                throw new IllegalArgumentException("Config id '" + config.getId() +
                        "' does not match provider id '" + provider.id() + "'");
            }
            registerProvider(provider);
            sourceConfigs.put(config.getId(), config);
            return this;
        }

        private void registerProvider(SourceProvider provider) {
            String id = Objects.requireNonNull(provider.id(), "provider id is required");
            if (providers.putIfAbsent(id, provider) != null) {
                throw new IllegalArgumentException("Duplicate source id '" + id + "'");
            }
        }

        public Builder options(FinderOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder healthTracker(SourceHealthTracker healthTracker) {
            this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker is required");
            return this;
        }

        /**
         * Thresholds for the tracker created at build time. Ignored when a tracker is supplied.
         */
        public Builder healthPolicy(HealthPolicy healthPolicy) {
            this.healthPolicy = Objects.requireNonNull(healthPolicy, "healthPolicy is required");
            return this;
        }

        public Builder normalizer(CompanyNameNormalizer normalizer) {
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
            return this;
        }

        public Builder mergeRules(MergeRules mergeRules) {
            this.mergeRules = Objects.requireNonNull(mergeRules, "mergeRules is required");
            return this;
        }

        public Builder categorizer(PersonCategorizer categorizer) {
            this.categorizer = Objects.requireNonNull(categorizer, "categorizer is required");
            return this;
        }

        public Builder cache(SearchCache cache) {
            this.cache = Objects.requireNonNull(cache, "cache is required");
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = Objects.requireNonNull(tracing, "tracing is required");
            return this;
        }

        /**
         * Applies externalized configuration: options, health policy, cache settings,
         * per-source configuration and extra parent-company aliases. Explicitly set
         * collaborators (tracker, normalizer, cache) take precedence.
         */
        public Builder config(FinderConfig config) {
            Objects.requireNonNull(config, "config is required");
            this.options = config.options();
            this.healthPolicy = config.healthPolicy();
            this.cacheConfig = config.cache();
            this.extraParents = config.parentCompanies();
            this.sourceConfigs.putAll(config.sources());
            return this;
        }

        public ConnectionFinder build() {
            if (providers.isEmpty()) {
                throw new IllegalStateException("At least one source is required");
            }

            List<RegisteredSource> registered = new ArrayList<>();
            for (SourceProvider provider : providers.values()) {
                SourceConfig config = sourceConfigs.getOrDefault(provider.id(), SourceConfig.defaults(provider.id()));
                registered.add(new RegisteredSource(provider, config));
            }
            for (String configured : sourceConfigs.keySet()) {
                if (!providers.containsKey(configured)) {
                    log.warn("Configuration for unknown source '{}' ignored", configured);
                }
            }
            registered.sort(Comparator.comparingInt((RegisteredSource s) -> s.config().getPriority())
                    .thenComparing(RegisteredSource::id));

            SourceHealthTracker tracker = healthTracker != null
                    ? healthTracker
                    : new SourceHealthTracker(healthPolicy != null ? healthPolicy : HealthPolicy.defaults());

            CompanyNameNormalizer resolvedNormalizer = normalizer != null
                    ? normalizer
                    : CompanySuffixRules.createDefaultNormalizer();
            if (extraParents.size() > 0) {
                resolvedNormalizer = resolvedNormalizer.withParentMapping(
                        resolvedNormalizer.getParentMapping().with(extraParents));
            }

            SearchCache resolvedCache = cache;
            if (resolvedCache == null) {
                resolvedCache = cacheConfig != null && cacheConfig.enabled()
                        ? new CaffeineSearchCache(cacheConfig)
                        : new NoOpSearchCache();
            }

            return new ConnectionFinder(this, registered, tracker, resolvedNormalizer, resolvedCache);
        }
    }
}
