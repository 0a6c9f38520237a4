package com.connection.finder.api;

import com.connection.finder.cache.CacheConfig;
import com.connection.finder.cache.CaffeineSearchCache;
import com.connection.finder.categorize.DefaultCategoryRules;
import com.connection.finder.config.FinderConfig;
import com.connection.finder.config.FinderConfigLoader;
import com.connection.finder.core.model.CanonicalPerson;
import com.connection.finder.core.model.PersonCategory;
import com.connection.finder.core.model.PersonField;
import com.connection.finder.core.model.PersonRecord;
import com.connection.finder.health.HealthPolicy;
import com.connection.finder.health.SourceHealthTracker;
import com.connection.finder.health.SourceStatus;
import com.connection.finder.metrics.MicrometerMetricsService;
import com.connection.finder.source.ProviderException;
import com.connection.finder.source.ProviderOutcome;
import com.connection.finder.source.SourceConfig;
import com.connection.finder.source.SourceQuery;
import com.connection.finder.source.StubSourceProvider;
import com.connection.finder.tracing.Span;
import com.connection.finder.tracing.TracingService;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static com.connection.finder.source.StubSourceProvider.people;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("ConnectionFinder Tests")
class ConnectionFinderTest {

    private final List<ConnectionFinder> finders = new ArrayList<>();
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        finders.forEach(ConnectionFinder::close);
    }

    private ConnectionFinder track(ConnectionFinder finder) {
        finders.add(finder);
        return finder;
    }

    private static SourceConfig priority(String id, int priority) {
        return SourceConfig.builder(id).priority(priority).build();
    }

    private static PersonRecord person(String source, String name, String company, double confidence) {
        return PersonRecord.builder()
                .name(name)
                .company(company)
                .source(source)
                .confidence(confidence)
                .build();
    }

    private static FinderOptions sequential() {
        return FinderOptions.builder().maxConcurrency(1).build();
    }

    @Nested
    @DisplayName("Aggregation across sources")
    class Aggregation {

        @Test
        @DisplayName("Same person from two sources should merge into one identity")
        void crossSourceMerge() {
            StubSourceProvider a = StubSourceProvider.returning("A", List.of(PersonRecord.builder()
                    .name("John Doe").company("Acme Inc").title("Engineer").source("A").confidence(0.5).build()));
            StubSourceProvider b = StubSourceProvider.returning("B", List.of(PersonRecord.builder()
                    .name("john doe").company("ACME").source("B").confidence(0.6)
                    .field(PersonField.EMAIL, "jd@acme.com").build()));

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a, priority("A", 1))
                    .source(b, priority("B", 2))
                    .options(sequential())
                    .build());

            SearchResult result = finder.search("Acme", null, 10);

            assertEquals(1, result.size());
            CanonicalPerson john = result.getPeople().get(0);
            assertEquals("John Doe", john.getName());
            assertEquals(List.of("A", "B"), new ArrayList<>(john.getSources()));
            assertEquals(0.7, john.getConfidence(), 1e-9);
            assertEquals("Engineer", john.getTitle());
            assertEquals("jd@acme.com", john.getEmail());

            SearchStats stats = result.getStats();
            assertEquals(1, stats.totalUnique());
            assertEquals(1, stats.multiSourceMatches());
            assertEquals(1, stats.mergedRecords());
            assertEquals(Map.of("A", 1, "B", 1), stats.bySource());
            assertFalse(result.isPartial());
            assertFalse(result.isFromCache());
        }

        @Test
        @DisplayName("Subsidiary names should resolve to the parent and merge")
        void parentCompanyMerge() {
            StubSourceProvider a = StubSourceProvider.returning("A", List.of(
                    person("A", "John Doe", "Meta Platforms Inc", 0.5)));
            StubSourceProvider b = StubSourceProvider.returning("B", List.of(PersonRecord.builder()
                    .name("john doe").company("Facebook LLC").source("B").confidence(0.6)
                    .title("Engineering Manager").build()));

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a, priority("A", 1))
                    .source(b, priority("B", 2))
                    .options(sequential())
                    .build());

            SearchResult result = finder.search("Meta", "Software Engineer", 10);

            assertEquals(1, result.size());
            CanonicalPerson john = result.getPeople().get(0);
            assertEquals("meta", john.getNormalizedCompany());
            assertEquals("Engineering Manager", john.getTitle());
            assertEquals(0.7, john.getConfidence(), 1e-9);
            assertEquals(Set.of("A", "B"), john.getSources());
            assertEquals(PersonCategory.MANAGER, john.getCategory());
        }

        @Test
        @DisplayName("Malformed records should be dropped and counted")
        void droppedRecords() {
            StubSourceProvider a = StubSourceProvider.returning("A", List.of(
                    person("A", "Ada Lovelace", "Acme", 0.5),
                    person("A", "  ", "Acme", 0.5),
                    person("A", "Grace Hopper", null, 0.5)));

            ConnectionFinder finder = track(ConnectionFinder.builder().source(a).build());

            SearchResult result = finder.search("Acme", null, 10);

            assertEquals(1, result.size());
            assertEquals(2, result.getStats().droppedRecords());
        }

        @Test
        @DisplayName("A provider returning nothing should yield an empty result, not an error")
        void zeroMatches() {
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.returning("A", List.of()))
                    .source(StubSourceProvider.returning("B", null))
                    .build());

            SearchResult result = finder.search("Nobody Corp", null, 10);

            assertTrue(result.isEmpty());
            assertEquals(2, result.getStats().countOutcome(ProviderOutcome.EMPTY));
            assertEquals(SourceStatus.HEALTHY, result.getStats().health().get("A").status());
        }
    }

    @Nested
    @DisplayName("Ranking and categorization")
    class Ranking {

        @Test
        @DisplayName("People should be ranked by confidence, then source count, then name")
        void rankingOrder() {
            StubSourceProvider a = StubSourceProvider.returning("A", List.of(
                    person("A", "Zed", "Acme", 0.9),
                    person("A", "Carl", "Acme", 0.5),
                    person("A", "amy", "Acme", 0.5),
                    person("A", "Bob", "Acme", 0.3)));
            StubSourceProvider b = StubSourceProvider.returning("B", List.of(
                    person("B", "Bob", "Acme", 0.7),
                    person("B", "Dan", "Acme", 0.7)));

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a, priority("A", 1))
                    .source(b, priority("B", 2))
                    .options(sequential())
                    .build());

            SearchResult result = finder.search("Acme", null, 10);

            List<String> names = result.getPeople().stream().map(CanonicalPerson::getName).toList();
            assertEquals(List.of("Zed", "Bob", "Dan", "amy", "Carl"), names);
        }

        @Test
        @DisplayName("Each person should be categorized against the target title")
        void categorization() {
            StubSourceProvider a = StubSourceProvider.returning("A", List.of(
                    PersonRecord.builder().name("Rita").company("Acme").source("A").title("Technical Recruiter").build(),
                    PersonRecord.builder().name("Max").company("Acme").source("A").title("Engineering Manager").build(),
                    PersonRecord.builder().name("Pia").company("Acme").source("A").title("Software Engineer").build(),
                    PersonRecord.builder().name("Sam").company("Acme").source("A").title("Principal Engineer").build(),
                    PersonRecord.builder().name("Gus").company("Acme").source("A").title("Gardener").build()));

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a)
                    .categorizer(DefaultCategoryRules.createTitleAwareCategorizer())
                    .build());

            SearchResult result = finder.search("Acme", "Software Engineer II", 10);

            Map<PersonCategory, List<CanonicalPerson>> grouped = result.byCategory();
            assertEquals(PersonCategory.values().length, grouped.size());
            assertEquals("Rita", grouped.get(PersonCategory.RECRUITER).get(0).getName());
            assertEquals("Max", grouped.get(PersonCategory.MANAGER).get(0).getName());
            assertEquals("Pia", grouped.get(PersonCategory.PEER).get(0).getName());
            assertEquals("Sam", grouped.get(PersonCategory.SENIOR).get(0).getName());
            assertEquals("Gus", grouped.get(PersonCategory.UNKNOWN).get(0).getName());
            assertEquals(1, result.getStats().categoryCounts().get(PersonCategory.RECRUITER));
        }

        @Test
        @DisplayName("The default categorizer should match plural and derived titles by keyword")
        void keywordCategorization() {
            StubSourceProvider a = StubSourceProvider.returning("A", List.of(
                    PersonRecord.builder().name("Rita").company("Acme").source("A").title("Technical Recruiters").build(),
                    PersonRecord.builder().name("Max").company("Acme").source("A").title("Engineering Managers").build(),
                    PersonRecord.builder().name("Pia").company("Acme").source("A").title("Software Engineering Internship").build(),
                    PersonRecord.builder().name("Sam").company("Acme").source("A").title("Engineering Leadership").build(),
                    PersonRecord.builder().name("Gus").company("Acme").source("A").title("Software Engineer").build()));

            ConnectionFinder finder = track(ConnectionFinder.builder().source(a).build());

            Map<PersonCategory, List<CanonicalPerson>> grouped =
                    finder.search("Acme", "Software Engineer", 10).byCategory();
            assertEquals("Rita", grouped.get(PersonCategory.RECRUITER).get(0).getName());
            assertEquals("Max", grouped.get(PersonCategory.MANAGER).get(0).getName());
            assertEquals("Pia", grouped.get(PersonCategory.PEER).get(0).getName());
            assertEquals("Sam", grouped.get(PersonCategory.SENIOR).get(0).getName());
            assertEquals("Gus", grouped.get(PersonCategory.UNKNOWN).get(0).getName());
        }
    }

    @Nested
    @DisplayName("Result budget")
    class Budget {

        @Test
        @DisplayName("Sources after the budget is met should be skipped and the result truncated")
        void budgetSkipsRemaining() {
            StubSourceProvider a = StubSourceProvider.withPeople("A", "Acme", "A1", "A2", "A3", "A4");
            StubSourceProvider b = StubSourceProvider.withPeople("B", "Acme", "B1", "B2", "B3", "B4");
            StubSourceProvider c = StubSourceProvider.withPeople("C", "Acme", "C1", "C2", "C3", "C4");

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a, priority("A", 1))
                    .source(b, priority("B", 2))
                    .source(c, priority("C", 3))
                    .options(sequential())
                    .build());

            SearchResult result = finder.search("Acme", null, 5);

            assertEquals(5, result.size());
            assertEquals(8, result.getStats().totalUnique());
            assertEquals(ProviderOutcome.SKIPPED_BUDGET, result.getStats().reportFor("C").orElseThrow().outcome());
            assertEquals(0, c.getCalls());
            assertFalse(result.isPartial());
        }

        @Test
        @DisplayName("Providers should receive the budget as limit unless a provider limit is set")
        void providerLimit() {
            StubSourceProvider a = StubSourceProvider.withPeople("A", "Acme", "Ada");
            ConnectionFinder finder = track(ConnectionFinder.builder().source(a).build());
            finder.search("Acme", "Engineer", 7);

            SourceQuery query = a.getQueries().get(0);
            assertEquals("Acme", query.company());
            assertEquals("Engineer", query.title());
            assertEquals(7, query.limit());

            StubSourceProvider b = StubSourceProvider.withPeople("B", "Acme", "Ada");
            ConnectionFinder limited = track(ConnectionFinder.builder()
                    .source(b)
                    .options(FinderOptions.builder().providerLimit(50).build())
                    .build());
            limited.search("Acme", null, 7);

            assertEquals(50, b.getQueries().get(0).limit());
        }
    }

    @Nested
    @DisplayName("Source selection and health")
    class Selection {

        @Test
        @DisplayName("Repeated failures should disable a source without failing the search")
        void failingSourceDisabled() {
            StubSourceProvider failing = StubSourceProvider.failing("F", new ProviderException("F", "HTTP 500"));
            StubSourceProvider good = StubSourceProvider.withPeople("G", "Acme", "Ada");

            ConnectionFinder finder = track(ConnectionFinder.builder().source(failing).source(good).build());

            SearchResult first = finder.search("Acme", null, 10);
            assertEquals(1, first.size());
            ProviderReport report = first.getStats().reportFor("F").orElseThrow();
            assertEquals(ProviderOutcome.FAILED, report.outcome());
            assertEquals("HTTP 500", report.message());
            assertEquals(SourceStatus.DEGRADED, first.getStats().health().get("F").status());

            for (int i = 0; i < 4; i++) {
                finder.search("Acme", null, 10);
            }
            assertEquals(SourceStatus.DISABLED, finder.getHealthTracker().status("F").status());

            SearchResult sixth = finder.search("Acme", null, 10);
            assertEquals(ProviderOutcome.SKIPPED_DISABLED_BY_HEALTH,
                    sixth.getStats().reportFor("F").orElseThrow().outcome());
            assertEquals(5, failing.getCalls());
            assertEquals(6, good.getCalls());
            assertTrue(finder.healthChecks().checkAll().isDegraded());
        }

        @Test
        @DisplayName("resetSource() should make a disabled source eligible again")
        void resetSource() {
            StubSourceProvider failing = StubSourceProvider.failing("F", new ProviderException("F", "HTTP 500"));
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(failing)
                    .source(StubSourceProvider.withPeople("G", "Acme", "Ada"))
                    .healthPolicy(HealthPolicy.builder().degradedAfter(1).failingAfter(1).disabledAfter(1).build())
                    .build());

            finder.search("Acme", null, 10);
            assertFalse(finder.getHealthTracker().isAvailable("F"));

            finder.resetSource("F");
            finder.search("Acme", null, 10);

            assertEquals(2, failing.getCalls());
        }

        @Test
        @DisplayName("Disabled and unconfigured sources should be reported and never invoked")
        void skippedSources() {
            StubSourceProvider off = StubSourceProvider.withPeople("off", "Acme", "Ada");
            StubSourceProvider unconfigured = StubSourceProvider.notConfigured("nokey");
            StubSourceProvider good = StubSourceProvider.withPeople("good", "Acme", "Ada");

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(off, SourceConfig.builder("off").enabled(false).build())
                    .source(unconfigured)
                    .source(good)
                    .build());

            SearchStats stats = finder.search("Acme", null, 10).getStats();

            assertEquals(ProviderOutcome.SKIPPED_DISABLED_BY_CONFIG, stats.reportFor("off").orElseThrow().outcome());
            assertEquals(ProviderOutcome.SKIPPED_NOT_CONFIGURED, stats.reportFor("nokey").orElseThrow().outcome());
            assertEquals(ProviderOutcome.SUCCESS, stats.reportFor("good").orElseThrow().outcome());
            assertEquals(0, off.getCalls());
            assertEquals(0, unconfigured.getCalls());
            assertEquals(3, stats.providerReports().size());
        }

        @Test
        @DisplayName("No eligible source should raise NoEligibleSourcesException")
        void noEligibleSources() {
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.notConfigured("A"))
                    .source(StubSourceProvider.withPeople("B", "Acme", "Ada"),
                            SourceConfig.builder("B").enabled(false).build())
                    .build());

            NoEligibleSourcesException e = assertThrows(NoEligibleSourcesException.class,
                    () -> finder.search("Acme", null, 10));
            assertEquals(2, e.getReports().size());
            assertTrue(e.getReports().stream().allMatch(r -> r.outcome().isSkipped()));
        }

        @Test
        @DisplayName("Unavailable sources should be reported without a health penalty")
        void unavailableNoPenalty() {
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.unavailable("U"))
                    .source(StubSourceProvider.withPeople("G", "Acme", "Ada"))
                    .build());

            SearchResult result = finder.search("Acme", null, 10);

            assertEquals(1, result.size());
            assertEquals(ProviderOutcome.UNAVAILABLE, result.getStats().reportFor("U").orElseThrow().outcome());
            assertEquals(SourceStatus.HEALTHY, finder.getHealthTracker().status("U").status());
        }

        @Test
        @DisplayName("Every dispatched source unavailable should raise NoEligibleSourcesException")
        void allUnavailable() {
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.unavailable("U1"))
                    .source(StubSourceProvider.unavailable("U2"))
                    .build());

            NoEligibleSourcesException e = assertThrows(NoEligibleSourcesException.class,
                    () -> finder.search("Acme", null, 10));
            assertTrue(e.getReports().stream().allMatch(r -> r.outcome() == ProviderOutcome.UNAVAILABLE));
            assertEquals(SourceStatus.HEALTHY, finder.getHealthTracker().status("U1").status());
        }

        @Test
        @DisplayName("A shared health tracker should carry state across finders")
        void sharedTracker() {
            SourceHealthTracker tracker = new SourceHealthTracker();
            for (int i = 0; i < 5; i++) {
                tracker.recordFailure("A");
            }
            StubSourceProvider a = StubSourceProvider.withPeople("A", "Acme", "Ada");

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a)
                    .source(StubSourceProvider.withPeople("B", "Acme", "Bea"))
                    .healthTracker(tracker)
                    .build());
            finder.search("Acme", null, 10);

            assertEquals(0, a.getCalls());
            assertSame(tracker, finder.getHealthTracker());
        }
    }

    @Nested
    @DisplayName("Timeouts and deadline")
    class Timing {

        @Test
        @DisplayName("A slow source should time out and degrade without blocking others")
        void providerTimeout() {
            StubSourceProvider slow = StubSourceProvider.sleeping("slow", Duration.ofSeconds(5),
                    people("slow", "Acme", "Late Larry"));
            StubSourceProvider fast = StubSourceProvider.withPeople("fast", "Acme", "Ada");

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(slow, SourceConfig.builder("slow").timeout(Duration.ofMillis(100)).build())
                    .source(fast)
                    .build());

            SearchResult result = finder.search("Acme", null, 10);

            assertEquals(List.of("Ada"), result.getPeople().stream().map(CanonicalPerson::getName).toList());
            assertEquals(ProviderOutcome.TIMED_OUT, result.getStats().reportFor("slow").orElseThrow().outcome());
            assertEquals(SourceStatus.DEGRADED, finder.getHealthTracker().status("slow").status());
            assertFalse(result.isPartial());
        }

        @Test
        @DisplayName("The search deadline should return a partial result and abandon running calls")
        void searchDeadline() {
            StubSourceProvider blocked = StubSourceProvider.blocking("blocked", release,
                    people("blocked", "Acme", "Never Seen"));
            StubSourceProvider fast = StubSourceProvider.withPeople("fast", "Acme", "Ada");

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(blocked)
                    .source(fast)
                    .options(FinderOptions.builder()
                            .searchDeadline(Duration.ofMillis(300))
                            .providerTimeout(Duration.ofSeconds(30))
                            .build())
                    .cache(new CaffeineSearchCache(CacheConfig.defaults()))
                    .build());

            SearchResult result = finder.search("Acme", null, 10);

            assertTrue(result.isPartial());
            assertEquals(1, result.size());
            assertEquals(ProviderOutcome.ABANDONED, result.getStats().reportFor("blocked").orElseThrow().outcome());
            assertEquals(ProviderOutcome.SUCCESS, result.getStats().reportFor("fast").orElseThrow().outcome());

            SearchResult again = finder.search("Acme", null, 10);
            assertFalse(again.isFromCache());
            assertEquals(2, fast.getCalls());
        }

        @Test
        @DisplayName("No more than maxConcurrency calls should run at once")
        void maxConcurrency() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            ConnectionFinder.Builder builder = ConnectionFinder.builder()
                    .options(FinderOptions.builder().maxConcurrency(2).build());
            for (int i = 0; i < 6; i++) {
                String id = "S" + i;
                builder.source(StubSourceProvider.of(id, query -> {
                    peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(50);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        running.decrementAndGet();
                    }
                    return people(id, "Acme", "Person " + id);
                }));
            }
            ConnectionFinder finder = track(builder.build());

            SearchResult result = finder.search("Acme", null, 100);

            assertEquals(6, result.size());
            assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Aliases of the same company should be served from the cache")
        void cacheHitAcrossAliases() {
            StubSourceProvider a = StubSourceProvider.withPeople("A", "Meta", "Ada");
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a)
                    .cache(new CaffeineSearchCache(CacheConfig.defaults()))
                    .metrics(new MicrometerMetricsService(registry))
                    .build());

            SearchResult first = finder.search("Meta", null, 10);
            SearchResult second = finder.search("Facebook, Inc.", null, 10);

            assertFalse(first.isFromCache());
            assertTrue(second.isFromCache());
            assertEquals(1, a.getCalls());
            assertEquals(first.size(), second.size());
            assertEquals("Meta", first.getRequest().company());
            assertEquals("Facebook, Inc.", second.getRequest().company());
            assertEquals(1.0, registry.find("finder.cache.hit").counter().count());
            assertEquals(1.0, registry.find("finder.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Different titles or budgets should not share cache entries")
        void cacheKeyIncludesTitleAndBudget() {
            StubSourceProvider a = StubSourceProvider.withPeople("A", "Acme", "Ada");
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(a)
                    .cache(new CaffeineSearchCache(CacheConfig.defaults()))
                    .build());

            finder.search("Acme", null, 10);
            finder.search("Acme", "Engineer", 10);
            finder.search("Acme", null, 5);
            finder.search("Acme Inc", null, 10);

            assertEquals(3, a.getCalls());
        }

        @Test
        @DisplayName("Mutating a returned result should not affect the cached copy")
        void cachedCopiesAreIndependent() {
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.withPeople("A", "Acme", "Ada"))
                    .cache(new CaffeineSearchCache(CacheConfig.defaults()))
                    .build());

            SearchResult first = finder.search("Acme", null, 10);
            first.getPeople().get(0).setConfidence(0.01);

            SearchResult second = finder.search("Acme", null, 10);
            assertEquals(0.5, second.getPeople().get(0).getConfidence(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("Provider calls and search duration should be recorded")
        void metricsRecorded() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.withPeople("A", "Acme", "Ada", "Bea"))
                    .source(StubSourceProvider.failing("F", new ProviderException("F", "boom")))
                    .metrics(new MicrometerMetricsService(registry))
                    .build());

            finder.search("Acme", null, 10);

            Timer success = registry.find("finder.provider.call").tag("source", "A").tag("outcome", "SUCCESS").timer();
            Timer failed = registry.find("finder.provider.call").tag("source", "F").tag("outcome", "FAILED").timer();
            Timer search = registry.find("finder.search.duration").tag("partial", "false").timer();
            assertNotNull(success);
            assertEquals(1, success.count());
            assertNotNull(failed);
            assertEquals(1, failed.count());
            assertNotNull(search);
            assertEquals(1, search.count());
            assertEquals(2.0, registry.find("finder.search.results").summary().totalAmount());
        }

        @Test
        @DisplayName("Spans should be started for the search and each provider call")
        void tracingSpans() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startSpan(anyString(), anyMap())).thenReturn(span);

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.withPeople("A", "Acme", "Ada"))
                    .source(StubSourceProvider.withPeople("B", "Acme", "Bea"))
                    .tracing(tracing)
                    .build());

            finder.search("Acme Inc", null, 10);

            verify(tracing).startSpan(eq("finder.search"), anyMap());
            verify(tracing, times(2)).startSpan(eq("finder.provider"), anyMap());
            verify(span).setAttribute("budget", 10L);
            verify(span, atLeastOnce()).setStatus(Span.SpanStatus.OK);
            verify(span, times(3)).close();
        }

        @Test
        @DisplayName("A failed search should mark its span as errored")
        void tracingError() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startSpan(anyString(), anyMap())).thenReturn(span);

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.notConfigured("A"))
                    .tracing(tracing)
                    .build());

            assertThrows(NoEligibleSourcesException.class, () -> finder.search("Acme", null, 10));
            verify(span).recordException(any(NoEligibleSourcesException.class));
            verify(span).setStatus(Span.SpanStatus.ERROR);
        }
    }

    @Nested
    @DisplayName("Configuration and lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Invalid queries should be rejected before any provider runs")
        void invalidQuery() {
            StubSourceProvider a = StubSourceProvider.withPeople("A", "Acme", "Ada");
            ConnectionFinder finder = track(ConnectionFinder.builder().source(a).build());

            assertThrows(InvalidQueryException.class, () -> finder.search("  ", null, 10));
            assertThrows(InvalidQueryException.class, () -> finder.search("Acme", null, 0));
            assertThrows(InvalidQueryException.class, () -> finder.search(null, null, 10));
            assertEquals(0, a.getCalls());
        }

        @Test
        @DisplayName("Loaded configuration should drive sources, options and parent companies")
        void appliesConfig() {
            String json = """
                    {
                      "options": { "maxConcurrency": 1, "providerLimit": 25 },
                      "health": { "disabledAfter": 2, "failingAfter": 2 },
                      "cache": { "enabled": true },
                      "sources": [
                        { "id": "B", "priority": 1 },
                        { "id": "A", "priority": 2, "timeoutMs": 500 },
                        { "id": "C", "enabled": false }
                      ],
                      "parentCompanies": { "initech": ["initrode"] }
                    }
                    """;
            FinderConfig config = new FinderConfigLoader()
                    .load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

            StubSourceProvider a = StubSourceProvider.withPeople("A", "Initech", "Ada");
            StubSourceProvider b = StubSourceProvider.withPeople("B", "Initrode LLC", "ada");
            StubSourceProvider c = StubSourceProvider.withPeople("C", "Initech", "Cat");

            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .config(config)
                    .source(a).source(b).source(c)
                    .build());

            assertEquals(List.of("B", "A", "C"),
                    finder.getSources().stream().map(SourceConfig::getId).toList());
            assertEquals(Duration.ofMillis(500), finder.getSources().get(1).getTimeout());
            assertEquals(1, finder.getOptions().getMaxConcurrency());
            assertEquals("initech", finder.getNormalizer().normalize("Initrode LLC"));
            assertEquals(2, finder.getHealthTracker().getPolicy().getDisabledAfter());

            SearchResult result = finder.search("Initech", null, 10);

            assertEquals(1, result.size());
            assertEquals(Set.of("A", "B"), result.getPeople().get(0).getSources());
            assertEquals(ProviderOutcome.SKIPPED_DISABLED_BY_CONFIG, result.getStats().reportFor("C").orElseThrow().outcome());
            assertEquals(25, a.getQueries().get(0).limit());
            assertTrue(finder.search("Initrode", null, 10).isFromCache());
        }

        @Test
        @DisplayName("Builder should reject missing and duplicate sources")
        void builderValidation() {
            assertThrows(IllegalStateException.class, () -> ConnectionFinder.builder().build());
            assertThrows(IllegalArgumentException.class, () -> ConnectionFinder.builder()
                    .source(StubSourceProvider.withPeople("A", "Acme"))
                    .source(StubSourceProvider.withPeople("A", "Acme")));
            assertThrows(IllegalArgumentException.class, () -> ConnectionFinder.builder()
                    .source(StubSourceProvider.withPeople("A", "Acme"), SourceConfig.defaults("B")));
        }

        @Test
        @DisplayName("Searching a closed finder should fail")
        void closedFinder() {
            ConnectionFinder finder = ConnectionFinder.builder()
                    .source(StubSourceProvider.withPeople("A", "Acme", "Ada"))
                    .build();
            finder.close();
            finder.close();

            assertThrows(IllegalStateException.class, () -> finder.search("Acme", null, 10));
        }

        @Test
        @DisplayName("Health checks should report tracked sources")
        void healthChecks() {
            ConnectionFinder finder = track(ConnectionFinder.builder()
                    .source(StubSourceProvider.withPeople("A", "Acme", "Ada"))
                    .build());

            assertTrue(finder.healthChecks().checkAll().isUp());
        }
    }
}
