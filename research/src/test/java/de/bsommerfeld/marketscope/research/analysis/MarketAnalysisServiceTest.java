package de.bsommerfeld.marketscope.research.analysis;

import de.bsommerfeld.marketscope.core.config.ResearchConfig;
import de.bsommerfeld.marketscope.core.config.StoreConfig;
import de.bsommerfeld.marketscope.core.domain.TelemetryEvent;
import de.bsommerfeld.marketscope.db.AnalysisCache;
import de.bsommerfeld.marketscope.db.ResearchDatabase;
import de.bsommerfeld.marketscope.db.TelemetryLog;
import de.bsommerfeld.marketscope.research.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the service against a real SQLite file so cache hits, TTL and
 * telemetry go through the actual store.
 */
class MarketAnalysisServiceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private AnalysisCache cache;
    private TelemetryLog telemetry;
    private StoreConfig storeConfig;
    private ResearchConfig researchConfig;
    private MarketAnalysisService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        ResearchDatabase database = new ResearchDatabase(tempDir.resolve("research.db"));
        storeConfig = new StoreConfig();
        researchConfig = new ResearchConfig();
        cache = new AnalysisCache(database, clock, storeConfig);
        telemetry = new TelemetryLog(database, clock);
        service = new MarketAnalysisService(cache, telemetry, storeConfig, researchConfig);
    }

    // -- Cache-first --

    @Test
    void analyze_shouldComputeAndCacheOnMiss() {
        AtomicInteger calls = new AtomicInteger();
        AnalysisProvider provider = (subject, kind, params) -> {
            calls.incrementAndGet();
            return "analysis of " + subject;
        };

        AnalysisResult first = service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider);
        AnalysisResult second = service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider);

        assertEquals(AnalysisResult.Origin.COMPUTED, first.origin());
        assertEquals(AnalysisResult.Origin.CACHE, second.origin());
        assertTrue(second.fromCache());
        assertEquals("analysis of Solar", second.payload());
        assertEquals(1, calls.get());
    }

    @Test
    void analyze_shouldRecomputeAfterTtlElapsed() {
        AtomicInteger calls = new AtomicInteger();
        AnalysisProvider provider = (subject, kind, params) -> "run " + calls.incrementAndGet();

        service.analyze("Solar", AnalysisKind.METRICS, Map.of(), provider);
        clock.advance(Duration.ofHours(storeConfig.getCacheTtlHours()).plusSeconds(1));
        AnalysisResult later = service.analyze("Solar", AnalysisKind.METRICS, Map.of(), provider);

        assertEquals(AnalysisResult.Origin.COMPUTED, later.origin());
        assertEquals("run 2", later.payload());
    }

    @Test
    void analyze_shouldKeepParameterSetsApart() {
        AnalysisProvider provider = (subject, kind, params) -> "region " + params.get("region");

        service.analyze("Solar", AnalysisKind.VERTICAL, Map.of("region", "EU"), provider);
        AnalysisResult us = service.analyze("Solar", AnalysisKind.VERTICAL, Map.of("region", "US"), provider);

        assertEquals(AnalysisResult.Origin.COMPUTED, us.origin());
        assertEquals("region US", us.payload());
    }

    @Test
    void analyze_shouldNotCacheBlankResult() {
        AtomicInteger calls = new AtomicInteger();
        AnalysisProvider provider = (subject, kind, params) -> {
            calls.incrementAndGet();
            return "  ";
        };

        service.analyze("Solar", AnalysisKind.MERGERS, Map.of(), provider);
        AnalysisResult second = service.analyze("Solar", AnalysisKind.MERGERS, Map.of(), provider);

        assertFalse(second.fromCache());
        assertEquals(2, calls.get());
        assertTrue(cache.get("Solar", "mergers", Map.of()).isEmpty());
    }

    @Test
    void analyze_shouldLogTelemetryForComputedResult() {
        service.analyze("Solar", AnalysisKind.TOP_COMPANIES, Map.of(), (s, k, p) -> "12345", "session-1");

        List<TelemetryEvent> events = telemetry.recent(10);
        assertEquals(1, events.size());
        assertEquals(MarketAnalysisService.EVENT_KIND, events.get(0).eventKind());
        assertEquals("session-1", events.get(0).sessionToken());
        assertTrue(events.get(0).eventPayload().contains("\"top_companies\""));
        assertTrue(events.get(0).eventPayload().contains("\"result_length\":5"));
    }

    @Test
    void analyze_shouldNotLogTelemetryForCacheHit() {
        AnalysisProvider provider = (s, k, p) -> "text";
        service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider);
        service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider);

        assertEquals(1, telemetry.recent(10).size());
    }

    @Test
    void analyze_shouldStoreConfiguredSource() {
        researchConfig.setAnalysisSource("perplexity");

        service.analyze("Solar", AnalysisKind.WEB_INSIGHTS, Map.of(), (s, k, p) -> "insights");

        assertEquals("perplexity", cache.get("Solar", "web_insights", Map.of()).orElseThrow().source());
    }

    // -- Single-flight --

    @Test
    void analyze_shouldShareOneProviderCallAcrossConcurrentMisses() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AnalysisProvider provider = (subject, kind, params) -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "shared";
        };

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Future<AnalysisResult> leader = executor.submit(
                    () -> service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Future<AnalysisResult> follower1 = executor.submit(
                    () -> service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider));
            Future<AnalysisResult> follower2 = executor.submit(
                    () -> service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider));
            Thread.sleep(200);
            release.countDown();

            assertEquals("shared", leader.get(5, TimeUnit.SECONDS).payload());
            assertEquals("shared", follower1.get(5, TimeUnit.SECONDS).payload());
            assertEquals("shared", follower2.get(5, TimeUnit.SECONDS).payload());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, calls.get());
        assertEquals(0, service.inFlightCount());
    }

    @Test
    void analyze_shouldPropagateProviderFailureToWaitingCallers() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AnalysisProvider provider = (subject, kind, params) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException("provider down");
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<AnalysisResult> leader = executor.submit(
                    () -> service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<AnalysisResult> follower = executor.submit(
                    () -> service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), provider));
            Thread.sleep(200);
            release.countDown();

            ExecutionException leaderError = assertThrows(ExecutionException.class,
                    () -> leader.get(5, TimeUnit.SECONDS));
            ExecutionException followerError = assertThrows(ExecutionException.class,
                    () -> follower.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, leaderError.getCause());
            assertInstanceOf(IllegalStateException.class, followerError.getCause());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, service.inFlightCount());
        assertTrue(cache.get("Solar", "global", Map.of()).isEmpty());
    }

    @Test
    void analyze_shouldAllowRetryAfterFailure() {
        assertThrows(IllegalStateException.class, () -> service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(),
                (s, k, p) -> {
                    throw new IllegalStateException("provider down");
                }));

        AnalysisResult retry = service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), (s, k, p) -> "recovered");

        assertEquals(AnalysisResult.Origin.COMPUTED, retry.origin());
        assertEquals("recovered", retry.payload());
    }

    @Test
    void analyze_shouldComputeIndependentlyWhenSingleFlightDisabled() {
        researchConfig.setSingleFlight(false);
        AtomicInteger calls = new AtomicInteger();

        AnalysisResult result = service.analyze("Solar", AnalysisKind.HORIZONTAL, Map.of(),
                (s, k, p) -> "run " + calls.incrementAndGet());

        assertEquals(AnalysisResult.Origin.COMPUTED, result.origin());
        assertEquals(0, service.inFlightCount());
        assertEquals("run 1", cache.get("Solar", "horizontal", Map.of()).orElseThrow().payload());
    }

    // -- Restore --

    @Test
    void restore_shouldReturnLiveAnalysesByKind() {
        service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), (s, k, p) -> "global text");
        service.analyze("Solar", AnalysisKind.METRICS, Map.of(), (s, k, p) -> "metrics text");
        service.analyze("Wind", AnalysisKind.GLOBAL, Map.of(), (s, k, p) -> "other subject");

        Map<AnalysisKind, String> restored = service.restore("Solar");

        assertEquals(2, restored.size());
        assertEquals("global text", restored.get(AnalysisKind.GLOBAL));
        assertEquals("metrics text", restored.get(AnalysisKind.METRICS));
    }

    @Test
    void restore_shouldSkipUnknownKinds() {
        cache.put("Solar", "legacy_report", Map.of(), "old format", "openai", Duration.ofHours(1));

        assertTrue(service.restore("Solar").isEmpty());
    }

    @Test
    void restore_shouldSkipExpiredAnalyses() {
        service.analyze("Solar", AnalysisKind.GLOBAL, Map.of(), (s, k, p) -> "global text");
        clock.advance(Duration.ofDays(2));

        assertTrue(service.restore("Solar").isEmpty());
    }
}
