package de.bsommerfeld.marketscope.research.analysis;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.config.ResearchConfig;
import de.bsommerfeld.marketscope.core.config.StoreConfig;
import de.bsommerfeld.marketscope.core.domain.CacheEntry;
import de.bsommerfeld.marketscope.core.domain.CachedAnalysis;
import de.bsommerfeld.marketscope.db.AnalysisCache;
import de.bsommerfeld.marketscope.db.KeyHasher;
import de.bsommerfeld.marketscope.db.TelemetryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache-first market analysis.
 *
 * <p>
 * On a miss the {@link AnalysisProvider} runs and a non-blank result is
 * written through to the {@link AnalysisCache} with the configured TTL.
 * With single-flight enabled, concurrent misses on the same fingerprint
 * share one provider call: the first caller computes, the others wait for
 * its result (or its failure). With it disabled every missing caller
 * computes and the last write wins.
 */
@Singleton
public class MarketAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(MarketAnalysisService.class);
    static final String EVENT_KIND = "market_analysis";

    private final AnalysisCache cache;
    private final TelemetryLog telemetry;
    private final StoreConfig storeConfig;
    private final ResearchConfig researchConfig;
    private final ConcurrentHashMap<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    @Inject
    public MarketAnalysisService(AnalysisCache cache, TelemetryLog telemetry,
            StoreConfig storeConfig, ResearchConfig researchConfig) {
        this.cache = cache;
        this.telemetry = telemetry;
        this.storeConfig = storeConfig;
        this.researchConfig = researchConfig;
    }

    public AnalysisResult analyze(String subject, AnalysisKind kind, Map<String, ?> parameters,
            AnalysisProvider provider) {
        return analyze(subject, kind, parameters, provider, null);
    }

    /**
     * Returns the cached analysis or computes it.
     *
     * @param sessionToken attached to the telemetry event of a computed result,
     *                     may be {@code null}
     */
    public AnalysisResult analyze(String subject, AnalysisKind kind, Map<String, ?> parameters,
            AnalysisProvider provider, String sessionToken) {
        Optional<CachedAnalysis> cached = cache.get(subject, kind.key(), parameters);
        if (cached.isPresent()) {
            LOG.debug("Serving {}/{} from cache.", subject, kind.key());
            return new AnalysisResult(cached.get().payload(), AnalysisResult.Origin.CACHE);
        }
        if (!researchConfig.isSingleFlight()) {
            return new AnalysisResult(computeAndStore(subject, kind, parameters, provider, sessionToken),
                    AnalysisResult.Origin.COMPUTED);
        }

        String fingerprint = KeyHasher.fingerprint(subject, kind.key(), parameters);
        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> running = inFlight.putIfAbsent(fingerprint, mine);
        if (running != null) {
            LOG.debug("Joining in-flight analysis of {}/{}.", subject, kind.key());
            return new AnalysisResult(await(running), AnalysisResult.Origin.SHARED);
        }

        try {
            // a previous leader may have finished between our miss and putIfAbsent
            Optional<CachedAnalysis> late = cache.get(subject, kind.key(), parameters);
            AnalysisResult result = late.isPresent()
                    ? new AnalysisResult(late.get().payload(), AnalysisResult.Origin.CACHE)
                    : new AnalysisResult(computeAndStore(subject, kind, parameters, provider, sessionToken),
                            AnalysisResult.Origin.COMPUTED);
            mine.complete(result.payload());
            return result;
        } catch (Throwable t) {
            mine.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(fingerprint, mine);
        }
    }

    private String computeAndStore(String subject, AnalysisKind kind, Map<String, ?> parameters,
            AnalysisProvider provider, String sessionToken) {
        LOG.info("Generating {} analysis for '{}'.", kind.key(), subject);
        String payload = provider.generate(subject, kind, parameters != null ? parameters : Map.of());
        if (payload == null || payload.isBlank()) {
            LOG.warn("Provider returned no {} analysis for '{}', not caching.", kind.key(), subject);
            return payload == null ? "" : payload;
        }

        cache.put(subject, kind.key(), parameters, payload, researchConfig.getAnalysisSource(),
                storeConfig.cacheTtl());
        telemetry.log(EVENT_KIND, Map.of(
                "market", subject,
                "type", kind.key(),
                "result_length", payload.length()), sessionToken);
        return payload;
    }

    private static String await(CompletableFuture<String> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Every live analysis of a subject, keyed by kind. Where a kind was cached
     * under several parameter sets the newest one is returned. Kinds this
     * version does not know are skipped.
     */
    public Map<AnalysisKind, String> restore(String subject) {
        Map<AnalysisKind, String> restored = new EnumMap<>(AnalysisKind.class);
        for (CacheEntry entry : cache.liveEntries(subject)) {
            AnalysisKind.fromKey(entry.queryKind())
                    .ifPresent(kind -> restored.putIfAbsent(kind, entry.payload()));
        }
        LOG.info("Restored {} analyses for '{}'.", restored.size(), subject);
        return restored;
    }

    /** Number of keys currently being computed. */
    int inFlightCount() {
        return inFlight.size();
    }
}
