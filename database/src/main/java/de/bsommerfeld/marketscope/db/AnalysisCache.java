package de.bsommerfeld.marketscope.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.config.StoreConfig;
import de.bsommerfeld.marketscope.core.domain.AnalysisHistoryItem;
import de.bsommerfeld.marketscope.core.domain.CacheEntry;
import de.bsommerfeld.marketscope.core.domain.CachedAnalysis;
import de.bsommerfeld.marketscope.core.domain.PopularSubject;
import de.bsommerfeld.marketscope.core.domain.SubjectSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent cache of generated market analyses, keyed by
 * {@link KeyHasher#fingerprint fingerprint}.
 *
 * <p>
 * Expiry is lazy: reads filter out rows whose {@code expires_at} has been
 * reached but never delete them. Only {@link #sweepExpired()} and the
 * explicit deletes reclaim rows, so expired analyses stay visible to
 * maintenance views until then.
 *
 * <p>
 * Check-then-populate is not atomic here. Two callers that miss at the same
 * time both compute and both {@link #put}; the upsert keeps exactly one row
 * and the later write wins.
 */
@Singleton
public class AnalysisCache {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisCache.class);

    public static final String DEFAULT_SOURCE = "openai";

    private final ResearchDatabase database;
    private final Clock clock;
    private final StoreConfig config;

    @Inject
    public AnalysisCache(ResearchDatabase database, Clock clock, StoreConfig config) {
        this.database = database;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Returns the live payload for the given key, or empty on a miss or when
     * the entry has expired.
     */
    public Optional<CachedAnalysis> get(String subject, String queryKind, Map<String, ?> parameters) {
        String fingerprint = KeyHasher.fingerprint(subject, queryKind, parameters);
        long now = clock.millis();
        return database.withConnection("read cache entry", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-live-cache-entry"))) {
                ps.setString(1, fingerprint);
                ps.setLong(2, now);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        LOG.debug("[DB] Cache miss for {}/{}", subject, queryKind);
                        return Optional.empty();
                    }
                    return Optional.of(new CachedAnalysis(
                            rs.getString("payload"),
                            rs.getString("source"),
                            SqlTypes.instant(rs, "created_at"),
                            SqlTypes.nullableInstant(rs, "expires_at")));
                }
            }
        });
    }

    /**
     * Writes the payload, replacing any entry with the same fingerprint and
     * restarting its expiry.
     *
     * @param source name of the producing service, {@value #DEFAULT_SOURCE} when {@code null}
     * @param ttl    {@code null} for an entry that never expires; zero or
     *               negative yields an entry that is already expired
     */
    public void put(String subject, String queryKind, Map<String, ?> parameters,
            String payload, String source, Duration ttl) {
        write("upsert-cache-entry", "write cache entry", subject, queryKind, parameters, payload, source, ttl);
        LOG.debug("[DB] Cached {}/{} (ttl {})", subject, queryKind, ttl);
    }

    /**
     * Strict insert for callers that must not overwrite an existing analysis.
     *
     * @throws ConstraintViolationException if the fingerprint is already cached,
     *                                      expired or not
     */
    public void create(String subject, String queryKind, Map<String, ?> parameters,
            String payload, String source, Duration ttl) {
        write("insert-cache-entry", "create cache entry", subject, queryKind, parameters, payload, source, ttl);
    }

    private void write(String statement, String operation, String subject, String queryKind,
            Map<String, ?> parameters, String payload, String source, Duration ttl) {
        String fingerprint = KeyHasher.fingerprint(subject, queryKind, parameters);
        StoreArguments.requireNonNull(payload, "payload");
        Instant now = clock.instant();
        Instant expiresAt = ttl == null ? null : now.plus(ttl);

        database.inTransaction(operation, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
                ps.setString(1, subject);
                ps.setString(2, queryKind);
                ps.setString(3, fingerprint);
                ps.setString(4, payload);
                ps.setLong(5, now.toEpochMilli());
                SqlTypes.setNullableInstant(ps, 6, expiresAt);
                ps.setString(7, source != null ? source : DEFAULT_SOURCE);
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Deletes every entry whose expiry has been reached.
     *
     * @return number of rows removed; zero on a second consecutive call
     */
    public int sweepExpired() {
        long now = clock.millis();
        int removed = database.inTransaction("sweep expired cache entries", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-expired-cache-entries"))) {
                ps.setLong(1, now);
                return ps.executeUpdate();
            }
        });
        if (removed > 0) {
            LOG.info("[DB] Swept {} expired cache entries.", removed);
        }
        return removed;
    }

    /** {@link #popular(Duration, int)} over the configured popularity window. */
    public List<PopularSubject> popular(int limit) {
        return popular(Duration.ofDays(config.getPopularWindowDays()), limit);
    }

    /**
     * Most-analysed subjects among live entries created within {@code window},
     * by entry count, ties broken by the most recent write.
     */
    public List<PopularSubject> popular(Duration window, int limit) {
        StoreArguments.requireNonNegative(window, "window");
        StoreArguments.requirePositive(limit, "limit");
        long now = clock.millis();
        long since = now - window.toMillis();

        return database.withConnection("read popular subjects", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-popular-subjects"))) {
                ps.setLong(1, since);
                ps.setLong(2, now);
                ps.setInt(3, limit);
                List<PopularSubject> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new PopularSubject(
                                rs.getString("subject"),
                                rs.getInt("entries"),
                                SqlTypes.instant(rs, "last_access")));
                    }
                }
                return result;
            }
        });
    }

    /** Live analyses grouped by subject and kind, most recently cached first. */
    public List<AnalysisHistoryItem> history(int limit) {
        StoreArguments.requirePositive(limit, "limit");
        long now = clock.millis();
        return database.withConnection("read analysis history", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-analysis-history"))) {
                ps.setLong(1, now);
                ps.setInt(2, limit);
                List<AnalysisHistoryItem> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new AnalysisHistoryItem(
                                rs.getString("subject"),
                                rs.getString("query_kind"),
                                SqlTypes.instant(rs, "last_cached_at"),
                                rs.getInt("entries")));
                    }
                }
                return result;
            }
        });
    }

    /** Every live entry for {@code subject}, newest first. */
    public List<CacheEntry> liveEntries(String subject) {
        StoreArguments.requireNonNull(subject, "subject");
        long now = clock.millis();
        return database.withConnection("read live cache entries", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-live-entries-for-subject"))) {
                ps.setString(1, subject);
                ps.setLong(2, now);
                List<CacheEntry> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new CacheEntry(
                                rs.getLong("id"),
                                rs.getString("subject"),
                                rs.getString("query_kind"),
                                rs.getString("fingerprint"),
                                rs.getString("payload"),
                                SqlTypes.instant(rs, "created_at"),
                                SqlTypes.nullableInstant(rs, "expires_at"),
                                rs.getString("source")));
                    }
                }
                return result;
            }
        });
    }

    /** All cached subjects with their row counts, expired rows included. */
    public List<SubjectSummary> cachedSubjects() {
        return database.withConnection("read cached subjects", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-cached-subjects"));
                    ResultSet rs = ps.executeQuery()) {
                List<SubjectSummary> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(new SubjectSummary(rs.getString("subject"), rs.getInt("entries")));
                }
                return result;
            }
        });
    }

    public int deleteSubject(String subject) {
        return deleteSubjects(List.of(StoreArguments.requireNonNull(subject, "subject")));
    }

    /** Deletes all entries of the given subjects in one transaction. */
    public int deleteSubjects(Collection<String> subjects) {
        StoreArguments.requireNonNull(subjects, "subjects");
        if (subjects.isEmpty()) {
            return 0;
        }
        int removed = database.inTransaction("delete cached subjects", conn -> {
            int total = 0;
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-cache-entries-for-subject"))) {
                for (String subject : subjects) {
                    ps.setString(1, subject);
                    total += ps.executeUpdate();
                }
            }
            return total;
        });
        LOG.info("[DB] Deleted {} cache entries for {} subject(s).", removed, subjects.size());
        return removed;
    }

    /** Deletes one analysis kind of a subject, across all parameter sets. */
    public int deleteEntries(String subject, String queryKind) {
        StoreArguments.requireNonNull(subject, "subject");
        StoreArguments.requireNonNull(queryKind, "queryKind");
        int removed = database.inTransaction("delete cache entries", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-cache-entries-for-subject-kind"))) {
                ps.setString(1, subject);
                ps.setString(2, queryKind);
                return ps.executeUpdate();
            }
        });
        LOG.info("[DB] Deleted {} cache entries for {}/{}.", removed, subject, queryKind);
        return removed;
    }

    /** Rows written before {@code now - age}, live or not. */
    public int countOlderThan(Duration age) {
        StoreArguments.requireNonNegative(age, "age");
        long cutoff = clock.millis() - age.toMillis();
        return database.withConnection("count stale cache entries", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-cache-entries-older-than"))) {
                ps.setLong(1, cutoff);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }
}
