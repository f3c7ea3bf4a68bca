package de.bsommerfeld.marketscope.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.domain.SearchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log of merger/acquisition searches. Repeating a search adds a
 * new row so the deal count can be followed over time.
 */
@Singleton
public class SearchHistoryLog {

    private static final Logger LOG = LoggerFactory.getLogger(SearchHistoryLog.class);

    private final ResearchDatabase database;
    private final Clock clock;

    @Inject
    public SearchHistoryLog(ResearchDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public long append(String subject, String timeframe, String payload, int dealsFound) {
        StoreArguments.requireNonNull(subject, "subject");
        StoreArguments.requireNonNull(timeframe, "timeframe");
        StoreArguments.requireNonNull(payload, "payload");
        StoreArguments.requireNonNegative(dealsFound, "dealsFound");
        long now = clock.millis();

        long id = database.inTransaction("append search", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-search"))) {
                ps.setString(1, subject);
                ps.setString(2, timeframe);
                ps.setString(3, payload);
                ps.setInt(4, dealsFound);
                ps.setLong(5, now);
                ps.executeUpdate();
            }
            return SqlTypes.lastInsertId(conn);
        });
        LOG.debug("[DB] Search {} recorded for {} ({} deals).", id, subject, dealsFound);
        return id;
    }

    /** Newest searches first. */
    public List<SearchRecord> recent(int limit) {
        StoreArguments.requirePositive(limit, "limit");
        return database.withConnection("read recent searches", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-recent-searches"))) {
                ps.setInt(1, limit);
                return readAll(ps);
            }
        });
    }

    /** All searches for one subject, newest first. */
    public List<SearchRecord> forSubject(String subject) {
        StoreArguments.requireNonNull(subject, "subject");
        return database.withConnection("read searches for subject", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-searches-for-subject"))) {
                ps.setString(1, subject);
                return readAll(ps);
            }
        });
    }

    /**
     * Removes one search from the history.
     *
     * @return rows removed, 0 for an unknown id
     */
    public int delete(long searchId) {
        int removed = database.inTransaction("delete search", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-search"))) {
                ps.setLong(1, searchId);
                return ps.executeUpdate();
            }
        });
        LOG.debug("[DB] Deleted search {} ({} row(s)).", searchId, removed);
        return removed;
    }

    /** Deletes searches created before {@code now - age}. */
    public int purgeOlderThan(Duration age) {
        StoreArguments.requireNonNegative(age, "age");
        long cutoff = clock.millis() - age.toMillis();
        int removed = database.inTransaction("purge searches", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-searches-older-than"))) {
                ps.setLong(1, cutoff);
                return ps.executeUpdate();
            }
        });
        LOG.info("[DB] Purged {} search(es) older than {}.", removed, age);
        return removed;
    }

    private static List<SearchRecord> readAll(PreparedStatement ps) throws SQLException {
        List<SearchRecord> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new SearchRecord(
                        rs.getLong("id"),
                        rs.getString("subject"),
                        rs.getString("timeframe"),
                        rs.getString("payload"),
                        rs.getInt("deals_found"),
                        SqlTypes.instant(rs, "created_at")));
            }
        }
        return result;
    }
}
