package de.bsommerfeld.marketscope.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.domain.DailyActivity;
import de.bsommerfeld.marketscope.core.domain.EventKindCount;
import de.bsommerfeld.marketscope.core.domain.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Usage events with free-form JSON payloads. Rows are only ever removed by
 * age or by a bulk delete.
 */
@Singleton
public class TelemetryLog {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryLog.class);

    private final ResearchDatabase database;
    private final Clock clock;

    @Inject
    public TelemetryLog(ResearchDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * @param payload      serialized to JSON, {@code null} stores no payload
     * @param sessionToken may be {@code null}
     * @throws MalformedInputException if the payload cannot be serialized
     */
    public long log(String eventKind, Map<String, ?> payload, String sessionToken) {
        StoreArguments.requireText(eventKind, "eventKind");
        String payloadJson = payload == null ? null : JsonColumns.write(payload);
        long now = clock.millis();

        long id = database.inTransaction("log telemetry event", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-telemetry-event"))) {
                ps.setString(1, eventKind);
                ps.setString(2, payloadJson);
                ps.setString(3, sessionToken);
                ps.setLong(4, now);
                ps.executeUpdate();
            }
            return SqlTypes.lastInsertId(conn);
        });
        LOG.trace("[DB] Telemetry {} logged as {}.", eventKind, id);
        return id;
    }

    public List<TelemetryEvent> recent(int limit) {
        StoreArguments.requirePositive(limit, "limit");
        return database.withConnection("read recent telemetry", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-recent-telemetry"))) {
                ps.setInt(1, limit);
                List<TelemetryEvent> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new TelemetryEvent(
                                rs.getLong("id"),
                                rs.getString("event_kind"),
                                rs.getString("event_payload"),
                                rs.getString("session_token"),
                                SqlTypes.instant(rs, "created_at")));
                    }
                }
                return result;
            }
        });
    }

    /** Events per UTC day within {@code window}, latest day first. */
    public List<DailyActivity> dailyActivity(Duration window, int limit) {
        StoreArguments.requireNonNegative(window, "window");
        StoreArguments.requirePositive(limit, "limit");
        long since = clock.millis() - window.toMillis();
        return database.withConnection("read daily activity", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-daily-activity"))) {
                ps.setLong(1, since);
                ps.setInt(2, limit);
                List<DailyActivity> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new DailyActivity(LocalDate.parse(rs.getString("day")), rs.getInt("events")));
                    }
                }
                return result;
            }
        });
    }

    /** Event counts per kind within {@code window}, most frequent first. */
    public List<EventKindCount> breakdown(Duration window) {
        StoreArguments.requireNonNegative(window, "window");
        long since = clock.millis() - window.toMillis();
        return database.withConnection("read event breakdown", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-event-breakdown"))) {
                ps.setLong(1, since);
                List<EventKindCount> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new EventKindCount(rs.getString("event_kind"), rs.getInt("events")));
                    }
                }
                return result;
            }
        });
    }

    public int countSince(Duration window) {
        StoreArguments.requireNonNegative(window, "window");
        long since = clock.millis() - window.toMillis();
        return database.withConnection("count telemetry events", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-telemetry-since"))) {
                ps.setLong(1, since);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    /** Deletes events created before {@code now - age}. */
    public int purgeOlderThan(Duration age) {
        StoreArguments.requireNonNegative(age, "age");
        long cutoff = clock.millis() - age.toMillis();
        int removed = database.inTransaction("purge telemetry", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-telemetry-older-than"))) {
                ps.setLong(1, cutoff);
                return ps.executeUpdate();
            }
        });
        LOG.info("[DB] Purged {} telemetry event(s) older than {}.", removed, age);
        return removed;
    }
}
