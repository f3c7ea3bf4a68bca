package de.bsommerfeld.marketscope.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.config.StoreConfig;
import de.bsommerfeld.marketscope.core.domain.BulkDeleteResult;
import de.bsommerfeld.marketscope.core.domain.CleanupReport;
import de.bsommerfeld.marketscope.core.domain.DeleteScope;
import de.bsommerfeld.marketscope.core.domain.StoreHealth;
import de.bsommerfeld.marketscope.core.domain.StoreStats;
import de.bsommerfeld.marketscope.core.domain.StoreTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Statistics, bulk deletion, compaction and backup of the research store.
 *
 * <p>
 * Bulk deletes are unconditional. Asking the user for confirmation is the
 * caller's job.
 */
@Singleton
public class MaintenanceService {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceService.class);
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final ResearchDatabase database;
    private final AnalysisCache analysisCache;
    private final TelemetryLog telemetryLog;
    private final StoreConfig config;

    @Inject
    public MaintenanceService(ResearchDatabase database, AnalysisCache analysisCache,
            TelemetryLog telemetryLog, StoreConfig config) {
        this.database = database;
        this.analysisCache = analysisCache;
        this.telemetryLog = telemetryLog;
        this.config = config;
    }

    /** Row count of every table and the current file size. */
    public StoreStats stats() {
        Map<StoreTable, Long> counts = database.withConnection("read store stats", conn -> {
            Map<StoreTable, Long> result = new EnumMap<>(StoreTable.class);
            try (Statement stmt = conn.createStatement()) {
                for (StoreTable table : StoreTable.values()) {
                    // table names come from the enum, never from callers
                    try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table.tableName())) {
                        result.put(table, rs.next() ? rs.getLong(1) : 0L);
                    }
                }
            }
            return result;
        });
        return new StoreStats(counts, database.sizeBytes());
    }

    /**
     * Deletes every row of the tables in {@code scope} in one transaction.
     * Interactions go whenever documents go.
     */
    public BulkDeleteResult bulkDelete(DeleteScope scope) {
        StoreArguments.requireNonNull(scope, "scope");
        Map<StoreTable, Integer> deleted = database.inTransaction("bulk delete " + scope, conn -> {
            Map<StoreTable, Integer> result = new EnumMap<>(StoreTable.class);
            try (Statement stmt = conn.createStatement()) {
                for (StoreTable table : scope.tables()) {
                    result.put(table, stmt.executeUpdate("DELETE FROM " + table.tableName()));
                }
            }
            return result;
        });
        BulkDeleteResult result = new BulkDeleteResult(scope, deleted);
        LOG.info("[DB] Bulk delete {} removed {} row(s): {}", scope, result.total(), deleted);
        return result;
    }

    /**
     * Rewrites the database file to reclaim space left by deletes.
     *
     * @return bytes reclaimed, never negative
     */
    public long compact() {
        long before = database.sizeBytes();
        database.withConnection("compact store", conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("VACUUM");
            }
            return null;
        });
        long reclaimed = Math.max(0, before - database.sizeBytes());
        LOG.info("[DB] Compacted store, reclaimed {} bytes.", reclaimed);
        return reclaimed;
    }

    /**
     * Sweeps expired cache entries, purges telemetry older than the
     * configured retention and compacts the file.
     */
    public CleanupReport fullCleanup() {
        int expired = analysisCache.sweepExpired();
        int purged = telemetryLog.purgeOlderThan(Duration.ofDays(config.getTelemetryRetentionDays()));
        long reclaimed = compact();
        CleanupReport report = new CleanupReport(expired, purged, reclaimed);
        LOG.info("[DB] Cleanup finished: {}", report);
        return report;
    }

    /** Evaluates file size and cache staleness against the configured thresholds. */
    public StoreHealth health() {
        long size = database.sizeBytes();
        int stale = analysisCache.countOlderThan(Duration.ofDays(config.getStaleCacheDays()));
        boolean sizeWarning = size > config.getSizeWarningMb() * BYTES_PER_MB;
        boolean staleWarning = stale > config.getStaleCacheWarningThreshold();
        if (sizeWarning || staleWarning) {
            LOG.warn("[DB] Store health: {} bytes, {} stale cache entries.", size, stale);
        }
        return new StoreHealth(size, sizeWarning, stale, staleWarning);
    }

    /**
     * Copies the database file to {@code target}, replacing an existing file.
     *
     * @throws StorageUnavailableException if the copy fails
     */
    public Path backupTo(Path target) {
        StoreArguments.requireNonNull(target, "target");
        Path source = database.databaseFile();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            LOG.error("[DB] Backup to {} failed", target, e);
            throw new StorageUnavailableException("Backup to " + target + " failed", e);
        }
        LOG.info("[DB] Backed up store to {}", target);
        return target;
    }
}
