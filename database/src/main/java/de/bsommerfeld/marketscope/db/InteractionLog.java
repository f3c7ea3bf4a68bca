package de.bsommerfeld.marketscope.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.config.StoreConfig;
import de.bsommerfeld.marketscope.core.domain.HistoryOrder;
import de.bsommerfeld.marketscope.core.domain.InteractionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Question/answer history per document. The cost estimate is fixed when the
 * row is written:
 * {@code (queryTokens * inputRate + responseTokens * outputRate) / 1000}.
 */
@Singleton
public class InteractionLog {

    private static final Logger LOG = LoggerFactory.getLogger(InteractionLog.class);

    private final ResearchDatabase database;
    private final Clock clock;
    private final StoreConfig config;

    @Inject
    public InteractionLog(ResearchDatabase database, Clock clock, StoreConfig config) {
        this.database = database;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Appends an interaction. The parent lookup and the insert share one
     * transaction.
     *
     * @return id of the new interaction
     * @throws NotFoundException if {@code documentId} does not exist
     */
    public long append(long documentId, String question, String answer, long queryTokens, long responseTokens) {
        StoreArguments.requireNonNull(question, "question");
        StoreArguments.requireNonNull(answer, "answer");
        StoreArguments.requireNonNegative(queryTokens, "queryTokens");
        StoreArguments.requireNonNegative(responseTokens, "responseTokens");
        double cost = costEstimate(queryTokens, responseTokens);
        long now = clock.millis();

        long id = database.inTransaction("append interaction", conn -> {
            if (!documentExists(conn, documentId)) {
                throw new NotFoundException("Document " + documentId + " does not exist");
            }
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-interaction"))) {
                ps.setLong(1, documentId);
                ps.setString(2, question);
                ps.setString(3, answer);
                ps.setLong(4, queryTokens);
                ps.setLong(5, responseTokens);
                ps.setDouble(6, cost);
                ps.setLong(7, now);
                ps.executeUpdate();
            }
            return SqlTypes.lastInsertId(conn);
        });
        LOG.debug("[DB] Interaction {} appended to document {} (cost {}).", id, documentId, cost);
        return id;
    }

    double costEstimate(long queryTokens, long responseTokens) {
        return (queryTokens * config.getInputTokenRate() + responseTokens * config.getOutputTokenRate()) / 1000.0;
    }

    /** Interactions of a document in the requested order; empty for unknown ids. */
    public List<InteractionRecord> history(long documentId, HistoryOrder order) {
        StoreArguments.requireNonNull(order, "order");
        return database.withConnection("read interaction history", conn -> selectHistory(conn, documentId, order));
    }

    /** Sum of the cost estimates recorded for a document. */
    public double totalCost(long documentId) {
        return database.withConnection("sum interaction cost", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("sum-interaction-cost"))) {
                ps.setLong(1, documentId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getDouble(1) : 0.0;
                }
            }
        });
    }

    /** Deletes every interaction of the document with exactly this question text. */
    public int deleteOne(long documentId, String question) {
        StoreArguments.requireNonNull(question, "question");
        int removed = database.inTransaction("delete interaction", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-interaction-by-question"))) {
                ps.setLong(1, documentId);
                ps.setString(2, question);
                return ps.executeUpdate();
            }
        });
        LOG.info("[DB] Deleted {} interaction(s) from document {}.", removed, documentId);
        return removed;
    }

    public int deleteAll(long documentId) {
        int removed = database.inTransaction("delete interactions", conn -> deleteForDocument(conn, documentId));
        LOG.info("[DB] Deleted all {} interaction(s) of document {}.", removed, documentId);
        return removed;
    }

    // -- Shared with DocumentStore so cascades stay in the caller's transaction --

    static int deleteForDocument(Connection conn, long documentId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-interactions-for-document"))) {
            ps.setLong(1, documentId);
            return ps.executeUpdate();
        }
    }

    static List<InteractionRecord> selectHistory(Connection conn, long documentId, HistoryOrder order)
            throws SQLException {
        String statement = order == HistoryOrder.NEWEST_FIRST
                ? "select-interactions-newest-first"
                : "select-interactions-oldest-first";
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            ps.setLong(1, documentId);
            List<InteractionRecord> result = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new InteractionRecord(
                            rs.getLong("id"),
                            rs.getLong("document_id"),
                            rs.getString("question"),
                            rs.getString("answer"),
                            rs.getLong("query_tokens"),
                            rs.getLong("response_tokens"),
                            rs.getDouble("cost_estimate"),
                            SqlTypes.instant(rs, "created_at")));
                }
            }
            return result;
        }
    }

    static boolean documentExists(Connection conn, long documentId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("exists-document"))) {
            ps.setLong(1, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
