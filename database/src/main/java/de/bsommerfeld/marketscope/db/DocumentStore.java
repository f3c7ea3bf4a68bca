package de.bsommerfeld.marketscope.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.domain.CascadeResult;
import de.bsommerfeld.marketscope.core.domain.ChunkRange;
import de.bsommerfeld.marketscope.core.domain.DocumentRecord;
import de.bsommerfeld.marketscope.core.domain.DocumentSession;
import de.bsommerfeld.marketscope.core.domain.DocumentStatus;
import de.bsommerfeld.marketscope.core.domain.DocumentSummary;
import de.bsommerfeld.marketscope.core.domain.HistoryOrder;
import de.bsommerfeld.marketscope.core.domain.InteractionRecord;
import de.bsommerfeld.marketscope.core.util.HashUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Content-addressed registry of ingested documents.
 *
 * <p>
 * Deduplication is the caller's decision: {@link #record} never checks for an
 * existing hash, so look up {@link #findByContent} first. Two callers
 * ingesting the same bytes at the same moment may both record a row; lookups
 * then resolve to the most recently processed one.
 */
@Singleton
public class DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentStore.class);

    private final ResearchDatabase database;
    private final Clock clock;

    @Inject
    public DocumentStore(ResearchDatabase database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    // -- Lookup --

    /** Most recently processed document with this content hash, if any. */
    public Optional<DocumentRecord> findByContent(String contentHash) {
        StoreArguments.requireNonNull(contentHash, "contentHash");
        return database.withConnection("find document by content",
                conn -> selectOne(conn, "select-document-by-hash", ps -> ps.setString(1, contentHash)));
    }

    public Optional<DocumentRecord> findByContent(byte[] content) {
        StoreArguments.requireNonNull(content, "content");
        return findByContent(HashUtil.sha256(content));
    }

    public Optional<DocumentRecord> findById(long documentId) {
        return database.withConnection("find document",
                conn -> selectOne(conn, "select-document-by-id", ps -> ps.setLong(1, documentId)));
    }

    // -- Recording --

    /**
     * Records a document whose chunks are only known by handle.
     *
     * @param chunkHandles opaque handles in chunk order, at least one
     * @return id of the new record
     */
    public long record(String displayName, byte[] content, int pageCount, List<String> chunkHandles) {
        StoreArguments.requirePositive(pageCount, "pageCount");
        StoreArguments.requireNonNull(chunkHandles, "chunkHandles");
        if (chunkHandles.isEmpty()) {
            throw new MalformedInputException("chunkHandles must not be empty");
        }
        return insert(displayName, content, pageCount, List.copyOf(chunkHandles), null);
    }

    /**
     * Records a document together with the exact page range of every chunk.
     * The page count is the largest end page.
     */
    public long record(String displayName, byte[] content, List<ChunkRange> chunks) {
        StoreArguments.requireNonNull(chunks, "chunks");
        if (chunks.isEmpty()) {
            throw new MalformedInputException("chunks must not be empty");
        }
        List<String> handles = new ArrayList<>(chunks.size());
        int pageCount = 0;
        for (ChunkRange chunk : chunks) {
            StoreArguments.requireNonNull(chunk.handle(), "chunk handle");
            if (chunk.startPage() < 1 || chunk.endPage() < chunk.startPage()) {
                throw new MalformedInputException("Invalid page range " + chunk.startPage() + "-"
                        + chunk.endPage() + " for chunk " + chunk.handle());
            }
            handles.add(chunk.handle());
            pageCount = Math.max(pageCount, chunk.endPage());
        }
        return insert(displayName, content, pageCount, handles, List.copyOf(chunks));
    }

    private long insert(String displayName, byte[] content, int pageCount, List<String> handles,
            List<ChunkRange> ranges) {
        StoreArguments.requireText(displayName, "displayName");
        StoreArguments.requireNonNull(content, "content");
        String contentHash = HashUtil.sha256(content);
        String handlesJson = JsonColumns.write(handles);
        String rangesJson = ranges == null ? null : JsonColumns.write(ranges);
        long now = clock.millis();

        long id = database.inTransaction("record document", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-document"))) {
                ps.setString(1, displayName);
                ps.setString(2, contentHash);
                ps.setLong(3, content.length);
                ps.setInt(4, pageCount);
                ps.setInt(5, handles.size());
                ps.setString(6, handlesJson);
                if (rangesJson == null) {
                    ps.setNull(7, Types.VARCHAR);
                } else {
                    ps.setString(7, rangesJson);
                }
                ps.setLong(8, now);
                ps.executeUpdate();
            }
            return SqlTypes.lastInsertId(conn);
        });
        LOG.info("[DB] Recorded document {} '{}' ({} pages, {} chunks).", id, displayName, pageCount, handles.size());
        return id;
    }

    // -- Chunk reconstruction --

    /**
     * Page ranges of the document's chunks. Exact ranges are returned when
     * they were recorded. Otherwise pages are divided evenly:
     * {@code pagesPerChunk = max(1, pageCount / chunkCount)} and chunk
     * {@code i} covers {@code [i * pagesPerChunk + 1, min((i + 1) * pagesPerChunk, pageCount)]},
     * clamped so no range starts past the last page. With uneven chunking
     * this is only an approximation.
     */
    public List<ChunkRange> reconstructChunkRanges(DocumentRecord record) {
        StoreArguments.requireNonNull(record, "record");
        if (record.hasRecordedRanges()) {
            return record.recordedRanges();
        }
        List<String> handles = record.chunkHandles();
        int chunks = handles.size();
        if (chunks == 0) {
            return List.of();
        }
        int pages = Math.max(1, record.pageCount());
        int pagesPerChunk = Math.max(1, pages / chunks);

        List<ChunkRange> ranges = new ArrayList<>(chunks);
        for (int i = 0; i < chunks; i++) {
            int start = Math.min(i * pagesPerChunk + 1, pages);
            int end = Math.max(start, Math.min((i + 1) * pagesPerChunk, pages));
            ranges.add(new ChunkRange(handles.get(i), start, end));
        }
        return ranges;
    }

    // -- Sessions --

    /** Processed documents with their interaction activity, newest first. */
    public List<DocumentSummary> sessions(int limit) {
        StoreArguments.requirePositive(limit, "limit");
        return database.withConnection("read document sessions", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-document-sessions"))) {
                ps.setInt(1, limit);
                List<DocumentSummary> result = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        result.add(new DocumentSummary(
                                rs.getLong("id"),
                                rs.getString("display_name"),
                                rs.getInt("page_count"),
                                rs.getInt("chunk_count"),
                                SqlTypes.instant(rs, "processed_at"),
                                rs.getInt("interaction_count"),
                                SqlTypes.nullableInstant(rs, "last_question_at")));
                    }
                }
                return result;
            }
        });
    }

    /**
     * Loads a processed document, its chunk ranges and its interactions in
     * asking order within one transaction. Failed or archived documents are
     * not restorable, matching {@link #sessions}.
     */
    public Optional<DocumentSession> restoreSession(long documentId) {
        return database.inTransaction("restore document session", conn -> {
            Optional<DocumentRecord> document = selectOne(conn, "select-processed-document-by-id",
                    ps -> ps.setLong(1, documentId));
            if (document.isEmpty()) {
                return Optional.empty();
            }
            List<InteractionRecord> interactions =
                    InteractionLog.selectHistory(conn, documentId, HistoryOrder.OLDEST_FIRST);
            return Optional.of(new DocumentSession(document.get(),
                    reconstructChunkRanges(document.get()), interactions));
        });
    }

    // -- Mutation --

    /**
     * @throws NotFoundException if the document does not exist
     */
    public void updateStatus(long documentId, DocumentStatus status) {
        StoreArguments.requireNonNull(status, "status");
        database.inTransaction("update document status", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-document-status"))) {
                ps.setString(1, status.dbValue());
                ps.setLong(2, documentId);
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException("Document " + documentId + " does not exist");
                }
                return null;
            }
        });
        LOG.debug("[DB] Document {} marked {}.", documentId, status.dbValue());
    }

    /**
     * Deletes a document and its interactions in one transaction. Unknown ids
     * yield {@link CascadeResult#NONE}.
     */
    public CascadeResult delete(long documentId) {
        return deleteAll(List.of(documentId));
    }

    public CascadeResult deleteAll(Collection<Long> documentIds) {
        StoreArguments.requireNonNull(documentIds, "documentIds");
        if (documentIds.isEmpty()) {
            return CascadeResult.NONE;
        }
        CascadeResult result = database.inTransaction("delete documents", conn -> {
            int documents = 0;
            int interactions = 0;
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-document"))) {
                for (long documentId : documentIds) {
                    interactions += InteractionLog.deleteForDocument(conn, documentId);
                    ps.setLong(1, documentId);
                    documents += ps.executeUpdate();
                }
            }
            return new CascadeResult(documents, interactions);
        });
        LOG.info("[DB] Deleted {} document(s) and {} interaction(s).",
                result.documentsDeleted(), result.interactionsDeleted());
        return result;
    }

    // -- Row mapping --

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private static Optional<DocumentRecord> selectOne(Connection conn, String statement, Binder binder)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement))) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapDocument(rs)) : Optional.empty();
            }
        }
    }

    private static DocumentRecord mapDocument(ResultSet rs) throws SQLException {
        return new DocumentRecord(
                rs.getLong("id"),
                rs.getString("display_name"),
                rs.getString("content_hash"),
                rs.getLong("byte_size"),
                rs.getInt("page_count"),
                rs.getInt("chunk_count"),
                JsonColumns.readHandles(rs.getString("chunk_handles")),
                JsonColumns.readRanges(rs.getString("chunk_ranges")),
                SqlTypes.instant(rs, "processed_at"),
                DocumentStatus.fromDbValue(rs.getString("status")));
    }
}
