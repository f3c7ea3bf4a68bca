package de.bsommerfeld.marketscope.research.document;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.domain.ChunkRange;
import de.bsommerfeld.marketscope.core.domain.DocumentRecord;
import de.bsommerfeld.marketscope.core.event.ApplicationEventBus;
import de.bsommerfeld.marketscope.core.event.StoreEvents;
import de.bsommerfeld.marketscope.db.DocumentStore;
import de.bsommerfeld.marketscope.db.MalformedInputException;
import de.bsommerfeld.marketscope.db.TelemetryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ingests uploaded documents, skipping the upload when byte-identical content
 * was processed before.
 */
@Singleton
public class DocumentIngestionService {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentIngestionService.class);
    static final String EVENT_KIND = "pdf_upload";

    private final DocumentStore documents;
    private final TelemetryLog telemetry;
    private final ApplicationEventBus eventBus;

    @Inject
    public DocumentIngestionService(DocumentStore documents, TelemetryLog telemetry, ApplicationEventBus eventBus) {
        this.documents = documents;
        this.telemetry = telemetry;
        this.eventBus = eventBus;
    }

    /**
     * Looks the content up by hash and reuses the stored chunks on a hit.
     * Otherwise uploads through {@code uploader} and records the exact chunk
     * ranges it reports.
     *
     * @throws IOException             if the upload fails; nothing is recorded then
     * @throws MalformedInputException if the uploader reports no chunks
     */
    public IngestResult ingest(String displayName, byte[] content, ChunkUploader uploader, String sessionToken)
            throws IOException {
        Optional<DocumentRecord> existing = documents.findByContent(content);
        if (existing.isPresent()) {
            DocumentRecord record = existing.get();
            LOG.info("'{}' matches document {} ('{}'), reusing {} chunks.",
                    displayName, record.id(), record.displayName(), record.chunkCount());
            eventBus.post(new StoreEvents.DocumentIngested(record.id(), record.displayName(), true));
            return new IngestResult(record.id(), documents.reconstructChunkRanges(record), true);
        }

        List<ChunkRange> chunks = uploader.upload(displayName, content);
        if (chunks == null || chunks.isEmpty()) {
            throw new MalformedInputException("Uploader returned no chunks for " + displayName);
        }
        long id = documents.record(displayName, content, chunks);
        int pageCount = chunks.stream().mapToInt(ChunkRange::endPage).max().orElse(0);

        telemetry.log(EVENT_KIND, Map.of(
                "file_name", displayName,
                "file_size", content.length,
                "total_pages", pageCount,
                "chunks_count", chunks.size()), sessionToken);
        eventBus.post(new StoreEvents.DocumentIngested(id, displayName, false));
        LOG.info("Ingested '{}' as document {} ({} chunks).", displayName, id, chunks.size());
        return new IngestResult(id, chunks, false);
    }
}
