package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * An ingested document and where its chunks live.
 *
 * @param contentHash    SHA-256 of the raw bytes, the deduplication key
 * @param byteSize       size of the raw bytes
 * @param chunkHandles   opaque chunk identifiers in chunk order
 * @param recordedRanges exact page ranges reported at ingestion; empty for
 *                       records that only know their handles
 */
public record DocumentRecord(
        long id,
        String displayName,
        String contentHash,
        long byteSize,
        int pageCount,
        int chunkCount,
        List<String> chunkHandles,
        List<ChunkRange> recordedRanges,
        Instant processedAt,
        DocumentStatus status) {

    public DocumentRecord {
        chunkHandles = chunkHandles != null ? List.copyOf(chunkHandles) : List.of();
        recordedRanges = recordedRanges != null ? List.copyOf(recordedRanges) : List.of();
    }

    public boolean hasRecordedRanges() {
        return !recordedRanges.isEmpty();
    }
}
