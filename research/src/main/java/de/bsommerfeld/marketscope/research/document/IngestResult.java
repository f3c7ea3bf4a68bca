package de.bsommerfeld.marketscope.research.document;

import de.bsommerfeld.marketscope.core.domain.ChunkRange;

import java.util.List;

/**
 * @param reused true when an earlier record with identical bytes was picked
 *               up and nothing was uploaded
 */
public record IngestResult(long documentId, List<ChunkRange> chunks, boolean reused) {

    public IngestResult {
        chunks = List.copyOf(chunks);
    }
}
