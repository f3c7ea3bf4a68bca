package de.bsommerfeld.marketscope.core.domain;

import java.util.List;

/**
 * Everything needed to resume work on a document: the record, its chunks and
 * the question/answer history in the order it was asked.
 */
public record DocumentSession(DocumentRecord document, List<ChunkRange> chunks, List<InteractionRecord> interactions) {

    public DocumentSession {
        chunks = List.copyOf(chunks);
        interactions = List.copyOf(interactions);
    }
}
