package de.bsommerfeld.marketscope.research.document;

import de.bsommerfeld.marketscope.core.domain.ChunkRange;

import java.io.IOException;
import java.util.List;

/**
 * Splits a document into chunks and uploads them to external storage.
 */
@FunctionalInterface
public interface ChunkUploader {

    /**
     * @return the uploaded chunks in document order with the pages each covers
     * @throws IOException if splitting or uploading fails
     */
    List<ChunkRange> upload(String displayName, byte[] content) throws IOException;
}
