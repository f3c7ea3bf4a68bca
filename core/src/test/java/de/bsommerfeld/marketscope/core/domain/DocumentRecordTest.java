package de.bsommerfeld.marketscope.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentRecordTest {

    @Test
    void constructor_shouldDefensivelyCopyHandles() {
        List<String> handles = new ArrayList<>(List.of("h1", "h2"));
        var record = new DocumentRecord(1, "deck.pdf", "abc", 10, 4, 2, handles, null,
                Instant.EPOCH, DocumentStatus.PROCESSED);

        handles.add("h3");

        assertEquals(List.of("h1", "h2"), record.chunkHandles());
        assertThrows(UnsupportedOperationException.class, () -> record.chunkHandles().add("x"));
    }

    @Test
    void constructor_shouldTreatNullListsAsEmpty() {
        var record = new DocumentRecord(1, "deck.pdf", "abc", 10, 4, 0, null, null,
                Instant.EPOCH, DocumentStatus.FAILED);

        assertTrue(record.chunkHandles().isEmpty());
        assertFalse(record.hasRecordedRanges());
    }

    @Test
    void documentStatus_shouldUseLowercaseColumnValues() {
        assertEquals("processed", DocumentStatus.PROCESSED.dbValue());
        assertEquals(DocumentStatus.ARCHIVED, DocumentStatus.fromDbValue("archived"));
    }

    @Test
    void chunkRange_shouldCountInclusivePages() {
        assertEquals(5, new ChunkRange("h", 6, 10).pageCount());
        assertEquals(1, new ChunkRange("h", 3, 3).pageCount());
    }
}
