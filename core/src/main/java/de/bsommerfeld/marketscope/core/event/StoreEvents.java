package de.bsommerfeld.marketscope.core.event;

import de.bsommerfeld.marketscope.core.domain.CleanupReport;
import de.bsommerfeld.marketscope.core.domain.DeleteScope;

/**
 * Events describing changes to the research store that views displaying
 * history or statistics care about.
 */
public class StoreEvents {

    /**
     * A document finished ingestion. {@code reused} is true when an earlier
     * record with identical content was picked up instead of uploading again.
     */
    public record DocumentIngested(long documentId, String displayName, boolean reused) {
    }

    public record BulkDeleteCompleted(DeleteScope scope, int rowsDeleted) {
    }

    public record CleanupCompleted(CleanupReport report) {
    }
}
