package de.bsommerfeld.marketscope.research.document;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.marketscope.core.config.ResearchConfig;
import de.bsommerfeld.marketscope.core.domain.DocumentSession;
import de.bsommerfeld.marketscope.core.domain.DocumentSummary;
import de.bsommerfeld.marketscope.db.DocumentStore;
import de.bsommerfeld.marketscope.db.InteractionLog;
import de.bsommerfeld.marketscope.db.TelemetryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records answers to questions asked against an ingested document and brings
 * earlier document sessions back.
 */
@Singleton
public class DocumentQaService {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentQaService.class);
    static final String EVENT_KIND = "pdf_query";

    private final DocumentStore documents;
    private final InteractionLog interactions;
    private final TelemetryLog telemetry;
    private final ResearchConfig config;

    @Inject
    public DocumentQaService(DocumentStore documents, InteractionLog interactions,
            TelemetryLog telemetry, ResearchConfig config) {
        this.documents = documents;
        this.interactions = interactions;
        this.telemetry = telemetry;
        this.config = config;
    }

    /**
     * Appends the exchange with word-based token estimates.
     *
     * @return id of the stored interaction
     * @throws de.bsommerfeld.marketscope.db.NotFoundException if the document is gone
     */
    public long recordAnswer(long documentId, String question, String answer, String sessionToken) {
        long queryTokens = estimateTokens(question);
        long responseTokens = estimateTokens(answer);
        long id = interactions.append(documentId, question, answer, queryTokens, responseTokens);
        telemetry.log(EVENT_KIND, Map.of(
                "document_id", documentId,
                "question_length", question.length(),
                "answer_length", answer.length()), sessionToken);
        LOG.debug("Recorded answer {} for document {}.", id, documentId);
        return id;
    }

    /** {@code round(words * tokensPerWord)}, words split on whitespace. */
    long estimateTokens(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int words = text.strip().split("\\s+").length;
        return Math.round(words * config.getTokensPerWord());
    }

    public Optional<DocumentSession> restore(long documentId) {
        return documents.restoreSession(documentId);
    }

    public List<DocumentSummary> sessions(int limit) {
        return documents.sessions(limit);
    }
}
