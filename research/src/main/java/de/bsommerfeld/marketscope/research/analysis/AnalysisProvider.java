package de.bsommerfeld.marketscope.research.analysis;

import java.util.Map;

/**
 * The text-producing service behind an analysis, typically a language model
 * call. Only invoked on a cache miss.
 */
@FunctionalInterface
public interface AnalysisProvider {

    /**
     * @return the generated text; blank results are returned to the caller
     *         but never cached
     */
    String generate(String subject, AnalysisKind kind, Map<String, ?> parameters);
}
