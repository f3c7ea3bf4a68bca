package de.bsommerfeld.marketscope.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import de.bsommerfeld.marketscope.core.util.HashUtil;

import java.util.Arrays;
import java.util.Map;

/**
 * Derives cache fingerprints. The canonical form is the JSON array
 * {@code [subject, queryKind, parameters]} with map keys sorted at every
 * nesting level, so two parameter maps with the same content always hash
 * alike regardless of insertion order. JSON string quoting keeps the parts
 * apart whatever characters a subject or kind contains. A {@code null} map
 * counts as empty.
 */
public final class KeyHasher {

    private static final ObjectMapper CANONICAL_JSON = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    private KeyHasher() {
    }

    /**
     * @return lowercase hex SHA-256 of the canonical form
     * @throws MalformedInputException if subject or kind is {@code null}, or
     *                                 a parameter value cannot be serialized
     */
    public static String fingerprint(String subject, String queryKind, Map<String, ?> parameters) {
        return HashUtil.sha256(canonicalForm(subject, queryKind, parameters));
    }

    static String canonicalForm(String subject, String queryKind, Map<String, ?> parameters) {
        StoreArguments.requireNonNull(subject, "subject");
        StoreArguments.requireNonNull(queryKind, "queryKind");
        Map<String, ?> params = parameters != null ? parameters : Map.of();
        try {
            return CANONICAL_JSON.writeValueAsString(Arrays.asList(subject, queryKind, params));
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Parameters for " + subject + "/" + queryKind
                    + " cannot be serialized canonically", e);
        }
    }
}
