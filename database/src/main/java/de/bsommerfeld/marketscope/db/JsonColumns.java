package de.bsommerfeld.marketscope.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.marketscope.core.domain.ChunkRange;

import java.sql.SQLException;
import java.util.List;

/**
 * JSON text columns: chunk handles, recorded chunk ranges and telemetry
 * payloads.
 */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> HANDLES = new TypeReference<>() {
    };
    private static final TypeReference<List<ChunkRange>> RANGES = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    /**
     * @throws MalformedInputException if {@code value} cannot be written as JSON
     */
    static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Value cannot be stored as JSON: " + e.getOriginalMessage(), e);
        }
    }

    static List<String> readHandles(String json) throws SQLException {
        return read(json, HANDLES);
    }

    /** {@code null} column means no ranges were recorded. */
    static List<ChunkRange> readRanges(String json) throws SQLException {
        return json == null ? List.of() : read(json, RANGES);
    }

    private static <T> T read(String json, TypeReference<T> type) throws SQLException {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column value: " + e.getOriginalMessage(), e);
        }
    }
}
