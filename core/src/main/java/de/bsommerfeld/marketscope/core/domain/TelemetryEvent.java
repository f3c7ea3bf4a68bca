package de.bsommerfeld.marketscope.core.domain;

import java.time.Instant;

/**
 * @param eventPayload JSON text with no fixed shape, may be {@code null}
 * @param sessionToken may be {@code null} for events outside a user session
 */
public record TelemetryEvent(long id, String eventKind, String eventPayload, String sessionToken, Instant createdAt) {
}
