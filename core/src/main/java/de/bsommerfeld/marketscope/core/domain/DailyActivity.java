package de.bsommerfeld.marketscope.core.domain;

import java.time.LocalDate;

/** Telemetry events per UTC day. */
public record DailyActivity(LocalDate day, int events) {
}
