package de.bsommerfeld.marketscope.core.domain;

/** A cached subject and how many rows it occupies, expired ones included. */
public record SubjectSummary(String subject, int entries) {
}
