package de.bsommerfeld.marketscope.core.domain;

public record EventKindCount(String eventKind, int events) {
}
