package de.bsommerfeld.marketscope.core.domain;

/**
 * Health indicators shown on the maintenance view.
 *
 * @param staleCacheEntries cache rows older than the configured staleness age
 */
public record StoreHealth(long sizeBytes, boolean sizeWarning, int staleCacheEntries, boolean staleCacheWarning) {

    public boolean healthy() {
        return !sizeWarning && !staleCacheWarning;
    }
}
