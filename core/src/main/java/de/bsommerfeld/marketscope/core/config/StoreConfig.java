package de.bsommerfeld.marketscope.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Settings of the persistent research store: file name, cache lifetime,
 * cost rates, retention and health thresholds.
 */
public class StoreConfig {

    @JsonProperty("database-file")
    private String databaseFile = "market-research.db";

    /** Lifetime of cached analyses. 0 or less stores entries without expiry. */
    @JsonProperty("cache-ttl-hours")
    private int cacheTtlHours = 24;

    /** USD per 1000 question tokens. */
    @JsonProperty("input-token-rate")
    private double inputTokenRate = 0.01;

    /** USD per 1000 answer tokens. */
    @JsonProperty("output-token-rate")
    private double outputTokenRate = 0.03;

    @JsonProperty("telemetry-retention-days")
    private int telemetryRetentionDays = 90;

    @JsonProperty("popular-window-days")
    private int popularWindowDays = 30;

    @JsonProperty("size-warning-mb")
    private int sizeWarningMb = 50;

    @JsonProperty("stale-cache-days")
    private int staleCacheDays = 7;

    @JsonProperty("stale-cache-warning-threshold")
    private int staleCacheWarningThreshold = 50;

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public int getCacheTtlHours() {
        return cacheTtlHours;
    }

    public void setCacheTtlHours(int cacheTtlHours) {
        this.cacheTtlHours = cacheTtlHours;
    }

    /** The configured cache lifetime, or {@code null} for entries that never expire. */
    public Duration cacheTtl() {
        return cacheTtlHours > 0 ? Duration.ofHours(cacheTtlHours) : null;
    }

    public double getInputTokenRate() {
        return inputTokenRate;
    }

    public void setInputTokenRate(double inputTokenRate) {
        this.inputTokenRate = inputTokenRate;
    }

    public double getOutputTokenRate() {
        return outputTokenRate;
    }

    public void setOutputTokenRate(double outputTokenRate) {
        this.outputTokenRate = outputTokenRate;
    }

    public int getTelemetryRetentionDays() {
        return telemetryRetentionDays;
    }

    public void setTelemetryRetentionDays(int telemetryRetentionDays) {
        this.telemetryRetentionDays = telemetryRetentionDays;
    }

    public int getPopularWindowDays() {
        return popularWindowDays;
    }

    public void setPopularWindowDays(int popularWindowDays) {
        this.popularWindowDays = popularWindowDays;
    }

    public int getSizeWarningMb() {
        return sizeWarningMb;
    }

    public void setSizeWarningMb(int sizeWarningMb) {
        this.sizeWarningMb = sizeWarningMb;
    }

    public int getStaleCacheDays() {
        return staleCacheDays;
    }

    public void setStaleCacheDays(int staleCacheDays) {
        this.staleCacheDays = staleCacheDays;
    }

    public int getStaleCacheWarningThreshold() {
        return staleCacheWarningThreshold;
    }

    public void setStaleCacheWarningThreshold(int staleCacheWarningThreshold) {
        this.staleCacheWarningThreshold = staleCacheWarningThreshold;
    }
}
