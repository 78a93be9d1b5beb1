package com.github.rudygunawan.rendercache.model;

import java.util.List;

/**
 * Health report of a render cache. Warnings never make the cache unhealthy; errors always do.
 */
public final class CacheHealthStatus {
    private final boolean healthy;
    private final List<String> errors;
    private final List<String> warnings;
    private final double utilization;
    private final double memoryUtilization;
    private final double hitRate;

    public CacheHealthStatus(List<String> errors, List<String> warnings, double utilization,
                             double memoryUtilization, double hitRate) {
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.healthy = errors.isEmpty();
        this.utilization = utilization;
        this.memoryUtilization = memoryUtilization;
        this.hitRate = hitRate;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Returns {@code currentEntryCount / maxEntries}.
     */
    public double getUtilization() {
        return utilization;
    }

    /**
     * Returns {@code currentTotalBytes / maxTotalBytes}.
     */
    public double getMemoryUtilization() {
        return memoryUtilization;
    }

    public double getHitRate() {
        return hitRate;
    }

    @Override
    public String toString() {
        return "CacheHealthStatus{"
                + "healthy=" + healthy
                + ", errors=" + errors
                + ", warnings=" + warnings
                + ", utilization=" + String.format("%.2f", utilization)
                + ", memoryUtilization=" + String.format("%.2f", memoryUtilization)
                + ", hitRate=" + String.format("%.2f%%", hitRate * 100)
                + '}';
    }
}
