package com.healthsentinel.core.config;

import java.util.List;

/**
 * Latency budgets for real-time mode, bound from the {@code realtime:} section.
 *
 * @since 1.0.0
 */
public class RealtimeSettings {

    private long latencyBudgetMs = 100;
    private long temporalBudgetMs = 40;

    void validate(List<String> errors) {
        if (latencyBudgetMs <= 0) {
            errors.add("realtime.latencyBudgetMs must be > 0");
        }
        if (temporalBudgetMs <= 0 || temporalBudgetMs > latencyBudgetMs) {
            errors.add("realtime.temporalBudgetMs must be in (0, latencyBudgetMs], got: " + temporalBudgetMs);
        }
    }

    public long getLatencyBudgetMs() {
        return latencyBudgetMs;
    }

    public void setLatencyBudgetMs(long latencyBudgetMs) {
        this.latencyBudgetMs = latencyBudgetMs;
    }

    public long getTemporalBudgetMs() {
        return temporalBudgetMs;
    }

    public void setTemporalBudgetMs(long temporalBudgetMs) {
        this.temporalBudgetMs = temporalBudgetMs;
    }

    @Override
    public String toString() {
        return "RealtimeSettings{latency=" + latencyBudgetMs + "ms, temporal=" + temporalBudgetMs + "ms}";
    }
}
