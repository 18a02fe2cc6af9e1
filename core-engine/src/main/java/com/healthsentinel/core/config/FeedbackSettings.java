package com.healthsentinel.core.config;

import java.util.List;

/**
 * Feedback storage, bound from the {@code feedback:} section.
 *
 * <p>
 * Without a {@code logPath} feedback is kept in memory for the lifetime of the
 * engine.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedbackSettings {

    private String logPath;
    private long lockTimeoutMs = 2000;

    void validate(List<String> errors) {
        if (logPath != null && logPath.isBlank()) {
            errors.add("feedback.logPath must not be blank when set");
        }
        if (lockTimeoutMs <= 0) {
            errors.add("feedback.lockTimeoutMs must be > 0");
        }
    }

    public String getLogPath() {
        return logPath;
    }

    public void setLogPath(String logPath) {
        this.logPath = logPath;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public void setLockTimeoutMs(long lockTimeoutMs) {
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public String toString() {
        return "FeedbackSettings{logPath=" + logPath + ", lockTimeoutMs=" + lockTimeoutMs + '}';
    }
}
