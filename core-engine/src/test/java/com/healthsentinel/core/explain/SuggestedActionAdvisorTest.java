package com.healthsentinel.core.explain;

import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.Severity;
import com.healthsentinel.core.model.SuggestedAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SuggestedActionAdvisor}.
 */
class SuggestedActionAdvisorTest {

    private final SuggestedActionAdvisor advisor = new SuggestedActionAdvisor();

    private static Anomaly anomaly(String metric, double value, Severity severity) {
        return Anomaly.builder()
                .metricName(metric)
                .timestamp(Instant.parse("2024-04-01T12:00:00Z"))
                .value(value)
                .ensembleScore(0.8)
                .severity(severity)
                .contributingMethods(EnumSet.of(DetectorKind.Z_SCORE))
                .createdAt(Instant.parse("2024-04-01T12:00:01Z"))
                .build();
    }

    @Test
    @DisplayName("Should always offer marking as normal and viewing details")
    void shouldAlwaysOfferDefaults() {
        assertThat(advisor.suggest(anomaly("body_temperature", 38.2, Severity.LOW)))
                .containsExactly(SuggestedAction.MARK_NORMAL, SuggestedAction.VIEW_DETAILS);
    }

    @Test
    @DisplayName("Should suggest checking activity only for an elevated heart rate")
    void shouldHandleHeartRate() {
        assertThat(advisor.suggest(anomaly("Heart_Rate", 130, Severity.MEDIUM)))
                .contains(SuggestedAction.CHECK_RECENT_ACTIVITY);
        assertThat(advisor.suggest(anomaly("resting_heart_rate", 42, Severity.MEDIUM)))
                .doesNotContain(SuggestedAction.CHECK_RECENT_ACTIVITY);
    }

    @Test
    @DisplayName("Should add metric specific actions for sleep and steps")
    void shouldHandleSleepAndSteps() {
        assertThat(advisor.suggest(anomaly("sleep_hours", 2, Severity.LOW))).contains(SuggestedAction.ADD_SLEEP_NOTE);
        assertThat(advisor.suggest(anomaly("daily_steps", 40000, Severity.LOW)))
                .contains(SuggestedAction.CHECK_LOCATION_DATA);
    }

    @Test
    @DisplayName("Should offer a reminder from high severity upwards")
    void shouldRemindForSevereAnomalies() {
        assertThat(advisor.suggest(anomaly("hrv", 10, Severity.HIGH))).endsWith(SuggestedAction.REMIND_LATER);
        assertThat(advisor.suggest(anomaly("hrv", 10, Severity.CRITICAL))).contains(SuggestedAction.REMIND_LATER);
        assertThat(advisor.suggest(anomaly("hrv", 10, Severity.MEDIUM))).doesNotContain(SuggestedAction.REMIND_LATER);
    }
}
