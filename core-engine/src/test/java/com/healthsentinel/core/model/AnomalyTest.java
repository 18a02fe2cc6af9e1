package com.healthsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Anomaly}.
 */
class AnomalyTest {

    private static final Instant TS = Instant.parse("2024-03-10T06:00:00Z");

    private static Anomaly.Builder anomaly(Set<DetectorKind> methods) {
        return Anomaly.builder()
                .metricName("resting_heart_rate")
                .timestamp(TS)
                .value(88)
                .ensembleScore(0.8)
                .severity(Severity.CRITICAL)
                .contributingMethods(methods)
                .createdAt(Instant.parse("2024-03-10T06:00:05Z"));
    }

    @Test
    @DisplayName("Should derive a 16 character hex id from metric, time and methods")
    void shouldComputeStableId() {
        Anomaly a = anomaly(EnumSet.of(DetectorKind.Z_SCORE, DetectorKind.IQR)).build();

        assertThat(a.getId()).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(a.getId()).isEqualTo(Anomaly.computeId("resting_heart_rate", TS,
                List.of(DetectorKind.IQR, DetectorKind.Z_SCORE)));
    }

    @Test
    @DisplayName("Should change the id when the contributing methods differ")
    void shouldDependOnMethods() {
        Anomaly a = anomaly(EnumSet.of(DetectorKind.Z_SCORE)).build();
        Anomaly b = anomaly(EnumSet.of(DetectorKind.Z_SCORE, DetectorKind.IQR)).build();

        assertThat(a.getId()).isNotEqualTo(b.getId());
    }

    @Test
    @DisplayName("Should ignore the creation time in equality")
    void shouldIgnoreCreatedAtInEquals() {
        Anomaly a = anomaly(EnumSet.of(DetectorKind.Z_SCORE)).build();
        Anomaly b = a.toBuilder().createdAt(Instant.parse("2030-01-01T00:00:00Z")).build();

        assertThat(b).isEqualTo(a).hasSameHashCodeAs(a);
    }

    @Test
    @DisplayName("Should require at least one contributing method")
    void shouldRequireMethods() {
        assertThatThrownBy(() -> anomaly(EnumSet.noneOf(DetectorKind.class)).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
