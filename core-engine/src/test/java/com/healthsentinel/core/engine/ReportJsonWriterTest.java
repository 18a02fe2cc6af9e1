package com.healthsentinel.core.engine;

import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.Explanation;
import com.healthsentinel.core.model.Severity;
import com.healthsentinel.core.model.SuggestedAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReportJsonWriterTest {

    private final ReportJsonWriter writer = new ReportJsonWriter();

    private static Anomaly anomaly() {
        return Anomaly.builder()
                .timestamp(Instant.parse("2024-02-01T07:00:00Z"))
                .metricName("resting_heart_rate")
                .value(95)
                .ensembleScore(0.97)
                .severity(Severity.CRITICAL)
                .contributingMethods(Set.of(DetectorKind.Z_SCORE, DetectorKind.IQR))
                .explanation(Explanation.builder()
                        .statisticalStatement("This value is 4.5 standard deviations above your typical range (mean 60).")
                        .build())
                .suggestedActions(List.of(SuggestedAction.MARK_NORMAL, SuggestedAction.REMIND_LATER))
                .createdAt(Instant.parse("2024-03-01T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Should write enums as ids and timestamps as ISO-8601")
    void shouldWriteAnomaly() {
        String json = writer.write(anomaly());

        assertThat(json)
                .contains("\"metricName\":\"resting_heart_rate\"")
                .contains("\"severity\":\"critical\"")
                .contains("\"timestamp\":\"2024-02-01T07:00:00Z\"")
                .contains("\"createdAt\":\"2024-03-01T00:00:00Z\"")
                .contains("\"zscore\"")
                .contains("\"remind_later\"")
                .contains("\"summary\":");
    }

    @Test
    @DisplayName("Should write a report with its status and counters")
    void shouldWriteReport() {
        DetectionReport report = DetectionReport.builder(DetectionMode.BATCH)
                .status(DetectionStatus.COMPLETE)
                .anomalies(List.of(anomaly()))
                .activeDetectors(Set.of(DetectorKind.Z_SCORE, DetectorKind.IQR))
                .receivedSamples(31)
                .evaluatedPoints(23)
                .build();

        String json = writer.write(report);

        assertThat(json)
                .contains("\"mode\":\"batch\"")
                .contains("\"status\":\"complete\"")
                .contains("\"receivedSamples\":31")
                .contains("\"id\":\"" + anomaly().getId() + "\"")
                .doesNotContain("failureReason");
    }

    @Test
    @DisplayName("Should include the failure reason of a failed report")
    void shouldWriteFailure() {
        DetectionReport report = DetectionReport.builder(DetectionMode.REALTIME)
                .failed(FailureReason.NO_VALID_SAMPLES)
                .build();

        assertThat(writer.write(report))
                .contains("\"status\":\"failed\"")
                .contains("\"failureReason\":\"no_valid_samples\"")
                .contains("\"anomalies\":[]");
    }

    @Test
    @DisplayName("Should indent output when asked to")
    void shouldPrettyPrint() {
        assertThat(new ReportJsonWriter(true).write(anomaly())).contains("\n");
    }
}
