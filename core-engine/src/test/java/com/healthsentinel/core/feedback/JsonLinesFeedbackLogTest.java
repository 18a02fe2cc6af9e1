package com.healthsentinel.core.feedback;

import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.FeedbackRecord;
import com.healthsentinel.core.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonLinesFeedbackLog}.
 */
class JsonLinesFeedbackLogTest {

    private static final Instant TS = Instant.parse("2024-06-01T10:00:00Z");

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should write one JSON object per line with ISO timestamps")
    void shouldWriteJsonLines() throws IOException {
        Path file = dir.resolve("nested/feedback.jsonl");
        JsonLinesFeedbackLog log = new JsonLinesFeedbackLog(file);

        log.append(new FeedbackRecord("a1", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.MODIFIED_Z_SCORE, TS));
        log.append(new FeedbackRecord("a2", Verdict.TRUE_POSITIVE, "steps", DetectorKind.IQR, TS));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0))
                .contains("\"verdict\":\"false_positive\"")
                .contains("\"detectorKind\":\"modified_zscore\"")
                .contains("\"timestamp\":\"2024-06-01T10:00:00Z\"");
    }

    @Test
    @DisplayName("Should read back existing records on open")
    void shouldReloadRecords() {
        Path file = dir.resolve("feedback.jsonl");
        FeedbackRecord record = new FeedbackRecord("a1", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.TEMPORAL, TS);
        new JsonLinesFeedbackLog(file).append(record);

        JsonLinesFeedbackLog reopened = new JsonLinesFeedbackLog(file);

        assertThat(reopened.records()).containsExactly(record);
        assertThat(reopened.records("hrv", DetectorKind.TEMPORAL)).hasSize(1);
        assertThat(reopened.records("hrv", DetectorKind.Z_SCORE)).isEmpty();
    }

    @Test
    @DisplayName("Should skip malformed lines instead of failing")
    void shouldSkipMalformedLines() throws IOException {
        Path file = dir.resolve("feedback.jsonl");
        Files.writeString(file, String.join("\n",
                "{\"anomalyId\":\"a1\",\"verdict\":\"true_positive\",\"metricName\":\"hrv\","
                        + "\"detectorKind\":\"lof\",\"timestamp\":\"2024-06-01T10:00:00Z\"}",
                "not json at all",
                "",
                "{\"anomalyId\":\"a2\",\"verdict\":\"false_positive\"}",
                ""), StandardCharsets.UTF_8);

        JsonLinesFeedbackLog log = new JsonLinesFeedbackLog(file);

        assertThat(log.records()).extracting(FeedbackRecord::getAnomalyId).containsExactly("a1");
    }

    @Test
    @DisplayName("Should delete the file on clear")
    void shouldClear() {
        Path file = dir.resolve("feedback.jsonl");
        JsonLinesFeedbackLog log = new JsonLinesFeedbackLog(file);
        log.append(new FeedbackRecord("a1", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.IQR, TS));

        log.clear();

        assertThat(log.records()).isEmpty();
        assertThat(file).doesNotExist();
        assertThat(log.getPath()).isEqualTo(file);
    }
}
