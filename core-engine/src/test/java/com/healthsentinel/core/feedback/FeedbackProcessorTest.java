package com.healthsentinel.core.feedback;

import com.healthsentinel.core.config.FeedbackSettings;
import com.healthsentinel.core.error.StateConflictException;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.FeedbackRecord;
import com.healthsentinel.core.model.PersonalThreshold;
import com.healthsentinel.core.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeedbackProcessor}.
 */
class FeedbackProcessorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);

    private static FeedbackProcessor processor(FeedbackLog log, ThresholdStore store) {
        return new FeedbackProcessor(log, store, new FeedbackSettings(), CLOCK);
    }

    private final FeedbackProcessor processor = processor(new InMemoryFeedbackLog(), new InMemoryThresholdStore());

    @Test
    @DisplayName("Should grow the multiplier by 1.1 per distinct false positive")
    void shouldGrowMultiplier() {
        for (int i = 0; i < 3; i++) {
            processor.submit("a" + i, Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);
        }

        PersonalThreshold threshold = processor.thresholds("hrv").get(DetectorKind.Z_SCORE);
        assertThat(threshold.getMultiplier()).isCloseTo(Math.pow(1.1, 3), within(1e-12));
        assertThat(threshold.getFalsePositiveCount()).isEqualTo(3);
        assertThat(threshold.getLastUpdated()).isEqualTo(CLOCK.instant());
    }

    @Test
    @DisplayName("Should clamp the multiplier at ten")
    void shouldClampMultiplier() {
        for (int i = 0; i < 24; i++) {
            processor.submit("a" + i, Verdict.FALSE_POSITIVE, "steps", DetectorKind.IQR);
        }
        assertThat(processor.thresholds("steps").get(DetectorKind.IQR).getMultiplier())
                .isCloseTo(Math.pow(1.1, 24), within(1e-9));

        processor.submit("a24", Verdict.FALSE_POSITIVE, "steps", DetectorKind.IQR);
        processor.submit("a25", Verdict.FALSE_POSITIVE, "steps", DetectorKind.IQR);

        assertThat(processor.thresholds("steps").get(DetectorKind.IQR).getMultiplier())
                .isEqualTo(PersonalThreshold.MAX_MULTIPLIER);
    }

    @Test
    @DisplayName("Should count a repeated verdict on the same anomaly once")
    void shouldBeIdempotent() {
        FeedbackAcknowledgement first = processor.submit("x", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.LOCAL_OUTLIER_FACTOR);
        FeedbackAcknowledgement second = processor.submit("x", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.LOCAL_OUTLIER_FACTOR);

        assertThat(first.isRepeated()).isFalse();
        assertThat(second.isRepeated()).isTrue();
        assertThat(second.getThreshold().getFalsePositiveCount()).isEqualTo(1);
        assertThat(second.getThreshold().getMultiplier()).isCloseTo(1.1, within(1e-12));
    }

    @Test
    @DisplayName("Should let the latest verdict on an anomaly win")
    void shouldUseLatestVerdict() {
        processor.submit("x", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);
        FeedbackAcknowledgement ack = processor.submit("x", Verdict.TRUE_POSITIVE, "hrv", DetectorKind.Z_SCORE);

        assertThat(ack.isRepeated()).isFalse();
        assertThat(ack.getThreshold().getFalsePositiveCount()).isZero();
        assertThat(ack.getThreshold().getTruePositiveCount()).isEqualTo(1);
        // confirmations never lower the threshold below neutral
        assertThat(ack.getThreshold().getMultiplier()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep thresholds independent per metric and detector")
    void shouldIsolateKeys() {
        processor.submit("x", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);

        assertThat(processor.thresholds("hrv")).containsOnlyKeys(DetectorKind.Z_SCORE);
        assertThat(processor.thresholds("steps")).isEmpty();
    }

    @Test
    @DisplayName("Should rebuild thresholds from a persisted log")
    void shouldReplayLog(@TempDir Path dir) {
        Path file = dir.resolve("feedback.jsonl");
        FeedbackProcessor writer = processor(new JsonLinesFeedbackLog(file), new InMemoryThresholdStore());
        writer.submit("a", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);
        writer.submit("b", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);
        writer.submit("c", Verdict.TRUE_POSITIVE, "sleep_hours", DetectorKind.IQR);

        FeedbackProcessor restarted = processor(new JsonLinesFeedbackLog(file), new InMemoryThresholdStore());

        assertThat(restarted.thresholds("hrv").get(DetectorKind.Z_SCORE).getMultiplier())
                .isCloseTo(1.21, within(1e-12));
        assertThat(restarted.thresholds("sleep_hours").get(DetectorKind.IQR).getTruePositiveCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should aggregate statistics across thresholds")
    void shouldComputeStatistics() {
        assertThat(processor.statistics().hasData()).isFalse();

        processor.submit("a", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);
        processor.submit("b", Verdict.TRUE_POSITIVE, "hrv", DetectorKind.Z_SCORE);
        processor.submit("c", Verdict.TRUE_POSITIVE, "steps", DetectorKind.IQR);
        processor.submit("d", Verdict.TRUE_POSITIVE, "steps", DetectorKind.IQR);

        FeedbackStatistics stats = processor.statistics();
        assertThat(stats.getTotalFeedback()).isEqualTo(4);
        assertThat(stats.getAccuracy()).isCloseTo(0.75, within(1e-12));
        assertThat(stats.getFalsePositiveRate()).isCloseTo(0.25, within(1e-12));
        assertThat(stats.getThresholdCount()).isEqualTo(2);
        assertThat(stats.getDetectorBreakdown().get(DetectorKind.Z_SCORE).getFalsePositives()).isEqualTo(1);
        assertThat(stats.getMetricBreakdown().get("steps").getTruePositives()).isEqualTo(2);
        assertThat(stats.getAverageMultiplier()).isCloseTo((1.1 + 1.0) / 2, within(1e-12));
    }

    @Test
    @DisplayName("Should recommend actions from the feedback collected so far")
    void shouldRecommend() {
        assertThat(processor.recommendations())
                .containsExactly("Start providing feedback on anomalies to improve accuracy");

        for (int i = 0; i < 4; i++) {
            processor.submit("a" + i, Verdict.FALSE_POSITIVE, "hrv", DetectorKind.LOCAL_OUTLIER_FACTOR);
        }

        assertThat(processor.recommendations()).containsExactly(
                "Consider increasing detection thresholds to reduce false positives",
                "Consider tuning lof detector - high false positive rate",
                "More feedback needed for reliable threshold adaptation");
    }

    @Test
    @DisplayName("Should forget everything on reset")
    void shouldReset() {
        InMemoryFeedbackLog log = new InMemoryFeedbackLog();
        FeedbackProcessor p = processor(log, new InMemoryThresholdStore());
        p.submit("a", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);

        p.reset();

        assertThat(p.thresholds("hrv")).isEmpty();
        assertThat(log.records()).isEmpty();
        assertThat(p.statistics().getTotalFeedback()).isZero();
    }

    @Test
    @DisplayName("Should export the log as JSON lines that reopen as the same records")
    void shouldExportLog(@TempDir Path dir) throws Exception {
        InMemoryFeedbackLog log = new InMemoryFeedbackLog();
        FeedbackRecord old = new FeedbackRecord("a", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE,
                Instant.parse("2024-01-10T08:00:00Z"));
        FeedbackRecord recent = new FeedbackRecord("b", Verdict.TRUE_POSITIVE, "steps", DetectorKind.IQR,
                Instant.parse("2024-05-20T08:00:00Z"));
        log.append(old);
        log.append(recent);
        FeedbackProcessor p = processor(log, new InMemoryThresholdStore());

        StringWriter all = new StringWriter();
        StringWriter sinceMay = new StringWriter();
        assertThat(p.export(all)).isEqualTo(2);
        assertThat(p.export(sinceMay, Instant.parse("2024-05-01T00:00:00Z"))).isEqualTo(1);

        assertThat(all.toString().lines()).hasSize(2)
                .allSatisfy(line -> assertThat(line).startsWith("{").contains("\"anomalyId\""));
        assertThat(sinceMay.toString()).contains("\"steps\"").contains("2024-05-20T08:00:00Z")
                .doesNotContain("\"hrv\"");

        Path file = dir.resolve("export.jsonl");
        Files.writeString(file, all.toString());
        assertThat(new JsonLinesFeedbackLog(file).records()).containsExactly(old, recent);
    }

    @Test
    @DisplayName("Should apply concurrent submissions without losing updates")
    void shouldHandleConcurrentSubmissions() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<FeedbackAcknowledgement>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String metric = i % 2 == 0 ? "hrv" : "steps";
                String id = "anomaly-" + i;
                futures.add(pool.submit(() -> processor.submit(id, Verdict.FALSE_POSITIVE, metric,
                        DetectorKind.Z_SCORE)));
            }
            for (Future<FeedbackAcknowledgement> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(processor.thresholds("hrv").get(DetectorKind.Z_SCORE).getFalsePositiveCount()).isEqualTo(20);
        assertThat(processor.thresholds("steps").get(DetectorKind.Z_SCORE).getFalsePositiveCount()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should fail with a state conflict when a key stays locked and leave other keys usable")
    void shouldReportStateConflict() throws Exception {
        BlockingFeedbackLog blocking = new BlockingFeedbackLog("slow");
        FeedbackSettings settings = new FeedbackSettings();
        settings.setLockTimeoutMs(50);
        FeedbackProcessor p = new FeedbackProcessor(blocking, new InMemoryThresholdStore(), settings, CLOCK);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<FeedbackAcknowledgement> holder = pool.submit(
                    () -> p.submit("slow", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE));
            assertThat(blocking.entered.await(10, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> p.submit("other", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE))
                    .isInstanceOf(StateConflictException.class)
                    .hasMessageContaining("hrv/zscore");
            assertThat(p.submit("free", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.IQR).getThreshold()
                    .getFalsePositiveCount()).isEqualTo(1);

            blocking.release.countDown();
            assertThat(holder.get(10, TimeUnit.SECONDS).getThreshold().getFalsePositiveCount()).isEqualTo(1);
        } finally {
            blocking.release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should let reset wait for an update in flight instead of being overwritten by it")
    void shouldResetAfterUpdateInFlight() throws Exception {
        BlockingFeedbackLog blocking = new BlockingFeedbackLog("slow");
        FeedbackProcessor p = processor(blocking, new InMemoryThresholdStore());
        p.submit("earlier", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<FeedbackAcknowledgement> holder = pool.submit(
                    () -> p.submit("slow", Verdict.FALSE_POSITIVE, "hrv", DetectorKind.Z_SCORE));
            assertThat(blocking.entered.await(10, TimeUnit.SECONDS)).isTrue();

            Future<?> reset = pool.submit(p::reset);
            assertThatThrownBy(() -> reset.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

            blocking.release.countDown();
            assertThat(holder.get(10, TimeUnit.SECONDS).getThreshold().getFalsePositiveCount()).isEqualTo(2);
            reset.get(10, TimeUnit.SECONDS);
        } finally {
            blocking.release.countDown();
            pool.shutdownNow();
        }

        assertThat(p.thresholds("hrv")).isEmpty();
        assertThat(blocking.records()).isEmpty();
    }

    @Test
    @DisplayName("Should refuse to reset while an update holds its key past the lock timeout")
    void shouldReportResetConflict() throws Exception {
        BlockingFeedbackLog blocking = new BlockingFeedbackLog("slow");
        FeedbackSettings settings = new FeedbackSettings();
        settings.setLockTimeoutMs(50);
        FeedbackProcessor p = new FeedbackProcessor(blocking, new InMemoryThresholdStore(), settings, CLOCK);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<FeedbackAcknowledgement> holder = pool.submit(
                    () -> p.submit("slow", Verdict.FALSE_POSITIVE, "steps", DetectorKind.IQR));
            assertThat(blocking.entered.await(10, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(p::reset)
                    .isInstanceOf(StateConflictException.class)
                    .hasMessageContaining("all thresholds");

            blocking.release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            blocking.release.countDown();
            pool.shutdownNow();
        }

        assertThat(p.thresholds("steps")).containsOnlyKeys(DetectorKind.IQR);
    }

    /** Log whose append of one anomaly id blocks until released. */
    private static final class BlockingFeedbackLog implements FeedbackLog {
        private final InMemoryFeedbackLog delegate = new InMemoryFeedbackLog();
        private final String blockedId;
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        BlockingFeedbackLog(String blockedId) {
            this.blockedId = blockedId;
        }

        @Override
        public void append(FeedbackRecord record) {
            if (record.getAnomalyId().equals(blockedId)) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            delegate.append(record);
        }

        @Override
        public List<FeedbackRecord> records() {
            return delegate.records();
        }

        @Override
        public void clear() {
            delegate.clear();
        }
    }
}
