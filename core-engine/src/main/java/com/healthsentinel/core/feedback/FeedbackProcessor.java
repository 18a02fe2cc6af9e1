package com.healthsentinel.core.feedback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsentinel.core.config.FeedbackSettings;
import com.healthsentinel.core.error.StateConflictException;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.FeedbackRecord;
import com.healthsentinel.core.model.PersonalThreshold;
import com.healthsentinel.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Records user feedback and maintains the personal thresholds.
 *
 * <h3>Threshold rule</h3>
 * <p>
 * For each (metric, detector) key the threshold is recomputed from that key's
 * full log, keeping only the last verdict per anomaly id:
 * {@code multiplier = clamp(1.1^falsePositives, 0.1, 10.0)}. True positives
 * are counted but leave the multiplier unchanged. Recomputing from the log
 * makes a repeated submission a no-op.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * This class is the only writer of the {@link ThresholdStore}. Updates of one
 * key are serialised by a per-key lock acquired with a timeout; updates of
 * different keys run in parallel. A timed-out acquisition is retried once
 * before {@link StateConflictException} is raised. Every keyed update also
 * holds the shared side of a reset gate, so {@link #reset()} waits for the
 * updates in flight and keeps new ones out until the store is cleared.
 * </p>
 *
 * @since 1.0.0
 */
public class FeedbackProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(FeedbackProcessor.class);

    /** Growth of the multiplier per false positive. */
    static final double FALSE_POSITIVE_FACTOR = 1.1;

    /** Below this many effective verdicts, adaptation is considered unreliable. */
    static final int MIN_RELIABLE_FEEDBACK = 10;

    private static final int LOCK_ATTEMPTS = 2;

    private final FeedbackLog log;
    private final ThresholdStore store;
    private final long lockTimeoutMs;
    private final Clock clock;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock resetGate = new ReentrantReadWriteLock();
    private final ObjectMapper exportMapper = JsonLinesFeedbackLog.createMapper();

    /**
     * Create the processor and rebuild the threshold store from the log.
     */
    public FeedbackProcessor(FeedbackLog log, ThresholdStore store, FeedbackSettings settings, Clock clock) {
        this.log = Objects.requireNonNull(log, "FeedbackLog must not be null");
        this.store = Objects.requireNonNull(store, "ThresholdStore must not be null");
        this.lockTimeoutMs = Objects.requireNonNull(settings, "FeedbackSettings must not be null").getLockTimeoutMs();
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        replay();
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Record a verdict and update the threshold of its (metric, detector) key.
     *
     * @param anomalyId  id of the anomaly the verdict refers to
     * @param verdict    the user's verdict
     * @param metricName metric of the anomaly
     * @param kind       detector whose threshold is adjusted
     * @return the stored verdict and the resulting threshold
     * @throws StateConflictException if the key stayed locked through both
     *                                attempts
     */
    public FeedbackAcknowledgement submit(String anomalyId, Verdict verdict, String metricName, DetectorKind kind) {
        Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        Objects.requireNonNull(verdict, "verdict must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(kind, "detector kind must not be null");

        StateConflictException conflict = null;
        for (int attempt = 1; attempt <= LOCK_ATTEMPTS; attempt++) {
            try {
                return submitLocked(anomalyId, verdict, metricName, kind);
            } catch (StateConflictException e) {
                conflict = e;
                LOG.warn("Attempt {}/{} to update threshold {}/{} failed: {}", attempt, LOCK_ATTEMPTS,
                        metricName, kind.getId(), e.getMessage());
            }
        }
        LOG.error("Giving up on feedback for anomaly {}: {}", anomalyId, conflict.getMessage());
        throw conflict;
    }

    /**
     * @return the current thresholds of a metric; empty without feedback
     */
    public Map<DetectorKind, PersonalThreshold> thresholds(String metricName) {
        return store.snapshot(metricName);
    }

    public FeedbackStatistics statistics() {
        Collection<PersonalThreshold> all = store.all();
        int fp = 0;
        int tp = 0;
        double multiplierSum = 0.0;
        Map<DetectorKind, FeedbackStatistics.Counts> byDetector = new EnumMap<>(DetectorKind.class);
        Map<String, FeedbackStatistics.Counts> byMetric = new TreeMap<>();
        FeedbackStatistics.Counts zero = new FeedbackStatistics.Counts(0, 0);
        for (PersonalThreshold t : all) {
            fp += t.getFalsePositiveCount();
            tp += t.getTruePositiveCount();
            multiplierSum += t.getMultiplier();
            byDetector.merge(t.getDetectorKind(), zero.plus(t.getFalsePositiveCount(), t.getTruePositiveCount()),
                    (a, b) -> a.plus(b.getFalsePositives(), b.getTruePositives()));
            byMetric.merge(t.getMetricName(), zero.plus(t.getFalsePositiveCount(), t.getTruePositiveCount()),
                    (a, b) -> a.plus(b.getFalsePositives(), b.getTruePositives()));
        }
        double average = all.isEmpty() ? PersonalThreshold.DEFAULT_MULTIPLIER : multiplierSum / all.size();
        return new FeedbackStatistics(fp, tp, byDetector, byMetric, all.size(), average);
    }

    /**
     * @return hints on how to improve detection, most general first
     */
    public List<String> recommendations() {
        FeedbackStatistics stats = statistics();
        List<String> hints = new ArrayList<>();
        if (!stats.hasData()) {
            hints.add("Start providing feedback on anomalies to improve accuracy");
            return hints;
        }
        if (stats.getFalsePositiveRate() > 0.3) {
            hints.add("Consider increasing detection thresholds to reduce false positives");
        } else if (stats.getFalsePositiveRate() < 0.05) {
            hints.add("Detection seems well-tuned. Consider enabling more sensitive methods");
        }
        stats.getDetectorBreakdown().forEach((kind, counts) -> {
            if (counts.getTotal() > 0 && counts.getFalsePositiveRate() > 0.5) {
                hints.add("Consider tuning " + kind.getId() + " detector - high false positive rate");
            }
        });
        if (stats.getTotalFeedback() < MIN_RELIABLE_FEEDBACK) {
            hints.add("More feedback needed for reliable threshold adaptation");
        }
        return hints;
    }

    /**
     * Forget all feedback: clears the log and every threshold.
     *
     * @throws StateConflictException if updates in flight did not finish
     *                                within the lock timeout
     */
    public void reset() {
        Lock exclusive = resetGate.writeLock();
        acquire(exclusive, "all thresholds");
        try {
            log.clear();
            store.clear();
            LOG.info("Feedback log and personal thresholds reset");
        } finally {
            exclusive.unlock();
        }
    }

    /**
     * Write the whole feedback log as JSON lines, in the format of
     * {@link JsonLinesFeedbackLog}.
     *
     * @return number of records written
     * @throws IOException if writing fails
     */
    public int export(Writer out) throws IOException {
        return export(out, null);
    }

    /**
     * Write the records at or after {@code since} as JSON lines, oldest
     * first. The output can be opened as a {@link JsonLinesFeedbackLog}.
     *
     * @param out   destination; flushed but not closed
     * @param since earliest record timestamp to include, or {@code null} for
     *              all records
     * @return number of records written
     * @throws IOException if writing fails
     */
    public int export(Writer out, Instant since) throws IOException {
        Objects.requireNonNull(out, "Writer must not be null");
        int written = 0;
        for (FeedbackRecord r : log.records()) {
            if (since != null && r.getTimestamp().isBefore(since)) {
                continue;
            }
            JsonLinesFeedbackLog.writeLine(exportMapper, out, r);
            written++;
        }
        out.flush();
        LOG.info("Exported {} feedback record(s)", written);
        return written;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private FeedbackAcknowledgement submitLocked(String anomalyId, Verdict verdict, String metricName,
            DetectorKind kind) {
        String key = metricName + "/" + kind.getId();
        Lock shared = resetGate.readLock();
        acquire(shared, "threshold " + key);
        try {
            ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            acquire(lock, "threshold " + key);
            try {
                List<FeedbackRecord> history = log.records(metricName, kind);
                boolean repeated = verdict == lastVerdicts(history).get(anomalyId);

                log.append(new FeedbackRecord(anomalyId, verdict, metricName, kind, clock.instant()));
                PersonalThreshold threshold = recompute(metricName, kind, log.records(metricName, kind));
                store.put(threshold);
                LOG.info("Feedback {} for anomaly {} -> {}", verdict.getId(), anomalyId, threshold);
                return new FeedbackAcknowledgement(anomalyId, verdict, threshold, repeated);
            } finally {
                lock.unlock();
            }
        } finally {
            shared.unlock();
        }
    }

    private void acquire(Lock lock, String what) {
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateConflictException("Interrupted while waiting for " + what, e);
        }
        if (!acquired) {
            throw new StateConflictException("Timed out after " + lockTimeoutMs + " ms waiting for " + what);
        }
    }

    private void replay() {
        Map<String, List<FeedbackRecord>> byKey = new LinkedHashMap<>();
        for (FeedbackRecord r : log.records()) {
            byKey.computeIfAbsent(r.getMetricName() + '|' + r.getDetectorKind().getId(), k -> new ArrayList<>())
                    .add(r);
        }
        for (List<FeedbackRecord> records : byKey.values()) {
            FeedbackRecord first = records.get(0);
            store.put(recompute(first.getMetricName(), first.getDetectorKind(), records));
        }
        if (!byKey.isEmpty()) {
            LOG.info("Rebuilt {} personal threshold(s) from the feedback log", byKey.size());
        }
    }

    static PersonalThreshold recompute(String metricName, DetectorKind kind, List<FeedbackRecord> records) {
        Map<String, Verdict> last = lastVerdicts(records);
        int fp = 0;
        int tp = 0;
        for (Verdict v : last.values()) {
            if (v == Verdict.FALSE_POSITIVE) {
                fp++;
            } else {
                tp++;
            }
        }
        Instant updated = records.stream()
                .map(FeedbackRecord::getTimestamp)
                .max(Instant::compareTo)
                .orElse(null);
        double multiplier = PersonalThreshold.clamp(Math.pow(FALSE_POSITIVE_FACTOR, fp));
        return new PersonalThreshold(metricName, kind, multiplier, fp, tp, updated);
    }

    private static Map<String, Verdict> lastVerdicts(List<FeedbackRecord> records) {
        Map<String, Verdict> last = new LinkedHashMap<>();
        for (FeedbackRecord r : records) {
            last.put(r.getAnomalyId(), r.getVerdict());
        }
        return last;
    }
}
