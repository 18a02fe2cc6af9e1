package com.healthsentinel.core.engine;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.config.EngineConfig;
import com.healthsentinel.core.detection.AnomalyDetector;
import com.healthsentinel.core.detection.DetectorFactory;
import com.healthsentinel.core.ensemble.EnsembleCombiner;
import com.healthsentinel.core.error.AnomalyDetectionException;
import com.healthsentinel.core.error.DetectorUnavailableException;
import com.healthsentinel.core.error.InvalidSampleException;
import com.healthsentinel.core.error.TimeoutExceededException;
import com.healthsentinel.core.explain.ExplanationGenerator;
import com.healthsentinel.core.explain.SuggestedActionAdvisor;
import com.healthsentinel.core.feedback.FeedbackAcknowledgement;
import com.healthsentinel.core.feedback.FeedbackLog;
import com.healthsentinel.core.feedback.FeedbackProcessor;
import com.healthsentinel.core.feedback.FeedbackStatistics;
import com.healthsentinel.core.feedback.InMemoryFeedbackLog;
import com.healthsentinel.core.feedback.InMemoryThresholdStore;
import com.healthsentinel.core.feedback.JsonLinesFeedbackLog;
import com.healthsentinel.core.feedback.ThresholdStore;
import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.model.MetricSample;
import com.healthsentinel.core.model.PersonalThreshold;
import com.healthsentinel.core.model.Verdict;
import com.healthsentinel.core.preprocess.MetricSeries;
import com.healthsentinel.core.preprocess.PreparedInput;
import com.healthsentinel.core.preprocess.SignalPreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Entry point of the health anomaly detection engine.
 *
 * <h3>Pipeline</h3>
 * <p>
 * Preprocess → detectors (in parallel on the worker pool) → ensemble per
 * (metric, timestamp) → explanation. Personal thresholds are snapshotted once
 * per request, so feedback submitted during a request only affects later
 * requests.
 * </p>
 *
 * <h3>Modes</h3>
 * <ul>
 * <li><b>Real-time</b> evaluates the latest observed point of each metric
 * within {@code realtime.latencyBudgetMs}. The temporal detector has its own
 * sub-budget and is skipped when its previous run overran it. Failures are not
 * retried.</li>
 * <li><b>Batch</b> evaluates every observed point. Work is split per (metric,
 * detector, chunk of points); a failed chunk is retried once and then recorded
 * as degraded.</li>
 * </ul>
 * <p>
 * A point's result depends only on the points up to and including it, so
 * batch and real-time agree on every point given the same input and state.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Detector-level problems degrade the report; only a request in which nothing
 * could be evaluated yields a {@link DetectionStatus#FAILED} report with a
 * {@link FailureReason}. Detection never throws for bad data.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetectionEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetectionEngine.class);

    private final EngineConfig config;
    private final DetectionContext context;
    private final SignalPreprocessor preprocessor = new SignalPreprocessor();
    private final EnsembleCombiner combiner;
    private final SuggestedActionAdvisor advisor = new SuggestedActionAdvisor();
    private final ThresholdStore thresholds;
    private final FeedbackProcessor feedback;

    /**
     * Create an engine with an in-memory threshold store and the feedback log
     * configured under {@code feedback.logPath} (in memory when unset).
     */
    public AnomalyDetectionEngine(EngineConfig config) {
        this(config, defaultFeedbackLog(config), new InMemoryThresholdStore(), Clock.systemUTC());
    }

    /**
     * @param config     validated configuration
     * @param feedbackLog feedback log, replayed on construction
     * @param thresholds threshold store
     * @param clock      clock for anomaly and feedback timestamps
     */
    public AnomalyDetectionEngine(EngineConfig config, FeedbackLog feedbackLog, ThresholdStore thresholds,
            Clock clock) {
        this(config, feedbackLog, thresholds, clock, configuredDetectors(config));
    }

    /**
     * Create an engine over an explicit detector table instead of the one
     * built from {@code detectors.enabled}.
     */
    AnomalyDetectionEngine(EngineConfig config, FeedbackLog feedbackLog, ThresholdStore thresholds, Clock clock,
            Map<DetectorKind, AnomalyDetector> detectors) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null");
        config.validate();
        this.thresholds = Objects.requireNonNull(thresholds, "ThresholdStore must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");
        this.combiner = new EnsembleCombiner(config.getEnsemble(), clock);
        this.feedback = new FeedbackProcessor(feedbackLog, thresholds, config.getFeedback(), clock);
        this.context = new DetectionContext(config, detectors);
        LOG.info("Anomaly detection engine started: {}", config);
    }

    /**
     * Create an engine from the configuration found by
     * {@link EngineConfig#resolve()}.
     */
    public static AnomalyDetectionEngine fromDefaultConfig() {
        return new AnomalyDetectionEngine(EngineConfig.resolve());
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    /**
     * Run detection over a set of samples.
     *
     * @param samples samples of one or more metrics, in any order
     * @param options mode and per-request overrides
     * @return the report; never {@code null}
     * @throws IllegalStateException if the engine has been closed
     */
    public DetectionReport detect(List<MetricSample> samples, DetectionOptions options) {
        Objects.requireNonNull(samples, "Samples must not be null");
        Objects.requireNonNull(options, "DetectionOptions must not be null");
        Function<MetricSeries, int[]> candidates = options.getMode() == DetectionMode.REALTIME
                ? AnomalyDetectionEngine::latestObserved
                : AnomalyDetectionEngine::allObserved;
        return run(samples, options, candidates);
    }

    /**
     * Evaluate one incoming sample in real-time mode against its history.
     *
     * @param history  earlier samples
     * @param incoming the new sample
     * @return the report for the incoming sample
     * @see #detectRealtime(List, MetricSample, DetectionOptions)
     */
    public DetectionReport detectRealtime(List<MetricSample> history, MetricSample incoming) {
        return detectRealtime(history, incoming, DetectionOptions.realtime());
    }

    /**
     * Evaluate one incoming sample in real-time mode against its history,
     * with per-request detector selection and parameter overrides.
     *
     * <p>
     * Other metrics in {@code history} take part in the multivariate frame
     * but are not evaluated themselves. The mode of {@code options} is
     * ignored: the request always runs in {@link DetectionMode#REALTIME}.
     * </p>
     *
     * @param history  earlier samples
     * @param incoming the new sample
     * @param options  detector selection and overrides
     * @return the report for the incoming sample
     */
    public DetectionReport detectRealtime(List<MetricSample> history, MetricSample incoming,
            DetectionOptions options) {
        Objects.requireNonNull(history, "History must not be null");
        Objects.requireNonNull(incoming, "Incoming sample must not be null");
        Objects.requireNonNull(options, "DetectionOptions must not be null");
        try {
            incoming.validate();
        } catch (InvalidSampleException e) {
            LOG.warn("Rejecting incoming sample: {}", e.getMessage());
            DetectionReport rejected = DetectionReport.builder(DetectionMode.REALTIME)
                    .failed(FailureReason.NO_VALID_SAMPLES)
                    .receivedSamples(1)
                    .invalidSamples(1)
                    .build();
            context.recordRun(rejected, 0);
            return rejected;
        }
        List<MetricSample> all = new ArrayList<>(history.size() + 1);
        all.addAll(history);
        all.add(incoming);
        return run(all, options.withMode(DetectionMode.REALTIME), series -> {
            if (!series.getMetricName().equals(incoming.getMetricName())) {
                return new int[0];
            }
            int idx = series.indexOfObserved(incoming.getTimestamp());
            return idx >= 0 ? new int[] { idx } : new int[0];
        });
    }

    // ---------------------------------------------------------------
    // Feedback
    // ---------------------------------------------------------------

    /**
     * Record a verdict on an anomaly for one of its detectors.
     *
     * @param anomalyId  anomaly id
     * @param verdict    user verdict
     * @param metricName metric of the anomaly
     * @param detectorId external detector id, e.g. {@code "zscore"}
     * @return acknowledgement with the updated threshold
     * @throws IllegalArgumentException if the detector id is unknown
     */
    public FeedbackAcknowledgement submitFeedback(String anomalyId, Verdict verdict, String metricName,
            String detectorId) {
        return submitFeedback(anomalyId, verdict, metricName, DetectorKind.fromId(detectorId));
    }

    public FeedbackAcknowledgement submitFeedback(String anomalyId, Verdict verdict, String metricName,
            DetectorKind detectorKind) {
        return feedback.submit(anomalyId, verdict, metricName, detectorKind);
    }

    /**
     * @return the metric's personal thresholds by detector (read-only)
     */
    public Map<DetectorKind, PersonalThreshold> getThresholdState(String metricName) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        return feedback.thresholds(metricName);
    }

    public FeedbackStatistics feedbackStatistics() {
        return feedback.statistics();
    }

    public List<String> recommendations() {
        return feedback.recommendations();
    }

    /**
     * Write the feedback log to {@code target} as JSON lines, replacing any
     * existing file.
     *
     * @return number of records written
     * @throws IllegalStateException if the file cannot be written
     */
    public int exportFeedback(Path target) {
        Objects.requireNonNull(target, "Export path must not be null");
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            return feedback.export(writer);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to export feedback to " + target, e);
        }
    }

    /**
     * Clear all feedback and personal thresholds.
     */
    public void resetFeedback() {
        feedback.reset();
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * @return detectors that passed the capability check at start-up
     */
    public Set<DetectorKind> availableDetectors() {
        return context.availableKinds();
    }

    /**
     * @return detectors, run counters and feedback statistics as of now
     */
    public EngineStatus status() {
        return context.status(config.getDetectors().enabledKinds(), feedback.statistics());
    }

    @Override
    public void close() {
        context.close();
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    private DetectionReport run(List<MetricSample> samples, DetectionOptions options,
            Function<MetricSeries, int[]> candidates) {
        if (context.isClosed()) {
            throw new IllegalStateException("Engine has been closed");
        }
        long started = System.nanoTime();
        DetectionReport report = execute(samples, options, candidates);
        context.recordRun(report, System.nanoTime() - started);
        return report;
    }

    private DetectionReport execute(List<MetricSample> samples, DetectionOptions options,
            Function<MetricSeries, int[]> candidates) {
        DetectionMode mode = options.getMode();
        PreparedInput input = preprocessor.prepare(samples);
        DetectionReport.Builder report = DetectionReport.builder(mode)
                .receivedSamples(input.getReceivedCount())
                .invalidSamples(input.getInvalidCount())
                .duplicateSamples(input.getDuplicateCount())
                .gapSamples(input.getGapCount());

        if (!input.hasObservations()) {
            LOG.error("Detection failed: no valid samples among {} received", input.getReceivedCount());
            return report.failed(FailureReason.NO_VALID_SAMPLES).build();
        }

        DetectorSettings settings = options.applyTo(config.getDetectors());
        Map<DetectorKind, AnomalyDetector> detectors = context.detectorsFor(options, settings);
        report.activeDetectors(detectors.keySet());
        if (detectors.isEmpty()) {
            LOG.error("Detection failed: none of the requested detectors is available");
            return report.failed(FailureReason.NO_DETECTORS_AVAILABLE).build();
        }

        Map<String, Map<DetectorKind, PersonalThreshold>> snapshot = new HashMap<>();
        try {
            for (String metric : input.getSeries().keySet()) {
                snapshot.put(metric, thresholds.snapshot(metric));
            }
        } catch (RuntimeException e) {
            LOG.error("Detection failed: threshold store unavailable", e);
            return report.failed(FailureReason.STATE_STORE_UNAVAILABLE).build();
        }

        Evaluation evaluation = new Evaluation();
        List<EvaluationTask> tasks = plan(input, detectors, settings, candidates);
        if (mode == DetectionMode.REALTIME) {
            runRealtime(tasks, evaluation);
        } else {
            runBatch(tasks, evaluation);
        }

        List<Anomaly> anomalies = combineAll(input, evaluation, snapshot, new ExplanationGenerator(settings), mode);
        report.degradedNotes(evaluation.notes())
                .evaluatedPoints(evaluation.evaluatedPoints());

        if (evaluation.isEmpty()) {
            if (!evaluation.failedKinds.isEmpty() && evaluation.failedKinds.containsAll(detectors.keySet())) {
                LOG.error("Detection failed: every detector failed ({})", evaluation.notes());
                return report.failed(FailureReason.ALL_DETECTORS_FAILED).build();
            }
            LOG.info("Not enough data to evaluate any point ({} observed sample(s))", input.getObservedCount());
            return report.status(DetectionStatus.INSUFFICIENT_DATA).build();
        }

        DetectionReport result = report
                .status(evaluation.notes().isEmpty() ? DetectionStatus.COMPLETE : DetectionStatus.DEGRADED)
                .anomalies(anomalies)
                .build();
        LOG.info("Detection finished: {}", result);
        return result;
    }

    private static List<EvaluationTask> plan(PreparedInput input, Map<DetectorKind, AnomalyDetector> detectors,
            DetectorSettings settings, Function<MetricSeries, int[]> candidates) {
        List<EvaluationTask> tasks = new ArrayList<>();
        for (MetricSeries series : input.getSeries().values()) {
            int[] points = candidates.apply(series);
            if (points.length == 0) {
                continue;
            }
            for (AnomalyDetector detector : detectors.values()) {
                tasks.add(new EvaluationTask(input, series.getMetricName(), detector, points,
                        settings.getHistoryWindow()));
            }
        }
        return tasks;
    }

    private void runBatch(List<EvaluationTask> tasks, Evaluation evaluation) {
        int chunkSize = config.getBatch().getChunkSize();
        List<EvaluationTask> chunks = new ArrayList<>();
        for (EvaluationTask task : tasks) {
            chunks.addAll(task.split(chunkSize));
        }

        List<Future<TaskOutcome>> futures = new ArrayList<>(chunks.size());
        for (EvaluationTask chunk : chunks) {
            futures.add(context.workers().submit(chunk));
        }

        List<EvaluationTask> failed = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            try {
                evaluation.accept(await(futures.get(i)));
            } catch (ExecutionException e) {
                LOG.warn("Task {} failed, scheduling retry: {}", chunks.get(i), e.getCause().toString());
                failed.add(chunks.get(i));
            }
        }

        for (EvaluationTask chunk : failed) {
            Throwable last = null;
            boolean done = false;
            for (int attempt = 0; attempt < config.getBatch().getRetries() && !done; attempt++) {
                try {
                    evaluation.accept(await(context.workers().submit(chunk)));
                    done = true;
                } catch (ExecutionException e) {
                    last = e.getCause();
                }
            }
            if (!done) {
                String cause = last != null ? last.toString() : "no retry configured";
                LOG.warn("Task {} failed after retry, recording as degraded: {}", chunk, cause);
                evaluation.fail(chunk.kind(), chunk + " failed: " + cause);
            }
        }
    }

    private void runRealtime(List<EvaluationTask> tasks, Evaluation evaluation) {
        Duration budget = Duration.ofMillis(config.getRealtime().getLatencyBudgetMs());
        long temporalBudgetNanos = TimeUnit.MILLISECONDS.toNanos(config.getRealtime().getTemporalBudgetMs());
        long deadline = System.nanoTime() + budget.toNanos();

        boolean skipTemporal = context.lastTemporalNanos() > temporalBudgetNanos;
        if (skipTemporal) {
            evaluation.note(DetectorKind.TEMPORAL.getId() + " skipped: last run took "
                    + TimeUnit.NANOSECONDS.toMillis(context.lastTemporalNanos()) + " ms, over the "
                    + config.getRealtime().getTemporalBudgetMs() + " ms budget");
            context.clearTemporalEstimate();
        }

        Map<EvaluationTask, Future<TaskOutcome>> futures = new LinkedHashMap<>();
        for (EvaluationTask task : tasks) {
            if (task.kind() == DetectorKind.TEMPORAL) {
                if (skipTemporal) {
                    continue;
                }
                futures.put(task, context.workers().submit(() -> {
                    long start = System.nanoTime();
                    try {
                        return task.call();
                    } finally {
                        context.recordTemporalNanos(System.nanoTime() - start);
                    }
                }));
            } else {
                futures.put(task, context.workers().submit(task));
            }
        }

        for (Map.Entry<EvaluationTask, Future<TaskOutcome>> e : futures.entrySet()) {
            EvaluationTask task = e.getKey();
            long remaining = deadline - System.nanoTime();
            if (task.kind() == DetectorKind.TEMPORAL) {
                remaining = Math.min(remaining, temporalBudgetNanos);
            }
            try {
                evaluation.accept(e.getValue().get(Math.max(0, remaining), TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                e.getValue().cancel(true);
                Duration limit = task.kind() == DetectorKind.TEMPORAL
                        ? Duration.ofNanos(temporalBudgetNanos)
                        : budget;
                TimeoutExceededException timeout = new TimeoutExceededException(task.kind(), limit, ex);
                LOG.warn("{} for {}", timeout.getMessage(), task);
                if (task.kind().isDegradable()) {
                    evaluation.note(timeout.getMessage());
                } else {
                    evaluation.fail(task.kind(), timeout.getMessage());
                }
            } catch (ExecutionException ex) {
                LOG.warn("Task {} failed: {}", task, ex.getCause().toString());
                evaluation.fail(task.kind(), task + " failed: " + ex.getCause());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new AnomalyDetectionException("Interrupted while waiting for " + task, ex);
            }
        }
    }

    private List<Anomaly> combineAll(PreparedInput input, Evaluation evaluation,
            Map<String, Map<DetectorKind, PersonalThreshold>> snapshot, ExplanationGenerator explainer,
            DetectionMode mode) {
        Map<String, Callable<List<Anomaly>>> perMetric = new TreeMap<>();
        evaluation.results.forEach((metric, byTimestamp) -> perMetric.put(metric, () -> combineMetric(
                input.getSeries().get(metric), byTimestamp, snapshot.getOrDefault(metric, Map.of()), explainer)));

        List<Anomaly> anomalies = new ArrayList<>();
        if (mode == DetectionMode.REALTIME) {
            for (Map.Entry<String, Callable<List<Anomaly>>> e : perMetric.entrySet()) {
                try {
                    anomalies.addAll(e.getValue().call());
                } catch (Exception ex) {
                    throw new AnomalyDetectionException("Failed to combine results for " + e.getKey(), ex);
                }
            }
            return anomalies;
        }

        Map<String, Future<List<Anomaly>>> futures = new TreeMap<>();
        perMetric.forEach((metric, job) -> futures.put(metric, context.workers().submit(job)));
        for (Map.Entry<String, Future<List<Anomaly>>> e : futures.entrySet()) {
            try {
                anomalies.addAll(await(e.getValue()));
            } catch (ExecutionException ex) {
                throw new AnomalyDetectionException("Failed to combine results for " + e.getKey(), ex.getCause());
            }
        }
        return anomalies;
    }

    private List<Anomaly> combineMetric(MetricSeries series, Map<Instant, List<DetectorResult>> byTimestamp,
            Map<DetectorKind, PersonalThreshold> metricThresholds, ExplanationGenerator explainer) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (List<DetectorResult> results : byTimestamp.values()) {
            Optional<Anomaly> draft = combiner.combine(results, metricThresholds);
            if (draft.isEmpty()) {
                continue;
            }
            Anomaly anomaly = draft.get();
            anomalies.add(anomaly.toBuilder()
                    .explanation(explainer.explain(anomaly, series))
                    .suggestedActions(advisor.suggest(anomaly))
                    .build());
        }
        return anomalies;
    }

    private static <T> T await(Future<T> future) throws ExecutionException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnomalyDetectionException("Interrupted while waiting for detection tasks", e);
        }
    }

    private static int[] allObserved(MetricSeries series) {
        int[] all = new int[series.observedCount()];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        return all;
    }

    private static int[] latestObserved(MetricSeries series) {
        int latest = series.latestObservedIndex();
        return latest >= 0 ? new int[] { latest } : new int[0];
    }

    private static Map<DetectorKind, AnomalyDetector> configuredDetectors(EngineConfig config) {
        Objects.requireNonNull(config, "EngineConfig must not be null").validate();
        DetectorSettings settings = config.getDetectors();
        return DetectorFactory.createAvailable(settings.enabledKinds(), settings);
    }

    private static FeedbackLog defaultFeedbackLog(EngineConfig config) {
        String path = Objects.requireNonNull(config, "EngineConfig must not be null").getFeedback().getLogPath();
        return path != null ? new JsonLinesFeedbackLog(Path.of(path)) : new InMemoryFeedbackLog();
    }

    // ---------------------------------------------------------------
    // Task plumbing
    // ---------------------------------------------------------------

    /**
     * One detector over a run of candidate points of one metric.
     */
    private static final class EvaluationTask implements Callable<TaskOutcome> {
        private final PreparedInput input;
        private final String metric;
        private final AnomalyDetector detector;
        private final int[] points;
        private final int historyWindow;

        EvaluationTask(PreparedInput input, String metric, AnomalyDetector detector, int[] points,
                int historyWindow) {
            this.input = input;
            this.metric = metric;
            this.detector = detector;
            this.points = points;
            this.historyWindow = historyWindow;
        }

        DetectorKind kind() {
            return detector.getKind();
        }

        List<EvaluationTask> split(int chunkSize) {
            List<EvaluationTask> chunks = new ArrayList<>();
            for (int from = 0; from < points.length; from += chunkSize) {
                int to = Math.min(points.length, from + chunkSize);
                chunks.add(new EvaluationTask(input, metric, detector,
                        Arrays.copyOfRange(points, from, to), historyWindow));
            }
            return chunks;
        }

        @Override
        public TaskOutcome call() {
            TaskOutcome outcome = new TaskOutcome(metric, detector.getKind());
            for (int point : points) {
                try {
                    detector.evaluate(input.window(metric, point, historyWindow)).ifPresent(outcome.results::add);
                } catch (DetectorUnavailableException e) {
                    outcome.unavailable++;
                    outcome.unavailableReason = e.getMessage();
                }
            }
            return outcome;
        }

        @Override
        public String toString() {
            return detector.getKind().getId() + "[" + metric + ", " + points.length + " point(s)]";
        }
    }

    private static final class TaskOutcome {
        private final String metric;
        private final DetectorKind kind;
        private final List<DetectorResult> results = new ArrayList<>();
        private int unavailable;
        private String unavailableReason;

        TaskOutcome(String metric, DetectorKind kind) {
            this.metric = metric;
            this.kind = kind;
        }
    }

    /**
     * Fan-in of task outcomes. Only touched by the request thread.
     */
    private static final class Evaluation {
        private final Map<String, Map<Instant, List<DetectorResult>>> results = new TreeMap<>();
        private final Map<String, Integer> unavailable = new LinkedHashMap<>();
        private final Map<String, String> unavailableReasons = new LinkedHashMap<>();
        private final List<String> notes = new ArrayList<>();
        private final Set<DetectorKind> failedKinds = EnumSet.noneOf(DetectorKind.class);

        void accept(TaskOutcome outcome) {
            for (DetectorResult r : outcome.results) {
                results.computeIfAbsent(outcome.metric, k -> new TreeMap<>())
                        .computeIfAbsent(r.getTimestamp(), k -> new ArrayList<>())
                        .add(r);
            }
            if (outcome.unavailable > 0) {
                String key = outcome.kind.getId() + " on " + outcome.metric;
                unavailable.merge(key, outcome.unavailable, Integer::sum);
                unavailableReasons.put(key, outcome.unavailableReason);
            }
        }

        void note(String note) {
            notes.add(note);
        }

        void fail(DetectorKind kind, String note) {
            failedKinds.add(kind);
            notes.add(note);
        }

        boolean isEmpty() {
            return results.isEmpty();
        }

        int evaluatedPoints() {
            return results.values().stream().mapToInt(Map::size).sum();
        }

        List<String> notes() {
            List<String> all = new ArrayList<>(notes);
            unavailable.forEach((key, count) -> all.add(key + " unavailable for " + count + " window(s): "
                    + unavailableReasons.get(key)));
            return all;
        }
    }
}
