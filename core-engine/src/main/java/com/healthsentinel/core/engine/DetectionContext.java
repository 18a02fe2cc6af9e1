package com.healthsentinel.core.engine;

import com.healthsentinel.core.config.EngineConfig;
import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.detection.AnomalyDetector;
import com.healthsentinel.core.detection.DetectorFactory;
import com.healthsentinel.core.feedback.FeedbackStatistics;
import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session state owned by one {@link AnomalyDetectionEngine}.
 *
 * <h3>Contents</h3>
 * <ul>
 * <li>the worker pool used for detector and combine tasks;</li>
 * <li>the detector table, with availability negotiated once at
 * construction;</li>
 * <li>the duration of the last real-time temporal run, used to skip the
 * temporal detector when it no longer fits its budget;</li>
 * <li>run counters behind {@link EngineStatus}.</li>
 * </ul>
 *
 * <p>
 * Created with the engine and discarded by {@link #close()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionContext.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ExecutorService workers;
    private final Map<DetectorKind, AnomalyDetector> detectors;
    private final AtomicLong lastTemporalNanos = new AtomicLong(-1);

    // guarded by this
    private long runs;
    private long failedRuns;
    private long totalRunNanos;
    private long lastRunNanos;
    private final Map<String, Long> anomaliesByMetric = new TreeMap<>();

    /**
     * @param detectors detector table, already checked for availability
     */
    DetectionContext(EngineConfig config, Map<DetectorKind, AnomalyDetector> detectors) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        Map<DetectorKind, AnomalyDetector> table = new EnumMap<>(DetectorKind.class);
        table.putAll(Objects.requireNonNull(detectors, "Detector table must not be null"));
        this.detectors = Collections.unmodifiableMap(table);

        int threads = config.getBatch().resolveWorkerThreads();
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "health-sentinel-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        LOG.info("Detection context started with {} worker(s) and detectors {}", threads, detectors.keySet());
    }

    ExecutorService workers() {
        return workers;
    }

    /**
     * @return detectors that passed the capability check, in kind order
     */
    public Set<DetectorKind> availableKinds() {
        return detectors.keySet();
    }

    /**
     * Resolve the detectors of one request.
     *
     * <p>
     * The request's enabled set is intersected with the available kinds.
     * Without parameter overrides the session's detector instances are
     * reused; otherwise fresh instances are built from {@code effective}.
     * </p>
     */
    Map<DetectorKind, AnomalyDetector> detectorsFor(DetectionOptions options, DetectorSettings effective) {
        Set<DetectorKind> requested = options.getEnabledDetectors().orElse(detectors.keySet());
        Map<DetectorKind, AnomalyDetector> selected = new EnumMap<>(DetectorKind.class);
        for (DetectorKind kind : requested) {
            AnomalyDetector configured = detectors.get(kind);
            if (configured == null) {
                LOG.debug("Requested detector '{}' is not available in this session", kind.getId());
                continue;
            }
            selected.put(kind, options.hasParameterOverrides() ? DetectorFactory.create(kind, effective) : configured);
        }
        return Collections.unmodifiableMap(selected);
    }

    /** Duration of the last real-time temporal run, or -1 when unknown. */
    long lastTemporalNanos() {
        return lastTemporalNanos.get();
    }

    void recordTemporalNanos(long nanos) {
        lastTemporalNanos.set(nanos);
    }

    /** Forget the estimate so the next request measures again. */
    void clearTemporalEstimate() {
        lastTemporalNanos.set(-1);
    }

    synchronized void recordRun(DetectionReport report, long nanos) {
        runs++;
        if (report.isFailed()) {
            failedRuns++;
        }
        totalRunNanos += nanos;
        lastRunNanos = nanos;
        for (Anomaly anomaly : report.getAnomalies()) {
            anomaliesByMetric.merge(anomaly.getMetricName(), 1L, Long::sum);
        }
    }

    synchronized EngineStatus status(Set<DetectorKind> enabled, FeedbackStatistics feedback) {
        Duration average = runs == 0 ? Duration.ZERO : Duration.ofNanos(totalRunNanos / runs);
        return new EngineStatus(enabled, detectors.keySet(), runs, failedRuns, anomaliesByMetric,
                Duration.ofNanos(lastRunNanos), average, feedback);
    }

    boolean isClosed() {
        return workers.isShutdown();
    }

    @Override
    public void close() {
        if (workers.isShutdown()) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Workers did not stop within {} s, interrupting", SHUTDOWN_TIMEOUT_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Detection context closed");
    }
}
