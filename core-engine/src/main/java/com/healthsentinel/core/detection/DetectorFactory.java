package com.healthsentinel.core.detection;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Strategy table that creates {@link AnomalyDetector} instances per
 * {@link DetectorKind}.
 *
 * <p>
 * This is the single point of extension when adding a detector: add the kind
 * to {@link DetectorKind} and register its constructor in {@link #STRATEGIES}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private static final Map<DetectorKind, Function<DetectorSettings, AnomalyDetector>> STRATEGIES;

    static {
        Map<DetectorKind, Function<DetectorSettings, AnomalyDetector>> table = new EnumMap<>(DetectorKind.class);
        table.put(DetectorKind.Z_SCORE, ZScoreDetector::new);
        table.put(DetectorKind.MODIFIED_Z_SCORE, ModifiedZScoreDetector::new);
        table.put(DetectorKind.IQR, IqrDetector::new);
        table.put(DetectorKind.ISOLATION_FOREST, IsolationForestDetector::new);
        table.put(DetectorKind.LOCAL_OUTLIER_FACTOR, DensityDetector::new);
        table.put(DetectorKind.TEMPORAL, TemporalDetector::new);
        STRATEGIES = Collections.unmodifiableMap(table);
    }

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create a detector of the given kind.
     *
     * @param kind     detector kind; must not be {@code null}
     * @param settings detector parameters; must not be {@code null}
     * @return a new detector
     * @throws NullPointerException if an argument is {@code null}
     */
    public static AnomalyDetector create(DetectorKind kind, DetectorSettings settings) {
        Objects.requireNonNull(kind, "DetectorKind must not be null");
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        Function<DetectorSettings, AnomalyDetector> strategy = STRATEGIES.get(kind);
        if (strategy == null) {
            throw new IllegalArgumentException("No detector registered for kind: " + kind);
        }
        return strategy.apply(settings);
    }

    /**
     * Create every requested detector and keep those that report themselves
     * available.
     *
     * <p>
     * The returned map is <strong>unmodifiable</strong> and iterates in
     * {@link DetectorKind} order.
     * </p>
     *
     * @param kinds    requested kinds
     * @param settings detector parameters
     * @return available detectors keyed by kind
     */
    public static Map<DetectorKind, AnomalyDetector> createAvailable(Collection<DetectorKind> kinds,
            DetectorSettings settings) {
        Objects.requireNonNull(kinds, "Detector kinds must not be null");
        Map<DetectorKind, AnomalyDetector> detectors = new EnumMap<>(DetectorKind.class);
        for (DetectorKind kind : kinds) {
            AnomalyDetector detector = create(kind, settings);
            if (detector.isAvailable()) {
                detectors.put(kind, detector);
            } else {
                LOG.warn("Detector '{}' is not available and is excluded from the active set", kind.getId());
            }
        }
        LOG.info("Active detectors: {}", detectors.keySet());
        return Collections.unmodifiableMap(detectors);
    }
}
