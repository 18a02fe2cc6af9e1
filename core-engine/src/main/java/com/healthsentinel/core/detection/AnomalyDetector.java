package com.healthsentinel.core.detection;

import com.healthsentinel.core.error.DetectorUnavailableException;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.preprocess.DetectionWindow;

import java.util.Optional;

/**
 * Contract for all anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: a verdict depends only on
 * the window passed in, so one instance serves every metric and every worker
 * thread concurrently.
 * </p>
 * <p>
 * A detector abstains (returns empty) when the window is too small or
 * degenerate for its statistic. It never throws for ordinary data; only
 * degradable detectors may throw {@link DetectorUnavailableException}.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate the candidate point of a window.
     *
     * @param window the evaluation window
     * @return a result (fired or not), or empty when the detector abstains
     * @throws DetectorUnavailableException if a degradable detector cannot
     *                                      produce a model for this window
     */
    Optional<DetectorResult> evaluate(DetectionWindow window);

    /**
     * @return the kind this detector implements
     */
    DetectorKind getKind();

    /**
     * Capability check performed once when the detector table is built.
     *
     * @return {@code false} to exclude the detector from the active set
     */
    default boolean isAvailable() {
        return true;
    }
}
