/**
 * Anomaly detectors.
 *
 * <p>
 * All detectors implement the
 * {@link com.healthsentinel.core.detection.AnomalyDetector}
 * interface and are instantiated via
 * {@link com.healthsentinel.core.detection.DetectorFactory}.
 * Built-in kinds:
 * </p>
 * <ul>
 * <li>{@link com.healthsentinel.core.detection.ZScoreDetector} - standard
 * score against the baseline</li>
 * <li>{@link com.healthsentinel.core.detection.ModifiedZScoreDetector} -
 * median / MAD score</li>
 * <li>{@link com.healthsentinel.core.detection.IqrDetector} - Tukey
 * fences</li>
 * <li>{@link com.healthsentinel.core.detection.IsolationForestDetector} -
 * isolation forest over aligned metrics</li>
 * <li>{@link com.healthsentinel.core.detection.DensityDetector} - local
 * outlier factor</li>
 * <li>{@link com.healthsentinel.core.detection.TemporalDetector} -
 * autoregressive residual (optional capability)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.detection;
