/**
 * Domain model of the health anomaly detection engine.
 *
 * <p>
 * Transient per-request values ({@link com.healthsentinel.core.model.MetricSample},
 * {@link com.healthsentinel.core.model.DetectorResult},
 * {@link com.healthsentinel.core.model.Anomaly}) and the two kinds of state
 * kept across requests ({@link com.healthsentinel.core.model.FeedbackRecord},
 * {@link com.healthsentinel.core.model.PersonalThreshold}). All classes are
 * immutable.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.model;
