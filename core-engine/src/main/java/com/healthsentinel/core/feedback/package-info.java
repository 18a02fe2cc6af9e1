/**
 * User feedback and adaptive personal thresholds.
 *
 * <p>
 * {@link com.healthsentinel.core.feedback.FeedbackProcessor} appends verdicts
 * to a {@link com.healthsentinel.core.feedback.FeedbackLog} and derives one
 * {@link com.healthsentinel.core.model.PersonalThreshold} per (metric,
 * detector) into a {@link com.healthsentinel.core.feedback.ThresholdStore},
 * which the engine snapshots at the start of every detection request.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.feedback;
