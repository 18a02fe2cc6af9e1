/**
 * Input cleaning and window construction.
 *
 * <p>
 * {@link com.healthsentinel.core.preprocess.SignalPreprocessor} turns raw
 * samples into {@link com.healthsentinel.core.preprocess.PreparedInput}, which
 * hands out one {@link com.healthsentinel.core.preprocess.DetectionWindow} per
 * candidate point.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.preprocess;
