/**
 * Exception taxonomy of the detection engine.
 *
 * <p>
 * All exceptions are unchecked and extend
 * {@link com.healthsentinel.core.error.AnomalyDetectionException}. Detector
 * failures are recovered locally by the engine; only a total failure is
 * reported to the caller, as a failed
 * {@link com.healthsentinel.core.engine.DetectionReport}.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.error;
