/**
 * Detection engine: request orchestration, real-time and batch modes, worker
 * pool, reports and their JSON rendering.
 *
 * <p>
 * {@link com.healthsentinel.core.engine.AnomalyDetectionEngine} is the entry
 * point for callers.
 * </p>
 */
package com.healthsentinel.core.engine;
