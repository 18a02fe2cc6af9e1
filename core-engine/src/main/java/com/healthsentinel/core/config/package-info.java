/**
 * YAML configuration of the detection engine.
 *
 * <p>
 * {@link com.healthsentinel.core.config.EngineConfig} binds a YAML document
 * with SnakeYAML and validates it before any engine is built. Each section
 * class checks its own values.
 * </p>
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.config;
