/**
 * Explanations and follow-up suggestions for detected anomalies.
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.explain;
