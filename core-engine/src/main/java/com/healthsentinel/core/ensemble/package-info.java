/**
 * Fan-in of detector results into anomalies.
 *
 * @since 1.0.0
 */
package com.healthsentinel.core.ensemble;
