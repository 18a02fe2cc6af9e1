package com.healthsentinel.core.feedback;

import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.PersonalThreshold;

import java.util.Collection;
import java.util.Map;

/**
 * Current {@link PersonalThreshold} per (metric, detector).
 *
 * <p>
 * Values are immutable, so a reader always sees a complete threshold. The
 * feedback processor is the only writer.
 * </p>
 *
 * @since 1.0.0
 */
public interface ThresholdStore {

    /**
     * @return an immutable copy of the metric's thresholds; empty when the
     *         metric has no feedback yet
     */
    Map<DetectorKind, PersonalThreshold> snapshot(String metricName);

    /**
     * @return every stored threshold
     */
    Collection<PersonalThreshold> all();

    void put(PersonalThreshold threshold);

    void clear();
}
