package com.healthsentinel.core.feedback;

import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.PersonalThreshold;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link ThresholdStore} backed by concurrent maps.
 *
 * @since 1.0.0
 */
public class InMemoryThresholdStore implements ThresholdStore {

    private final ConcurrentMap<String, ConcurrentMap<DetectorKind, PersonalThreshold>> thresholds =
            new ConcurrentHashMap<>();

    @Override
    public Map<DetectorKind, PersonalThreshold> snapshot(String metricName) {
        Map<DetectorKind, PersonalThreshold> byKind = thresholds.get(metricName);
        if (byKind == null || byKind.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(byKind));
    }

    @Override
    public Collection<PersonalThreshold> all() {
        return thresholds.values().stream()
                .flatMap(m -> m.values().stream())
                .toList();
    }

    @Override
    public void put(PersonalThreshold threshold) {
        Objects.requireNonNull(threshold, "PersonalThreshold must not be null");
        thresholds.computeIfAbsent(threshold.getMetricName(), k -> new ConcurrentHashMap<>())
                .put(threshold.getDetectorKind(), threshold);
    }

    @Override
    public void clear() {
        thresholds.clear();
    }
}
