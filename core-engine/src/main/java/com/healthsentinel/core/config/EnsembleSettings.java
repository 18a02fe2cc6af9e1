package com.healthsentinel.core.config;

import com.healthsentinel.core.model.DetectorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ensemble parameters, bound from the {@code ensemble:} section.
 *
 * <p>
 * Weights are keyed by detector id; detectors without an entry weigh 1.0.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleSettings {

    private Map<String, Object> weights = new LinkedHashMap<>();
    private double decisiveScore = 0.9;
    private double decisionThreshold = 0.5;

    /**
     * @param kind detector kind
     * @return configured weight, 1.0 when absent
     */
    public double weightFor(DetectorKind kind) {
        for (Map.Entry<String, Object> e : weights.entrySet()) {
            if (e.getValue() instanceof Number n && DetectorKind.fromId(e.getKey()) == kind) {
                return n.doubleValue();
            }
        }
        return 1.0;
    }

    void validate(List<String> errors) {
        for (Map.Entry<String, Object> e : weights.entrySet()) {
            try {
                DetectorKind.fromId(e.getKey());
            } catch (IllegalArgumentException | NullPointerException ex) {
                errors.add("ensemble.weights: " + ex.getMessage());
            }
            if (!(e.getValue() instanceof Number n) || n.doubleValue() <= 0) {
                errors.add("ensemble.weights." + e.getKey() + " must be a number > 0, got: " + e.getValue());
            }
        }
        if (decisiveScore <= 0 || decisiveScore > 1) {
            errors.add("ensemble.decisiveScore must be in (0, 1], got: " + decisiveScore);
        }
        if (decisionThreshold <= 0 || decisionThreshold >= 1) {
            errors.add("ensemble.decisionThreshold must be in (0, 1), got: " + decisionThreshold);
        }
    }

    public Map<String, Object> getWeights() {
        return Collections.unmodifiableMap(weights);
    }

    public void setWeights(Map<String, Object> weights) {
        this.weights = weights != null ? new LinkedHashMap<>(weights) : new LinkedHashMap<>();
    }

    public double getDecisiveScore() {
        return decisiveScore;
    }

    public void setDecisiveScore(double decisiveScore) {
        this.decisiveScore = decisiveScore;
    }

    public double getDecisionThreshold() {
        return decisionThreshold;
    }

    public void setDecisionThreshold(double decisionThreshold) {
        this.decisionThreshold = decisionThreshold;
    }

    @Override
    public String toString() {
        return "EnsembleSettings{weights=" + weights + ", decisive=" + decisiveScore
                + ", threshold=" + decisionThreshold + '}';
    }
}
