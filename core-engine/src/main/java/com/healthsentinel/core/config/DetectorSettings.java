package com.healthsentinel.core.config;

import com.healthsentinel.core.model.DetectorKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Detector parameters, bound from the {@code detectors:} section.
 *
 * <pre>
 * detectors:
 *   enabled: [zscore, modified_zscore, iqr, isolation_forest, lof, temporal]
 *   historyWindow: 90
 *   zscoreThreshold: 3.0
 *   contamination: 0.01
 *   temporalEnabled: true
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectorSettings {

    private List<String> enabled = new ArrayList<>(Arrays.stream(DetectorKind.values())
            .map(DetectorKind::getId)
            .toList());
    private int historyWindow = 90;
    private int minimumPoints = 8;

    private double zscoreThreshold = 3.0;
    private double modifiedZscoreThreshold = 3.5;
    private double iqrMultiplier = 1.5;

    private double contamination = 0.01;
    private int isolationTrees = 100;
    private int isolationSampleSize = 256;
    private long isolationSeed = 42L;

    private int densityNeighbors = 20;
    private double densityThreshold = 1.5;

    private boolean temporalEnabled = true;
    private int temporalSequenceLength = 24;
    private int temporalLags = 3;
    private double temporalThreshold = 3.0;

    /**
     * @return an independent copy, used to apply per-request overrides
     */
    public DetectorSettings copy() {
        DetectorSettings c = new DetectorSettings();
        c.enabled = new ArrayList<>(enabled);
        c.historyWindow = historyWindow;
        c.minimumPoints = minimumPoints;
        c.zscoreThreshold = zscoreThreshold;
        c.modifiedZscoreThreshold = modifiedZscoreThreshold;
        c.iqrMultiplier = iqrMultiplier;
        c.contamination = contamination;
        c.isolationTrees = isolationTrees;
        c.isolationSampleSize = isolationSampleSize;
        c.isolationSeed = isolationSeed;
        c.densityNeighbors = densityNeighbors;
        c.densityThreshold = densityThreshold;
        c.temporalEnabled = temporalEnabled;
        c.temporalSequenceLength = temporalSequenceLength;
        c.temporalLags = temporalLags;
        c.temporalThreshold = temporalThreshold;
        return c;
    }

    /**
     * Resolve the configured ids into detector kinds.
     *
     * @return enabled kinds in declaration order
     * @throws IllegalArgumentException if an id is unknown
     */
    public Set<DetectorKind> enabledKinds() {
        Set<DetectorKind> kinds = EnumSet.noneOf(DetectorKind.class);
        for (String id : enabled) {
            kinds.add(DetectorKind.fromId(id));
        }
        if (!temporalEnabled) {
            kinds.remove(DetectorKind.TEMPORAL);
        }
        return kinds;
    }

    /**
     * Firing threshold of a detector in its own raw-score units.
     *
     * @param kind detector kind
     * @return threshold, or the contamination rate for the isolation forest
     */
    public double thresholdFor(DetectorKind kind) {
        return switch (kind) {
            case Z_SCORE -> zscoreThreshold;
            case MODIFIED_Z_SCORE -> modifiedZscoreThreshold;
            case IQR -> iqrMultiplier;
            case ISOLATION_FOREST -> contamination;
            case LOCAL_OUTLIER_FACTOR -> densityThreshold;
            case TEMPORAL -> temporalThreshold;
        };
    }

    /**
     * Replace the firing threshold of one detector.
     *
     * @param kind  detector kind
     * @param value new threshold; for the isolation forest, the contamination
     *              rate
     */
    public void overrideThreshold(DetectorKind kind, double value) {
        switch (kind) {
            case Z_SCORE -> zscoreThreshold = value;
            case MODIFIED_Z_SCORE -> modifiedZscoreThreshold = value;
            case IQR -> iqrMultiplier = value;
            case ISOLATION_FOREST -> contamination = value;
            case LOCAL_OUTLIER_FACTOR -> densityThreshold = value;
            case TEMPORAL -> temporalThreshold = value;
        }
    }

    void validate(List<String> errors) {
        if (enabled == null || enabled.isEmpty()) {
            errors.add("detectors.enabled must list at least one detector");
        } else {
            for (String id : enabled) {
                try {
                    DetectorKind.fromId(id);
                } catch (IllegalArgumentException | NullPointerException e) {
                    errors.add("detectors.enabled: " + e.getMessage());
                }
            }
        }
        if (minimumPoints < 3) {
            errors.add("detectors.minimumPoints must be >= 3, got: " + minimumPoints);
        }
        if (historyWindow < minimumPoints) {
            errors.add("detectors.historyWindow must be >= minimumPoints (" + minimumPoints
                    + "), got: " + historyWindow);
        }
        if (zscoreThreshold <= 0) {
            errors.add("detectors.zscoreThreshold must be > 0");
        }
        if (modifiedZscoreThreshold <= 0) {
            errors.add("detectors.modifiedZscoreThreshold must be > 0");
        }
        if (iqrMultiplier <= 0) {
            errors.add("detectors.iqrMultiplier must be > 0");
        }
        if (contamination <= 0 || contamination > 0.5) {
            errors.add("detectors.contamination must be in (0, 0.5], got: " + contamination);
        }
        if (isolationTrees < 1) {
            errors.add("detectors.isolationTrees must be >= 1");
        }
        if (isolationSampleSize < 2) {
            errors.add("detectors.isolationSampleSize must be >= 2");
        }
        if (densityNeighbors < 1) {
            errors.add("detectors.densityNeighbors must be >= 1");
        }
        if (densityThreshold <= 1.0) {
            errors.add("detectors.densityThreshold must be > 1.0, got: " + densityThreshold);
        }
        if (temporalLags < 1) {
            errors.add("detectors.temporalLags must be >= 1");
        }
        if (temporalSequenceLength < 2 * temporalLags + 2) {
            errors.add("detectors.temporalSequenceLength must be >= 2 * temporalLags + 2 ("
                    + (2 * temporalLags + 2) + "), got: " + temporalSequenceLength);
        }
        if (temporalThreshold <= 0) {
            errors.add("detectors.temporalThreshold must be > 0");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public List<String> getEnabled() {
        return Collections.unmodifiableList(enabled);
    }

    public void setEnabled(List<String> enabled) {
        this.enabled = enabled != null ? new ArrayList<>(enabled) : new ArrayList<>();
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public int getMinimumPoints() {
        return minimumPoints;
    }

    public void setMinimumPoints(int minimumPoints) {
        this.minimumPoints = minimumPoints;
    }

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public void setZscoreThreshold(double zscoreThreshold) {
        this.zscoreThreshold = zscoreThreshold;
    }

    public double getModifiedZscoreThreshold() {
        return modifiedZscoreThreshold;
    }

    public void setModifiedZscoreThreshold(double modifiedZscoreThreshold) {
        this.modifiedZscoreThreshold = modifiedZscoreThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public int getIsolationTrees() {
        return isolationTrees;
    }

    public void setIsolationTrees(int isolationTrees) {
        this.isolationTrees = isolationTrees;
    }

    public int getIsolationSampleSize() {
        return isolationSampleSize;
    }

    public void setIsolationSampleSize(int isolationSampleSize) {
        this.isolationSampleSize = isolationSampleSize;
    }

    public long getIsolationSeed() {
        return isolationSeed;
    }

    public void setIsolationSeed(long isolationSeed) {
        this.isolationSeed = isolationSeed;
    }

    public int getDensityNeighbors() {
        return densityNeighbors;
    }

    public void setDensityNeighbors(int densityNeighbors) {
        this.densityNeighbors = densityNeighbors;
    }

    public double getDensityThreshold() {
        return densityThreshold;
    }

    public void setDensityThreshold(double densityThreshold) {
        this.densityThreshold = densityThreshold;
    }

    public boolean isTemporalEnabled() {
        return temporalEnabled;
    }

    public void setTemporalEnabled(boolean temporalEnabled) {
        this.temporalEnabled = temporalEnabled;
    }

    public int getTemporalSequenceLength() {
        return temporalSequenceLength;
    }

    public void setTemporalSequenceLength(int temporalSequenceLength) {
        this.temporalSequenceLength = temporalSequenceLength;
    }

    public int getTemporalLags() {
        return temporalLags;
    }

    public void setTemporalLags(int temporalLags) {
        this.temporalLags = temporalLags;
    }

    public double getTemporalThreshold() {
        return temporalThreshold;
    }

    public void setTemporalThreshold(double temporalThreshold) {
        this.temporalThreshold = temporalThreshold;
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "enabled=" + enabled +
                ", historyWindow=" + historyWindow +
                ", z=" + zscoreThreshold +
                ", modifiedZ=" + modifiedZscoreThreshold +
                ", iqr=" + iqrMultiplier +
                ", contamination=" + contamination +
                ", lof=" + densityThreshold +
                ", temporal=" + (temporalEnabled ? temporalThreshold : "off") +
                '}';
    }
}
