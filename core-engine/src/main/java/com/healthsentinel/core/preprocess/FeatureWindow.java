package com.healthsentinel.core.preprocess;

import java.util.List;

/**
 * Multivariate slice of a {@link DetectionWindow}: aligned baseline rows and
 * the candidate's own row.
 *
 * @since 1.0.0
 */
public final class FeatureWindow {

    private final List<String> featureNames;
    private final double[][] baselineRows;
    private final double[] candidateRow;
    private final int candidateFeature;

    public FeatureWindow(List<String> featureNames, double[][] baselineRows, double[] candidateRow,
            int candidateFeature) {
        if (candidateRow.length != featureNames.size()) {
            throw new IllegalArgumentException("Candidate row has " + candidateRow.length
                    + " columns, expected " + featureNames.size());
        }
        this.featureNames = List.copyOf(featureNames);
        this.baselineRows = baselineRows;
        this.candidateRow = candidateRow;
        this.candidateFeature = candidateFeature;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int dimensions() {
        return featureNames.size();
    }

    public double[][] getBaselineRows() {
        return baselineRows;
    }

    public double[] getCandidateRow() {
        return candidateRow;
    }

    /** Column of the metric under evaluation. */
    public int getCandidateFeature() {
        return candidateFeature;
    }

    public boolean isMultivariate() {
        return featureNames.size() > 1;
    }
}
