package com.healthsentinel.core.explain;

import com.healthsentinel.core.config.DetectorSettings;
import com.healthsentinel.core.detection.WindowStatistics;
import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.Explanation;
import com.healthsentinel.core.preprocess.MetricSeries;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the human-readable {@link Explanation} of an anomaly from the
 * metric's history.
 *
 * <p>
 * A pure function of its inputs: nothing is cached between calls and the
 * anomaly is not modified.
 * </p>
 *
 * @since 1.0.0
 */
public class ExplanationGenerator {

    private static final int TOP_FEATURES = 3;

    private static final Map<DetectorKind, String> METHOD_LABELS = new EnumMap<>(Map.of(
            DetectorKind.Z_SCORE, "z-score",
            DetectorKind.MODIFIED_Z_SCORE, "modified z-score",
            DetectorKind.IQR, "quartile range",
            DetectorKind.ISOLATION_FOREST, "isolation forest",
            DetectorKind.LOCAL_OUTLIER_FACTOR, "local density",
            DetectorKind.TEMPORAL, "trend model"));

    private final int historyWindow;
    private final double zscoreThreshold;

    public ExplanationGenerator(DetectorSettings settings) {
        Objects.requireNonNull(settings, "DetectorSettings must not be null");
        this.historyWindow = settings.getHistoryWindow();
        this.zscoreThreshold = settings.getZscoreThreshold();
    }

    /**
     * @param anomaly the anomaly to explain
     * @param history the anomaly metric's series; the anomaly timestamp must
     *                be one of its observed points
     * @return the explanation
     * @throws IllegalArgumentException if the anomaly is not part of the
     *                                  series
     */
    public Explanation explain(Anomaly anomaly, MetricSeries history) {
        Objects.requireNonNull(anomaly, "Anomaly must not be null");
        Objects.requireNonNull(history, "History must not be null");
        int index = history.indexOfObserved(anomaly.getTimestamp());
        if (index < 0) {
            throw new IllegalArgumentException("Anomaly " + anomaly.getId() + " at " + anomaly.getTimestamp()
                    + " is not an observed point of " + history.getMetricName());
        }

        double[] baseline = history.observedValues(Math.max(0, index - historyWindow + 1), index);
        double mean = baseline.length > 0 ? WindowStatistics.mean(baseline) : 0.0;
        double std = baseline.length > 0 ? WindowStatistics.populationStd(baseline) : 0.0;

        List<String> topFeatures = anomaly.getContributingFeatures().size() > 1
                ? anomaly.getContributingFeatures().keySet().stream().limit(TOP_FEATURES).toList()
                : List.of();

        return Explanation.builder()
                .statisticalStatement(statisticalStatement(anomaly.getValue(), baseline.length, mean, std))
                .recurrenceStatement(recurrenceStatement(anomaly.getValue(), history, index, mean, std))
                .topFeatures(topFeatures)
                .methodStatement(methodStatement(anomaly.getContributingMethods(), topFeatures.size() > 1))
                .severityStatement(severityStatement(anomaly))
                .build();
    }

    // ---------------------------------------------------------------
    // Parts
    // ---------------------------------------------------------------

    private static String statisticalStatement(double value, int baselineSize, double mean, double std) {
        if (baselineSize == 0) {
            return "No earlier readings are available for comparison.";
        }
        if (std == 0.0) {
            return String.format(Locale.ROOT, "This value breaks a previously constant reading of %s.",
                    format(mean));
        }
        double z = (value - mean) / std;
        return String.format(Locale.ROOT, "This value is %.1f standard deviations %s your typical range (mean %s).",
                Math.abs(z), z >= 0 ? "above" : "below", format(mean));
    }

    private String recurrenceStatement(double value, MetricSeries history, int index, double mean, double std) {
        boolean above = value >= mean;
        int occurrences = 0;
        Instant latest = null;
        for (int i = 0; i < index; i++) {
            double deviation = history.observedValue(i) - mean;
            if (above ? deviation <= 0 : deviation >= 0) {
                continue;
            }
            boolean similar = std == 0.0 || Math.abs(deviation) / std >= zscoreThreshold;
            if (similar) {
                occurrences++;
                latest = history.observedTimestamp(i);
            }
        }
        if (occurrences == 0) {
            return "This is the first time a reading like this has been recorded.";
        }
        LocalDate date = LocalDate.ofInstant(latest, ZoneOffset.UTC);
        return occurrences == 1
                ? "A similar reading occurred once before, on " + date + "."
                : "Similar readings occurred " + occurrences + " times, most recently on " + date + ".";
    }

    private static String methodStatement(Set<DetectorKind> methods, boolean multivariate) {
        List<String> labels = new ArrayList<>();
        for (DetectorKind kind : methods) {
            labels.add(METHOD_LABELS.get(kind));
        }
        StringBuilder sb = new StringBuilder("Detected by ")
                .append(joinLabels(labels))
                .append(labels.size() == 1 ? " analysis." : " analyses.");
        if (methods.contains(DetectorKind.IQR)) {
            sb.append(" This value falls outside your normal range using statistical quartiles.");
        }
        if (methods.contains(DetectorKind.ISOLATION_FOREST)) {
            sb.append(multivariate
                    ? " This pattern is unusual when considering multiple health metrics together."
                    : " This value is easy to isolate from your other readings.");
        }
        if (methods.contains(DetectorKind.LOCAL_OUTLIER_FACTOR)) {
            sb.append(" This value is significantly different from nearby data points.");
        }
        if (methods.contains(DetectorKind.TEMPORAL)) {
            sb.append(" This value departs from the recent trend of your readings.");
        }
        return sb.toString();
    }

    private static String severityStatement(Anomaly anomaly) {
        return switch (anomaly.getSeverity()) {
            case CRITICAL -> "This is a rare occurrence that may warrant attention.";
            case HIGH -> "This deviation is quite significant.";
            case MEDIUM -> "This is moderately unusual for your patterns.";
            case LOW -> null;
        };
    }

    private static String joinLabels(List<String> labels) {
        if (labels.size() == 1) {
            return labels.get(0);
        }
        return String.join(", ", labels.subList(0, labels.size() - 1)) + " and " + labels.get(labels.size() - 1);
    }

    private static String format(double value) {
        return value == Math.rint(value)
                ? String.format(Locale.ROOT, "%.0f", value)
                : String.format(Locale.ROOT, "%.1f", value);
    }
}
