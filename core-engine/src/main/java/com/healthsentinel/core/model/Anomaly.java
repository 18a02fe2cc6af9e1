package com.healthsentinel.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * A flagged (metric, timestamp) produced by the ensemble.
 *
 * <h3>Identity</h3>
 * <p>
 * The {@link #getId() id} is derived from the metric, the timestamp and the
 * contributing detector ids, so re-running the same detection yields the same
 * id. Feedback refers to anomalies by this id. {@code createdAt} is excluded
 * from {@link #equals(Object)}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricName}, {@code timestamp},
 * {@code severity} and {@code createdAt} are required and at least one
 * contributing method must be present.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly {

    private static final int ID_LENGTH = 16;

    private final String id;
    private final Instant timestamp;
    private final String metricName;
    private final double value;
    private final double ensembleScore;
    private final Severity severity;
    private final Set<DetectorKind> contributingMethods;
    private final Map<String, Double> contributingFeatures;
    private final Explanation explanation;
    private final List<SuggestedAction> suggestedActions;
    private final Instant createdAt;

    private Anomaly(Builder b) {
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        if (b.contributingMethods.isEmpty()) {
            throw new IllegalArgumentException("An anomaly needs at least one contributing method");
        }
        this.value = b.value;
        this.ensembleScore = b.ensembleScore;
        this.contributingMethods = Collections.unmodifiableSet(EnumSet.copyOf(b.contributingMethods));
        this.contributingFeatures = Collections.unmodifiableMap(new LinkedHashMap<>(b.contributingFeatures));
        this.explanation = b.explanation;
        this.suggestedActions = List.copyOf(b.suggestedActions);
        this.id = computeId(metricName, timestamp, contributingMethods);
    }

    /**
     * Stable anomaly id: the first 16 hex characters of
     * SHA-256({@code metric|epochMillis|sorted detector ids}).
     *
     * @param metricName metric name
     * @param timestamp  anomaly timestamp
     * @param methods    contributing detectors
     * @return lowercase hex id
     */
    public static String computeId(String metricName, Instant timestamp, Collection<DetectorKind> methods) {
        String methodIds = methods.stream()
                .map(DetectorKind::getId)
                .sorted()
                .collect(Collectors.joining(","));
        String key = metricName + "|" + timestamp.toEpochMilli() + "|" + methodIds;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this anomaly's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .timestamp(timestamp)
                .metricName(metricName)
                .value(value)
                .ensembleScore(ensembleScore)
                .severity(severity)
                .contributingMethods(contributingMethods)
                .contributingFeatures(contributingFeatures)
                .explanation(explanation)
                .suggestedActions(suggestedActions)
                .createdAt(createdAt);
    }

    public static class Builder {
        private Instant timestamp;
        private String metricName;
        private double value;
        private double ensembleScore;
        private Severity severity;
        private Set<DetectorKind> contributingMethods = Set.of();
        private Map<String, Double> contributingFeatures = Map.of();
        private Explanation explanation;
        private List<SuggestedAction> suggestedActions = List.of();
        private Instant createdAt;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder ensembleScore(double ensembleScore) {
            this.ensembleScore = ensembleScore;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder contributingMethods(Set<DetectorKind> contributingMethods) {
            this.contributingMethods = contributingMethods != null ? contributingMethods : Set.of();
            return this;
        }

        public Builder contributingFeatures(Map<String, Double> contributingFeatures) {
            this.contributingFeatures = contributingFeatures != null ? contributingFeatures : Map.of();
            return this;
        }

        public Builder explanation(Explanation explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder suggestedActions(List<SuggestedAction> suggestedActions) {
            this.suggestedActions = suggestedActions != null ? suggestedActions : List.of();
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if no contributing method is set
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getValue() {
        return value;
    }

    public double getEnsembleScore() {
        return ensembleScore;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Set<DetectorKind> getContributingMethods() {
        return contributingMethods;
    }

    /** Feature weights from the multivariate detector, strongest first; may be empty. */
    public Map<String, Double> getContributingFeatures() {
        return contributingFeatures;
    }

    /** May be {@code null} until the explanation step has run. */
    public Explanation getExplanation() {
        return explanation;
    }

    public List<SuggestedAction> getSuggestedActions() {
        return suggestedActions;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return id.equals(that.id)
                && Double.compare(value, that.value) == 0
                && Double.compare(ensembleScore, that.ensembleScore) == 0
                && severity == that.severity
                && timestamp.equals(that.timestamp)
                && metricName.equals(that.metricName)
                && contributingMethods.equals(that.contributingMethods)
                && contributingFeatures.equals(that.contributingFeatures)
                && Objects.equals(explanation, that.explanation)
                && suggestedActions.equals(that.suggestedActions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value, ensembleScore, severity);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", metric='" + metricName + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", score=" + ensembleScore +
                ", severity=" + severity +
                ", methods=" + contributingMethods +
                '}';
    }
}
