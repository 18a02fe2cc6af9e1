package com.healthsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Human-readable reasons attached to an {@link Anomaly}.
 *
 * <p>
 * Each part is one sentence; parts that do not apply are {@code null}
 * (recurrence, method) or empty (top features). {@link #summary()} joins the
 * present parts in a fixed order.
 * </p>
 *
 * @since 1.0.0
 */
public final class Explanation {

    private final String statisticalStatement;
    private final String recurrenceStatement;
    private final List<String> topFeatures;
    private final String methodStatement;
    private final String severityStatement;

    private Explanation(Builder b) {
        this.statisticalStatement = Objects.requireNonNull(b.statisticalStatement,
                "statisticalStatement must not be null");
        this.recurrenceStatement = b.recurrenceStatement;
        this.topFeatures = Collections.unmodifiableList(new ArrayList<>(b.topFeatures));
        this.methodStatement = b.methodStatement;
        this.severityStatement = b.severityStatement;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String statisticalStatement;
        private String recurrenceStatement;
        private List<String> topFeatures = List.of();
        private String methodStatement;
        private String severityStatement;

        public Builder statisticalStatement(String statisticalStatement) {
            this.statisticalStatement = statisticalStatement;
            return this;
        }

        public Builder recurrenceStatement(String recurrenceStatement) {
            this.recurrenceStatement = recurrenceStatement;
            return this;
        }

        public Builder topFeatures(List<String> topFeatures) {
            this.topFeatures = topFeatures != null ? topFeatures : List.of();
            return this;
        }

        public Builder methodStatement(String methodStatement) {
            this.methodStatement = methodStatement;
            return this;
        }

        public Builder severityStatement(String severityStatement) {
            this.severityStatement = severityStatement;
            return this;
        }

        public Explanation build() {
            return new Explanation(this);
        }
    }

    public String getStatisticalStatement() {
        return statisticalStatement;
    }

    public String getRecurrenceStatement() {
        return recurrenceStatement;
    }

    /** Up to three feature names, strongest first. */
    public List<String> getTopFeatures() {
        return topFeatures;
    }

    public String getMethodStatement() {
        return methodStatement;
    }

    public String getSeverityStatement() {
        return severityStatement;
    }

    /**
     * @return every present part, space separated
     */
    @JsonProperty("summary")
    public String summary() {
        StringBuilder sb = new StringBuilder(statisticalStatement);
        append(sb, recurrenceStatement);
        if (!topFeatures.isEmpty()) {
            append(sb, "Main contributors: " + String.join(", ", topFeatures) + ".");
        }
        append(sb, methodStatement);
        append(sb, severityStatement);
        return sb.toString();
    }

    private static void append(StringBuilder sb, String part) {
        if (part != null && !part.isBlank()) {
            sb.append(' ').append(part);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Explanation that))
            return false;
        return statisticalStatement.equals(that.statisticalStatement)
                && Objects.equals(recurrenceStatement, that.recurrenceStatement)
                && topFeatures.equals(that.topFeatures)
                && Objects.equals(methodStatement, that.methodStatement)
                && Objects.equals(severityStatement, that.severityStatement);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statisticalStatement, recurrenceStatement, topFeatures,
                methodStatement, severityStatement);
    }

    @Override
    public String toString() {
        return "Explanation{" + summary() + '}';
    }
}
