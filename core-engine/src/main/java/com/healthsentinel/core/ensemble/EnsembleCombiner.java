package com.healthsentinel.core.ensemble;

import com.healthsentinel.core.config.EnsembleSettings;
import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.DetectorResult;
import com.healthsentinel.core.model.PersonalThreshold;
import com.healthsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the detector results of one (metric, timestamp) into at most one
 * {@link Anomaly}.
 *
 * <h3>Decision</h3>
 * <ol>
 * <li>Every firing result is scaled by {@code 1 / multiplier} of its
 * {@link PersonalThreshold} (1.0 when the key has no threshold yet).</li>
 * <li>Results whose scaled score still exceeds the decision threshold are the
 * contributors. Without contributors there is no anomaly.</li>
 * <li>If any contributor exceeds the decisive score, the ensemble score is the
 * maximum; otherwise it is the weighted mean over the contributors.</li>
 * </ol>
 *
 * <p>
 * Every contributor is above the decision threshold, so the mean is too, and
 * adding a detector can never remove an anomaly the others already report.
 * Contributors become the contributing methods. The returned anomaly has no
 * explanation yet. Stateless apart from the clock; thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class EnsembleCombiner {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleCombiner.class);

    private final EnsembleSettings settings;
    private final Clock clock;

    public EnsembleCombiner(EnsembleSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "EnsembleSettings must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Combine results for a single point.
     *
     * @param results    every result produced for the point; may be empty
     * @param thresholds threshold snapshot of the point's metric, by detector
     * @return the anomaly, or empty when no scaled score exceeds the decision
     *         threshold
     * @throws IllegalArgumentException if the results refer to different
     *                                  points
     */
    public Optional<Anomaly> combine(Collection<DetectorResult> results,
            Map<DetectorKind, PersonalThreshold> thresholds) {
        Objects.requireNonNull(results, "Results must not be null");
        Objects.requireNonNull(thresholds, "Thresholds must not be null");

        List<DetectorResult> fired = results.stream().filter(DetectorResult::isFired).toList();
        if (fired.isEmpty()) {
            return Optional.empty();
        }
        DetectorResult first = fired.get(0);
        for (DetectorResult r : fired) {
            if (!r.getMetricName().equals(first.getMetricName()) || !r.getTimestamp().equals(first.getTimestamp())) {
                throw new IllegalArgumentException("Cannot combine results of different points: "
                        + first.getMetricName() + "@" + first.getTimestamp() + " and "
                        + r.getMetricName() + "@" + r.getTimestamp());
            }
        }

        double max = 0.0;
        double weightedSum = 0.0;
        double weightTotal = 0.0;
        Set<DetectorKind> methods = EnumSet.noneOf(DetectorKind.class);
        Map<String, Double> features = Map.of();
        for (DetectorResult r : fired) {
            PersonalThreshold threshold = thresholds.get(r.getDetectorKind());
            double multiplier = threshold != null ? threshold.getMultiplier() : PersonalThreshold.DEFAULT_MULTIPLIER;
            double scaled = r.getNormalizedScore() / multiplier;
            if (scaled <= settings.getDecisionThreshold()) {
                LOG.trace("{} suppressed for {}@{}: scaled={} multiplier={}", r.getDetectorKind().getId(),
                        r.getMetricName(), r.getTimestamp(), scaled, multiplier);
                continue;
            }
            double weight = settings.weightFor(r.getDetectorKind());

            max = Math.max(max, scaled);
            weightedSum += weight * scaled;
            weightTotal += weight;
            methods.add(r.getDetectorKind());
            if (r.getDetectorKind() == DetectorKind.ISOLATION_FOREST) {
                features = r.getContributingFeatures();
            }
        }

        if (methods.isEmpty()) {
            LOG.debug("Ensemble suppressed {}@{}: no detector above {} after personal thresholds",
                    first.getMetricName(), first.getTimestamp(), settings.getDecisionThreshold());
            return Optional.empty();
        }
        double score = Math.min(1.0, max > settings.getDecisiveScore() ? max : weightedSum / weightTotal);

        Instant now = clock.instant();
        Anomaly anomaly = Anomaly.builder()
                .metricName(first.getMetricName())
                .timestamp(first.getTimestamp())
                .value(first.getValue())
                .ensembleScore(score)
                .severity(Severity.fromEnsembleScore(score))
                .contributingMethods(methods)
                .contributingFeatures(features)
                .createdAt(now)
                .build();
        LOG.debug("Ensemble fired: {}", anomaly);
        return Optional.of(anomaly);
    }
}
