package com.healthsentinel.core.explain;

import com.healthsentinel.core.model.Anomaly;
import com.healthsentinel.core.model.Severity;
import com.healthsentinel.core.model.SuggestedAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Chooses the follow-up actions a notification can offer for an anomaly.
 *
 * <p>
 * Marking as normal and viewing details are always offered; metric-specific
 * and severity-specific actions follow.
 * </p>
 *
 * @since 1.0.0
 */
public class SuggestedActionAdvisor {

    /** Heart rate above which recent activity is worth checking, in bpm. */
    static final double ELEVATED_HEART_RATE = 100.0;

    public List<SuggestedAction> suggest(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "Anomaly must not be null");
        List<SuggestedAction> actions = new ArrayList<>();
        actions.add(SuggestedAction.MARK_NORMAL);
        actions.add(SuggestedAction.VIEW_DETAILS);

        String metric = anomaly.getMetricName().toLowerCase(Locale.ROOT);
        if (metric.contains("heart_rate")) {
            if (anomaly.getValue() > ELEVATED_HEART_RATE) {
                actions.add(SuggestedAction.CHECK_RECENT_ACTIVITY);
            }
        } else if (metric.contains("sleep")) {
            actions.add(SuggestedAction.ADD_SLEEP_NOTE);
        } else if (metric.contains("steps")) {
            actions.add(SuggestedAction.CHECK_LOCATION_DATA);
        }

        if (anomaly.getSeverity().isAtLeast(Severity.HIGH)) {
            actions.add(SuggestedAction.REMIND_LATER);
        }
        return List.copyOf(actions);
    }
}
