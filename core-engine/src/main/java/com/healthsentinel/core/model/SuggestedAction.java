package com.healthsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Follow-up a notification layer can offer next to an anomaly.
 *
 * @since 1.0.0
 */
public enum SuggestedAction {

    MARK_NORMAL("This is normal for me"),
    VIEW_DETAILS("View details"),
    CHECK_RECENT_ACTIVITY("Check recent activity"),
    ADD_SLEEP_NOTE("Add sleep note"),
    CHECK_LOCATION_DATA("Check location data"),
    REMIND_LATER("Remind me later");

    private final String label;

    SuggestedAction(String label) {
        this.label = label;
    }

    /** Button text shown to the user. */
    public String getLabel() {
        return label;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
