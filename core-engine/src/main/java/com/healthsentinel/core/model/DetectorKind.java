package com.healthsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Closed set of detector kinds known to the engine.
 *
 * <p>
 * The {@link #getId() id} is the external {@code detector_id} used in
 * configuration files, feedback submissions and serialised anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    Z_SCORE("zscore", false),
    MODIFIED_Z_SCORE("modified_zscore", false),
    IQR("iqr", false),
    ISOLATION_FOREST("isolation_forest", false),
    LOCAL_OUTLIER_FACTOR("lof", false),
    TEMPORAL("temporal", true);

    private final String id;
    private final boolean degradable;

    DetectorKind(String id, boolean degradable) {
        this.id = id;
        this.degradable = degradable;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * @return {@code true} for optional capabilities that may be skipped
     *         without affecting the rest of the ensemble
     */
    public boolean isDegradable() {
        return degradable;
    }

    /**
     * Resolve a detector kind from its id or enum name, case-insensitively.
     *
     * @param value detector id such as {@code "zscore"} or {@code "Z_SCORE"}
     * @return the matching kind
     * @throws NullPointerException     if {@code value} is {@code null}
     * @throws IllegalArgumentException if no kind matches
     */
    @JsonCreator
    public static DetectorKind fromId(String value) {
        Objects.requireNonNull(value, "Detector id must not be null");
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (DetectorKind kind : values()) {
            if (kind.id.equals(normalised) || kind.name().toLowerCase(Locale.ROOT).equals(normalised)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown detector id: '" + value
                + "'. Supported: zscore, modified_zscore, iqr, isolation_forest, lof, temporal");
    }
}
