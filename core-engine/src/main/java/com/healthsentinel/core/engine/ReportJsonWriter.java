package com.healthsentinel.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.healthsentinel.core.model.Anomaly;

import java.util.Objects;

/**
 * Renders reports and anomalies as JSON with ISO-8601 timestamps.
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportJsonWriter {

    private final ObjectMapper mapper;

    public ReportJsonWriter() {
        this(false);
    }

    /**
     * @param pretty indent the output
     */
    public ReportJsonWriter(boolean pretty) {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.configure(SerializationFeature.INDENT_OUTPUT, pretty);
    }

    /**
     * @throws IllegalStateException if the report cannot be serialised
     */
    public String write(DetectionReport report) {
        Objects.requireNonNull(report, "DetectionReport must not be null");
        return serialize(report, "report");
    }

    /**
     * @throws IllegalStateException if the anomaly cannot be serialised
     */
    public String write(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "Anomaly must not be null");
        return serialize(anomaly, "anomaly " + anomaly.getId());
    }

    private String serialize(Object value, String what) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise " + what, e);
        }
    }
}
