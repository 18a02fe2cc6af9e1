package com.healthsentinel.core.feedback;

import com.healthsentinel.core.model.DetectorKind;
import com.healthsentinel.core.model.FeedbackRecord;

import java.util.List;

/**
 * Append-only store of {@link FeedbackRecord}s.
 *
 * <p>
 * Implementations must be thread-safe. Records are returned in append order.
 * </p>
 *
 * @since 1.0.0
 */
public interface FeedbackLog {

    /**
     * @param record record to append
     * @throws IllegalStateException if the record cannot be persisted
     */
    void append(FeedbackRecord record);

    /**
     * @return every record, oldest first
     */
    List<FeedbackRecord> records();

    /**
     * @return the records of one (metric, detector) key, oldest first
     */
    default List<FeedbackRecord> records(String metricName, DetectorKind kind) {
        return records().stream()
                .filter(r -> r.getMetricName().equals(metricName) && r.getDetectorKind() == kind)
                .toList();
    }

    /**
     * Remove every record.
     */
    void clear();
}
