package com.healthsentinel.core.feedback;

import com.healthsentinel.core.model.FeedbackRecord;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Feedback log that lives as long as the engine.
 *
 * @since 1.0.0
 */
public class InMemoryFeedbackLog implements FeedbackLog {

    private final List<FeedbackRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(FeedbackRecord record) {
        records.add(Objects.requireNonNull(record, "FeedbackRecord must not be null"));
    }

    @Override
    public List<FeedbackRecord> records() {
        return List.copyOf(records);
    }

    @Override
    public void clear() {
        records.clear();
    }
}
