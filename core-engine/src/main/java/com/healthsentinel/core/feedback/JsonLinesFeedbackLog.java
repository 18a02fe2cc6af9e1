package com.healthsentinel.core.feedback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.healthsentinel.core.model.FeedbackRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Feedback log persisted as one JSON object per line.
 *
 * <p>
 * Existing records are read when the log is opened. Lines that cannot be
 * parsed are logged and skipped, never fatal. Appends are synchronised and
 * written through to disk before {@link #append} returns.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesFeedbackLog implements FeedbackLog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesFeedbackLog.class);

    private final ObjectMapper mapper;
    private final Path path;
    private final List<FeedbackRecord> records = new ArrayList<>();

    /**
     * Open (or create on first append) the log at {@code path}.
     *
     * @param path log file
     * @throws IllegalStateException if an existing file cannot be read
     */
    public JsonLinesFeedbackLog(Path path) {
        this.path = Objects.requireNonNull(path, "Feedback log path must not be null");
        this.mapper = createMapper();
        load();
    }

    @Override
    public synchronized void append(FeedbackRecord record) {
        Objects.requireNonNull(record, "FeedbackRecord must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                writeLine(mapper, writer, record);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to append feedback to " + path, e);
        }
        records.add(record);
    }

    @Override
    public synchronized List<FeedbackRecord> records() {
        return List.copyOf(records);
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to clear feedback log " + path, e);
        }
        records.clear();
    }

    public Path getPath() {
        return path;
    }

    /**
     * Mapper for the line format: ISO-8601 timestamps, unknown properties
     * ignored on read.
     */
    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    static void writeLine(ObjectMapper mapper, Writer writer, FeedbackRecord record) throws IOException {
        writer.write(mapper.writeValueAsString(record));
        writer.write('\n');
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void load() {
        if (!Files.exists(path)) {
            LOG.info("Feedback log {} does not exist yet, starting empty", path);
            return;
        }
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(mapper.readValue(line, FeedbackRecord.class));
                } catch (JsonProcessingException e) {
                    skipped++;
                    LOG.warn("Skipping malformed feedback record at {}:{}: {}", path, lineNumber, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read feedback log " + path, e);
        }
        LOG.info("Loaded {} feedback record(s) from {} ({} skipped)", records.size(), path, skipped);
    }
}
