package com.healthsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * detectors:
 *   historyWindow: 90
 *   zscoreThreshold: 3.0
 * ensemble:
 *   weights: { zscore: 1.0, temporal: 0.5 }
 * realtime:
 *   latencyBudgetMs: 100
 * batch:
 *   chunkSize: 64
 * feedback:
 *   logPath: /var/lib/health-sentinel/feedback.jsonl
 * </pre>
 *
 * <p>
 * Every section is optional and falls back to its defaults; an empty document
 * is the default configuration. Duplicate keys are rejected. The static
 * {@code from*} factories return validated instances; a configuration built
 * in code is validated by the engine.
 * </p>
 *
 * <p>
 * {@link #resolve()} reads the file named by {@value #ENV_CONFIG_PATH} when
 * that variable is set, and the bundled {@value #DEFAULT_RESOURCE} otherwise.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfig.class);

    /** Names a YAML file that replaces the bundled configuration. */
    public static final String ENV_CONFIG_PATH = "HEALTH_SENTINEL_CONFIG";

    public static final String DEFAULT_RESOURCE = "health-sentinel.yml";

    private DetectorSettings detectors = new DetectorSettings();
    private EnsembleSettings ensemble = new EnsembleSettings();
    private RealtimeSettings realtime = new RealtimeSettings();
    private BatchSettings batch = new BatchSettings();
    private FeedbackSettings feedback = new FeedbackSettings();

    /**
     * @return a configuration holding only defaults
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * @return the configuration named by the environment, or the bundled one
     * @throws IllegalArgumentException if {@value #ENV_CONFIG_PATH} names a
     *                                  missing file
     * @throws IllegalStateException    if the document is malformed or invalid
     */
    public static EngineConfig resolve() {
        return resolve(System::getenv);
    }

    static EngineConfig resolve(Function<String, String> environment) {
        String path = environment.apply(ENV_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            return fromResource(DEFAULT_RESOURCE);
        }
        return fromPath(Path.of(path));
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails, or the document is
     *                                  malformed or invalid
     */
    public static EngineConfig fromPath(Path path) {
        Objects.requireNonNull(path, "Config path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if the document is malformed or invalid
     */
    public static EngineConfig fromResource(String resource) {
        Objects.requireNonNull(resource, "Config resource must not be null");
        InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Config resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return parse(reader, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config resource: " + resource, e);
        }
    }

    static EngineConfig parse(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        EngineConfig config;
        try {
            config = new Yaml(new Constructor(EngineConfig.class, options)).load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed engine configuration in " + source + ": " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("{} is empty, using the default configuration", source);
            config = defaults();
        }
        config.validate();
        LOG.info("Engine configuration from {}: {}", source, config);
        return config;
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception if any value is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        detectors.validate(errors);
        ensemble.validate(errors);
        realtime.validate(errors);
        batch.validate(errors);
        feedback.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    public DetectorSettings getDetectors() {
        return detectors;
    }

    public void setDetectors(DetectorSettings detectors) {
        this.detectors = detectors != null ? detectors : new DetectorSettings();
    }

    public EnsembleSettings getEnsemble() {
        return ensemble;
    }

    public void setEnsemble(EnsembleSettings ensemble) {
        this.ensemble = ensemble != null ? ensemble : new EnsembleSettings();
    }

    public RealtimeSettings getRealtime() {
        return realtime;
    }

    public void setRealtime(RealtimeSettings realtime) {
        this.realtime = realtime != null ? realtime : new RealtimeSettings();
    }

    public BatchSettings getBatch() {
        return batch;
    }

    public void setBatch(BatchSettings batch) {
        this.batch = batch != null ? batch : new BatchSettings();
    }

    public FeedbackSettings getFeedback() {
        return feedback;
    }

    public void setFeedback(FeedbackSettings feedback) {
        this.feedback = feedback != null ? feedback : new FeedbackSettings();
    }

    @Override
    public String toString() {
        return "EngineConfig{" + detectors + ", " + ensemble + ", " + realtime + ", " + batch + ", " + feedback + '}';
    }
}
