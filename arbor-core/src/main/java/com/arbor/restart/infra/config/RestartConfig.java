/*
 * Copyright (c) 2025 Arbor
 * Licensed under the Apache License, Version 2.0
 */
package com.arbor.restart.infra.config;

import com.arbor.restart.api.model.EstimationMethod;
import com.arbor.restart.api.model.ForecastMethod;
import com.arbor.restart.api.model.ProgressMeasure;
import com.arbor.restart.api.model.RestartPolicy;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration of the restart controller.
 *
 * <p>Values are resolved in increasing precedence:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>a properties file ({@code restart.properties} by default)</li>
 *   <li>environment variables</li>
 *   <li>explicit builder calls</li>
 * </ol>
 *
 * <p><b>Property keys</b> use the option names of the engine's parameter tree, e.g.
 * <pre>
 * restarts/restartpolicy=e
 * restarts/estimation/factor=2.5
 * restarts/hitcounterlim=10
 * restarts/regforestfilename=/opt/models/completion.rf
 * </pre>
 *
 * <p><b>Environment variables</b> are the upper-cased keys with {@code /} replaced by
 * {@code _}: {@code RESTARTS_RESTARTPOLICY}, {@code RESTARTS_ESTIMATION_FACTOR}, ...
 *
 * <p>Invalid values are rejected with an {@link IllegalArgumentException}; no partially
 * validated configuration is ever returned.
 *
 * <pre>{@code
 * RestartConfig config = RestartConfig.builder()
 *     .restartPolicy(RestartPolicy.ESTIMATION)
 *     .estimationFactor(2.0)
 *     .hitCounterLimit(1)
 *     .build();
 * }</pre>
 */
public final class RestartConfig {

    private static final Logger logger = Logger.getLogger(RestartConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "restart.properties";

    /** Forest file name meaning "no forest". */
    public static final String NO_FOREST = "-";

    /** Largest supported rolling window of the window forecaster. */
    public static final int MAX_WINDOW_SIZE = 500;

    // ========================================================================
    // OPTION KEYS
    // ========================================================================

    static final String KEY_RESTART_POLICY = "restarts/restartpolicy";
    static final String KEY_ESTIMATION_METHOD = "restarts/estimationmethod";
    static final String KEY_PROGRESS_MEASURE = "restarts/progressmeasure";
    static final String KEY_FORECAST = "restarts/forecast";
    static final String KEY_WINDOW_SIZE = "restarts/windowsize";
    static final String KEY_USE_ACCELERATION = "restarts/useacceleration";
    static final String KEY_RESTART_LIMIT = "restarts/restartlimit";
    static final String KEY_MIN_NODES = "restarts/minnodes";
    static final String KEY_COUNT_ONLY_LEAVES = "restarts/countonlyleaves";
    static final String KEY_ESTIMATION_FACTOR = "restarts/estimation/factor";
    static final String KEY_HIT_COUNTER_LIMIT = "restarts/hitcounterlim";
    static final String KEY_PRINT_REPORTS = "restarts/printreports";
    static final String KEY_REGFOREST_FILENAME = "restarts/regforestfilename";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final RestartPolicy restartPolicy;
    private final EstimationMethod estimationMethod;
    private final ProgressMeasure progressMeasure;
    private final ForecastMethod forecastMethod;
    private final int windowSize;
    private final boolean useAcceleration;
    private final int restartLimit;
    private final long minNodes;
    private final boolean countOnlyLeaves;
    private final double estimationFactor;
    private final int hitCounterLimit;
    private final boolean printReports;
    private final String regForestFilename;

    private RestartConfig(Builder builder) {
        this.restartPolicy = builder.restartPolicy;
        this.estimationMethod = builder.estimationMethod;
        this.progressMeasure = builder.progressMeasure;
        this.forecastMethod = builder.forecastMethod;
        this.windowSize = builder.windowSize;
        this.useAcceleration = builder.useAcceleration;
        this.restartLimit = builder.restartLimit;
        this.minNodes = builder.minNodes;
        this.countOnlyLeaves = builder.countOnlyLeaves;
        this.estimationFactor = builder.estimationFactor;
        this.hitCounterLimit = builder.hitCounterLimit;
        this.printReports = builder.printReports;
        this.regForestFilename = builder.regForestFilename;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults overridden by environment variables.
     */
    public static RestartConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} from the classpath or the working directory.
     * Falls back to defaults if the file does not exist.
     */
    public static RestartConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads configuration from a properties file, searching the classpath first and the
     * file system second. Environment variables override file values.
     *
     * @param propertiesPath classpath resource or file path
     * @return validated configuration
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static RestartConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = RestartConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.fine("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.fine("No restart properties at " + propertiesPath + ", using defaults");
            }
        }

        return fromProperties(props, System::getenv);
    }

    static RestartConfig fromProperties(Properties props, Function<String, String> environment) {
        Builder builder = new Builder();
        builder.apply(props::getProperty);
        builder.apply(key -> environment.apply(toEnvironmentKey(key)));
        return builder.build();
    }

    static String toEnvironmentKey(String key) {
        return key.replace('/', '_').toUpperCase();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Builder seeded with defaults and environment overrides.
     */
    public static Builder builder() {
        Builder builder = new Builder();
        builder.apply(key -> System.getenv(toEnvironmentKey(key)));
        return builder;
    }

    /**
     * Builder seeded with this configuration's values; the environment is not re-read.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.restartPolicy = this.restartPolicy;
        builder.estimationMethod = this.estimationMethod;
        builder.progressMeasure = this.progressMeasure;
        builder.forecastMethod = this.forecastMethod;
        builder.windowSize = this.windowSize;
        builder.useAcceleration = this.useAcceleration;
        builder.restartLimit = this.restartLimit;
        builder.minNodes = this.minNodes;
        builder.countOnlyLeaves = this.countOnlyLeaves;
        builder.estimationFactor = this.estimationFactor;
        builder.hitCounterLimit = this.hitCounterLimit;
        builder.printReports = this.printReports;
        builder.regForestFilename = this.regForestFilename;
        return builder;
    }

    public static final class Builder {
        private RestartPolicy restartPolicy = RestartPolicy.NEVER;
        private EstimationMethod estimationMethod = EstimationMethod.TREE_SIZE;
        private ProgressMeasure progressMeasure = ProgressMeasure.UNIFORM;
        private ForecastMethod forecastMethod = ForecastMethod.LINEAR;
        private int windowSize = 100;
        private boolean useAcceleration = false;
        private int restartLimit = 1;
        private long minNodes = 1000L;
        private boolean countOnlyLeaves = false;
        private double estimationFactor = 2.0;
        private int hitCounterLimit = 50;
        private boolean printReports = false;
        private String regForestFilename = NO_FOREST;

        private Builder() {
        }

        /**
         * Overrides every option the source knows about.
         */
        private void apply(Function<String, String> source) {
            lookup(source, KEY_RESTART_POLICY).ifPresent(v -> restartPolicy = RestartPolicy.fromCode(code(KEY_RESTART_POLICY, v)));
            lookup(source, KEY_ESTIMATION_METHOD).ifPresent(v -> estimationMethod = EstimationMethod.fromCode(code(KEY_ESTIMATION_METHOD, v)));
            lookup(source, KEY_PROGRESS_MEASURE).ifPresent(v -> progressMeasure = ProgressMeasure.fromCode(code(KEY_PROGRESS_MEASURE, v)));
            lookup(source, KEY_FORECAST).ifPresent(v -> forecastMethod = ForecastMethod.fromCode(code(KEY_FORECAST, v)));
            lookup(source, KEY_WINDOW_SIZE).ifPresent(v -> windowSize = parseInt(KEY_WINDOW_SIZE, v));
            lookup(source, KEY_USE_ACCELERATION).ifPresent(v -> useAcceleration = parseBoolean(KEY_USE_ACCELERATION, v));
            lookup(source, KEY_RESTART_LIMIT).ifPresent(v -> restartLimit = parseInt(KEY_RESTART_LIMIT, v));
            lookup(source, KEY_MIN_NODES).ifPresent(v -> minNodes = parseLong(KEY_MIN_NODES, v));
            lookup(source, KEY_COUNT_ONLY_LEAVES).ifPresent(v -> countOnlyLeaves = parseBoolean(KEY_COUNT_ONLY_LEAVES, v));
            lookup(source, KEY_ESTIMATION_FACTOR).ifPresent(v -> estimationFactor = parseDouble(KEY_ESTIMATION_FACTOR, v));
            lookup(source, KEY_HIT_COUNTER_LIMIT).ifPresent(v -> hitCounterLimit = parseInt(KEY_HIT_COUNTER_LIMIT, v));
            lookup(source, KEY_PRINT_REPORTS).ifPresent(v -> printReports = parseBoolean(KEY_PRINT_REPORTS, v));
            lookup(source, KEY_REGFOREST_FILENAME).ifPresent(v -> regForestFilename = v);
        }

        public Builder restartPolicy(RestartPolicy policy) {
            this.restartPolicy = policy;
            return this;
        }

        public Builder estimationMethod(EstimationMethod method) {
            this.estimationMethod = method;
            return this;
        }

        public Builder progressMeasure(ProgressMeasure measure) {
            this.progressMeasure = measure;
            return this;
        }

        public Builder forecastMethod(ForecastMethod method) {
            this.forecastMethod = method;
            return this;
        }

        public Builder windowSize(int size) {
            this.windowSize = size;
            return this;
        }

        public Builder useAcceleration(boolean enable) {
            this.useAcceleration = enable;
            return this;
        }

        /**
         * @param limit maximum number of restarts, {@code -1} for unlimited
         */
        public Builder restartLimit(int limit) {
            this.restartLimit = limit;
            return this;
        }

        /**
         * @param nodes minimum node count before a restart may happen, {@code -1} for none
         */
        public Builder minNodes(long nodes) {
            this.minNodes = nodes;
            return this;
        }

        public Builder countOnlyLeaves(boolean enable) {
            this.countOnlyLeaves = enable;
            return this;
        }

        public Builder estimationFactor(double factor) {
            this.estimationFactor = factor;
            return this;
        }

        public Builder hitCounterLimit(int limit) {
            this.hitCounterLimit = limit;
            return this;
        }

        public Builder printReports(boolean enable) {
            this.printReports = enable;
            return this;
        }

        public Builder regForestFilename(String filename) {
            this.regForestFilename = filename;
            return this;
        }

        public RestartConfig build() {
            return new RestartConfig(this);
        }

        // ====================================================================
        // PARSING HELPERS
        // ====================================================================

        private static Optional<String> lookup(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(value.trim());
        }

        private static char code(String key, String value) {
            if (value.length() != 1) {
                throw new IllegalArgumentException(key + " must be a single character: " + value);
            }
            return value.charAt(0);
        }

        private static int parseInt(String key, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid int value for " + key + ": " + value, e);
            }
        }

        private static long parseLong(String key, String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid long value for " + key + ": " + value, e);
            }
        }

        private static double parseDouble(String key, String value) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid real value for " + key + ": " + value, e);
            }
        }

        private static boolean parseBoolean(String key, String value) {
            String normalized = value.toLowerCase();
            switch (normalized) {
                case "true", "1", "yes":
                    return true;
                case "false", "0", "no":
                    return false;
                default:
                    throw new IllegalArgumentException("Invalid bool value for " + key + ": " + value);
            }
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (restartPolicy == null || estimationMethod == null || progressMeasure == null || forecastMethod == null) {
            throw new IllegalArgumentException("restart policy and methods must not be null");
        }
        if (windowSize < 2 || windowSize > MAX_WINDOW_SIZE) {
            throw new IllegalArgumentException(
                    "windowSize must be between 2 and " + MAX_WINDOW_SIZE + ": " + windowSize);
        }
        if (restartLimit < -1) {
            throw new IllegalArgumentException("restartLimit must be -1 or nonnegative: " + restartLimit);
        }
        if (minNodes < -1) {
            throw new IllegalArgumentException("minNodes must be -1 or nonnegative: " + minNodes);
        }
        if (!(estimationFactor >= 1.0)) {
            throw new IllegalArgumentException("estimationFactor must be at least 1: " + estimationFactor);
        }
        if (hitCounterLimit < 1) {
            throw new IllegalArgumentException("hitCounterLimit must be positive: " + hitCounterLimit);
        }
        if (regForestFilename == null || regForestFilename.isEmpty()) {
            throw new IllegalArgumentException("regForestFilename must not be empty, use \"-\" for none");
        }
        logger.fine("Restart configuration validated: " + this);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public RestartPolicy getRestartPolicy() { return restartPolicy; }
    public EstimationMethod getEstimationMethod() { return estimationMethod; }
    public ProgressMeasure getProgressMeasure() { return progressMeasure; }
    public ForecastMethod getForecastMethod() { return forecastMethod; }
    public int getWindowSize() { return windowSize; }
    public boolean isUseAcceleration() { return useAcceleration; }
    public int getRestartLimit() { return restartLimit; }
    public long getMinNodes() { return minNodes; }
    public boolean isCountOnlyLeaves() { return countOnlyLeaves; }
    public double getEstimationFactor() { return estimationFactor; }
    public int getHitCounterLimit() { return hitCounterLimit; }
    public boolean isPrintReports() { return printReports; }
    public String getRegForestFilename() { return regForestFilename; }

    public boolean hasRegForest() {
        return !NO_FOREST.equals(regForestFilename);
    }

    @Override
    public String toString() {
        return "RestartConfig{" +
                "policy=" + restartPolicy +
                ", estimation=" + estimationMethod +
                ", progress=" + progressMeasure +
                ", forecast=" + forecastMethod +
                ", windowSize=" + windowSize +
                ", useAcceleration=" + useAcceleration +
                ", restartLimit=" + restartLimit +
                ", minNodes=" + minNodes +
                ", countOnlyLeaves=" + countOnlyLeaves +
                ", estimationFactor=" + estimationFactor +
                ", hitCounterLimit=" + hitCounterLimit +
                ", printReports=" + printReports +
                ", regForest='" + regForestFilename + '\'' +
                '}';
    }
}
