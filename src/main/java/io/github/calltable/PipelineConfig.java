package io.github.calltable;

import com.google.common.base.Preconditions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Settings for one pipeline run.
 *
 * <p>This class uses the builder pattern for configuration and is immutable
 * once constructed.</p>
 */
public final class PipelineConfig {

    public static final Path DEFAULT_OUTPUT_DIR = Paths.get("/output/tableStructureed");
    public static final String DEFAULT_OUTPUT_FILENAME = "calls.csv";
    public static final LogLevel DEFAULT_LOG_LEVEL = LogLevel.INFO;

    private final Path inputDir;
    private final Path outputDir;
    private final String outputFilename;
    private final LogLevel logLevel;

    private PipelineConfig(Builder builder) {
        this.inputDir = builder.inputDir;
        this.outputDir = builder.outputDir;
        this.outputFilename = builder.outputFilename;
        this.logLevel = builder.logLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getOutputFilename() {
        return outputFilename;
    }

    public LogLevel getLogLevel() {
        return logLevel;
    }

    /**
     * Returns a builder pre-filled with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .inputDir(inputDir)
                .outputDir(outputDir)
                .outputFilename(outputFilename)
                .logLevel(logLevel);
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "inputDir=" + inputDir +
                ", outputDir=" + outputDir +
                ", outputFilename='" + outputFilename + '\'' +
                ", logLevel=" + logLevel +
                '}';
    }

    /**
     * Verbosity names accepted on the command line and in configuration.
     */
    public enum LogLevel {
        DEBUG,
        INFO,
        WARNING,
        ERROR,
        CRITICAL;

        /**
         * Parses a level name, case-insensitively.
         *
         * @throws IllegalArgumentException for unknown names
         */
        public static LogLevel parse(String name) {
            Preconditions.checkArgument(name != null, "Log level cannot be null");
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid log level '" + name
                        + "' (choose from DEBUG, INFO, WARNING, ERROR, CRITICAL)", e);
            }
        }
    }

    public static final class Builder {
        private Path inputDir;
        private Path outputDir = DEFAULT_OUTPUT_DIR;
        private String outputFilename = DEFAULT_OUTPUT_FILENAME;
        private LogLevel logLevel = DEFAULT_LOG_LEVEL;

        private Builder() {
        }

        public Builder inputDir(Path inputDir) {
            this.inputDir = inputDir;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = Preconditions.checkNotNull(outputDir, "outputDir");
            return this;
        }

        public Builder outputFilename(String outputFilename) {
            Preconditions.checkArgument(outputFilename != null && !outputFilename.isBlank(),
                    "Output filename cannot be null or empty");
            this.outputFilename = outputFilename;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = Preconditions.checkNotNull(logLevel, "logLevel");
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
