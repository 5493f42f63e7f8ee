package io.github.calltable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Builds a {@link PipelineConfig} from layered sources.
 *
 * <p>Later layers win: built-in defaults, then the classpath properties file
 * {@value #DEFAULT_CONFIG_FILE} when present, then environment variables.
 * Command line options are applied on top by {@link CallTableApp}.</p>
 */
public final class PipelineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "calltable.properties";

    // Property keys
    static final String OUTPUT_DIR = "calltable.output.dir";
    static final String OUTPUT_FILENAME = "calltable.output.filename";
    static final String LOG_LEVEL = "calltable.log.level";

    // Environment variables
    static final String ENV_OUTPUT_DIR = "CALLTABLE_OUTPUT_DIR";
    static final String ENV_OUTPUT_FILENAME = "CALLTABLE_OUTPUT_FILENAME";
    static final String ENV_LOG_LEVEL = "CALLTABLE_LOG_LEVEL";

    private PipelineConfigLoader() {
    }

    /**
     * Loads defaults, the default properties file and the process environment.
     */
    public static PipelineConfig.Builder load() {
        return load(DEFAULT_CONFIG_FILE, System.getenv());
    }

    /**
     * Loads defaults, the named classpath properties file (if it exists) and {@code env}.
     */
    public static PipelineConfig.Builder load(String propertiesResource, Map<String, String> env) {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        applyProperties(builder, loadProperties(propertiesResource));
        applyEnvironment(builder, env);
        return builder;
    }

    static Properties loadProperties(String resource) {
        Properties props = new Properties();
        try (InputStream is = PipelineConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                LOG.debug("No {} on the classpath, using defaults", resource);
                return props;
            }
            props.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load properties file: " + resource, e);
        }
        return props;
    }

    static void applyProperties(PipelineConfig.Builder builder, Properties props) {
        String outputDir = props.getProperty(OUTPUT_DIR);
        if (isSet(outputDir)) {
            builder.outputDir(Paths.get(outputDir.trim()));
        }
        String outputFilename = props.getProperty(OUTPUT_FILENAME);
        if (isSet(outputFilename)) {
            builder.outputFilename(outputFilename.trim());
        }
        String logLevel = props.getProperty(LOG_LEVEL);
        if (isSet(logLevel)) {
            builder.logLevel(PipelineConfig.LogLevel.parse(logLevel));
        }
    }

    static void applyEnvironment(PipelineConfig.Builder builder, Map<String, String> env) {
        String outputDir = env.get(ENV_OUTPUT_DIR);
        if (isSet(outputDir)) {
            builder.outputDir(Paths.get(outputDir.trim()));
        }
        String outputFilename = env.get(ENV_OUTPUT_FILENAME);
        if (isSet(outputFilename)) {
            builder.outputFilename(outputFilename.trim());
        }
        String logLevel = env.get(ENV_LOG_LEVEL);
        if (isSet(logLevel)) {
            builder.logLevel(PipelineConfig.LogLevel.parse(logLevel));
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
