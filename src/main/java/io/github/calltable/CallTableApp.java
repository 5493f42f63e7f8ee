package io.github.calltable;

import ch.qos.logback.classic.Level;
import io.github.calltable.files.InputDirectoryNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * Command line entry point.
 *
 * <pre>
 * CallTableApp &lt;input_dir&gt; [--output-dir DIR] [--output-filename NAME] [--log-level LEVEL]
 * </pre>
 *
 * <p>Prints the path of the written CSV on success. Exit codes: 0 on success, 1 when the
 * input directory is missing or the output cannot be written, 2 on a usage error.</p>
 */
public class CallTableApp {

    private static final Logger LOG = LoggerFactory.getLogger(CallTableApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: calltable [-h] [--output-filename OUTPUT_FILENAME] [--output-dir OUTPUT_DIR]",
            "                 [--log-level {DEBUG,INFO,WARNING,ERROR,CRITICAL}] input_dir",
            "",
            "Extract fields from JSON/JSONL call records to a single CSV.",
            "",
            "positional arguments:",
            "  input_dir             Directory containing .json/.jsonl files (recursively scanned)",
            "",
            "options:",
            "  -h, --help            show this help message and exit",
            "  --output-filename OUTPUT_FILENAME",
            "                        CSV filename to write inside the output directory (default: calls.csv)",
            "  --output-dir OUTPUT_DIR",
            "                        Output directory to write the CSV to, created if missing",
            "                        (default: /output/tableStructureed)",
            "  --log-level {DEBUG,INFO,WARNING,ERROR,CRITICAL}",
            "                        Logging level (default: INFO)");

    private final CallRecordPipeline pipeline;
    private final Supplier<PipelineConfig.Builder> baseConfig;
    private final PrintStream out;
    private final PrintStream err;

    public CallTableApp(CallRecordPipeline pipeline, Supplier<PipelineConfig.Builder> baseConfig,
                        PrintStream out, PrintStream err) {
        this.pipeline = pipeline;
        this.baseConfig = baseConfig;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        CallTableApp app = new CallTableApp(new CallRecordPipeline(), PipelineConfigLoader::load,
                System.out, System.err);
        System.exit(app.run(args));
    }

    /**
     * Parses {@code args}, runs the pipeline and returns the process exit code.
     */
    public int run(String[] args) {
        PipelineConfig config;
        try {
            config = parseArgs(args, baseConfig.get());
        } catch (HelpRequested e) {
            out.println(USAGE);
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println(USAGE);
            err.println("calltable: error: " + e.getMessage());
            return EXIT_USAGE;
        }

        applyLogLevel(config.getLogLevel());

        try {
            PipelineResult result = pipeline.run(config);
            out.println(result.outputPath());
            return EXIT_OK;
        } catch (InputDirectoryNotFoundException e) {
            LOG.error(e.getMessage());
            err.println("calltable: error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LOG.error("Run failed: {}", e.toString(), e);
            err.println("calltable: error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Applies command line options on top of {@code builder}.
     *
     * @throws IllegalArgumentException on unknown options, missing values or a missing input directory
     */
    static PipelineConfig parseArgs(String[] args, PipelineConfig.Builder builder) {
        String inputDir = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("-h") || arg.equals("--help")) {
                throw new HelpRequested();
            }
            if (!arg.startsWith("-") || arg.equals("-")) {
                if (inputDir != null) {
                    throw new IllegalArgumentException("unrecognized arguments: " + arg);
                }
                inputDir = arg;
                continue;
            }

            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            if (!name.equals("--output-dir") && !name.equals("--output-filename") && !name.equals("--log-level")) {
                throw new IllegalArgumentException("unrecognized arguments: " + arg);
            }
            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("argument " + name + ": expected one argument");
                }
                value = args[++i];
            }

            switch (name) {
                case "--output-dir" -> builder.outputDir(Paths.get(value));
                case "--output-filename" -> builder.outputFilename(value);
                default -> builder.logLevel(PipelineConfig.LogLevel.parse(value));
            }
        }
        if (inputDir == null) {
            throw new IllegalArgumentException("the following arguments are required: input_dir");
        }
        return builder.inputDir(Paths.get(inputDir)).build();
    }

    /**
     * Sets the root logger's level when Logback is the active SLF4J binding.
     */
    static void applyLogLevel(PipelineConfig.LogLevel level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(toLogbackLevel(level));
        }
    }

    static Level toLogbackLevel(PipelineConfig.LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR, CRITICAL -> Level.ERROR;
        };
    }

    private static final class HelpRequested extends RuntimeException {
        HelpRequested() {
            super(null, null, false, false);
        }
    }
}
