package io.github.calltable;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.calltable.schema.CallRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

class CallTableAppTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private CallTableApp app;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        originalRootLevel = rootLogger().getLevel();
        app = new CallTableApp(new CallRecordPipeline(), PipelineConfig::builder,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        rootLogger().setLevel(originalRootLevel);
    }

    @Test
    @DisplayName("prints the written CSV path on success")
    void success() throws IOException {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(input.resolve("calls.json"), new ObjectMapper().writeValueAsString(CallRecords.valid()));
        Path output = tempDir.resolve("out");

        int code = app.run(new String[]{input.toString(), "--output-dir", output.toString(),
                "--output-filename=result.csv", "--log-level", "WARNING"});

        assertThat(code).isEqualTo(CallTableApp.EXIT_OK);
        assertThat(stdout().trim()).isEqualTo(output.resolve("result.csv").toString());
        assertThat(Files.readAllLines(output.resolve("result.csv"))).hasSize(2);
        assertThat(rootLogger().getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    @DisplayName("fails without output when the input directory is missing")
    void missingInputDirectory() {
        Path output = tempDir.resolve("out");

        int code = app.run(new String[]{tempDir.resolve("absent").toString(), "--output-dir", output.toString()});

        assertThat(code).isEqualTo(CallTableApp.EXIT_FAILURE);
        assertThat(stderr()).contains("Input directory not found");
        assertThat(stdout()).isEmpty();
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("reports a usage error when input_dir is missing")
    void missingArgument() {
        int code = app.run(new String[]{"--log-level", "DEBUG"});

        assertThat(code).isEqualTo(CallTableApp.EXIT_USAGE);
        assertThat(stderr()).contains("usage:").contains("the following arguments are required: input_dir");
    }

    @Test
    @DisplayName("prints usage for --help")
    void help() {
        assertThat(app.run(new String[]{"--help"})).isEqualTo(CallTableApp.EXIT_OK);
        assertThat(stdout()).contains("input_dir").contains("--output-filename");
    }

    @Nested
    @DisplayName("argument parsing")
    class ParseArgs {

        @Test
        @DisplayName("applies defaults when only input_dir is given")
        void defaults() {
            PipelineConfig config = CallTableApp.parseArgs(new String[]{"data"}, PipelineConfig.builder());

            assertThat(config.getInputDir()).isEqualTo(Paths.get("data"));
            assertThat(config.getOutputDir()).isEqualTo(PipelineConfig.DEFAULT_OUTPUT_DIR);
            assertThat(config.getOutputFilename()).isEqualTo("calls.csv");
            assertThat(config.getLogLevel()).isEqualTo(PipelineConfig.LogLevel.INFO);
        }

        @Test
        @DisplayName("accepts options before the positional argument")
        void optionsFirst() {
            PipelineConfig config = CallTableApp.parseArgs(
                    new String[]{"--log-level=critical", "--output-dir=/tmp/x", "data"}, PipelineConfig.builder());

            assertThat(config.getLogLevel()).isEqualTo(PipelineConfig.LogLevel.CRITICAL);
            assertThat(config.getOutputDir()).isEqualTo(Paths.get("/tmp/x"));
        }

        @Test
        @DisplayName("rejects unknown options, extra arguments and missing values")
        void rejectsBadInput() {
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> CallTableApp.parseArgs(new String[]{"data", "--verbose"}, PipelineConfig.builder()))
                    .withMessageContaining("unrecognized arguments");
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> CallTableApp.parseArgs(new String[]{"data", "more"}, PipelineConfig.builder()));
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> CallTableApp.parseArgs(new String[]{"data", "--output-dir"}, PipelineConfig.builder()))
                    .withMessageContaining("expected one argument");
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> CallTableApp.parseArgs(new String[]{"data", "--log-level", "LOUD"}, PipelineConfig.builder()));
        }

        @Test
        @DisplayName("maps log levels onto Logback levels")
        void logbackLevels() {
            assertThat(CallTableApp.toLogbackLevel(PipelineConfig.LogLevel.DEBUG)).isEqualTo(Level.DEBUG);
            assertThat(CallTableApp.toLogbackLevel(PipelineConfig.LogLevel.WARNING)).isEqualTo(Level.WARN);
            assertThat(CallTableApp.toLogbackLevel(PipelineConfig.LogLevel.CRITICAL)).isEqualTo(Level.ERROR);
        }
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static Logger rootLogger() {
        return (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
}
