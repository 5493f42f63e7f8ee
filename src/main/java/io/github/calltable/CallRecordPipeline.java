package io.github.calltable;

import com.google.common.base.Preconditions;
import io.github.calltable.converter.CoercionException;
import io.github.calltable.files.CsvTableWriter;
import io.github.calltable.files.FileDiscoverer;
import io.github.calltable.files.RecordReader;
import io.github.calltable.schema.CallRow;
import io.github.calltable.schema.FieldExtractor;
import io.github.calltable.schema.SchemaValidator;
import io.github.calltable.schema.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Drives discovery, reading, validation, extraction and CSV output for one run.
 *
 * <p>Files are processed sequentially in discovery order and records in read order.
 * A bad record or file is logged and skipped; only a missing input directory or a
 * failure to write the output aborts the run.</p>
 */
public class CallRecordPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CallRecordPipeline.class);

    private final FileDiscoverer discoverer;
    private final RecordReader reader;
    private final SchemaValidator validator;
    private final FieldExtractor extractor;
    private final CsvTableWriter writer;

    public CallRecordPipeline() {
        this(new FileDiscoverer(), new RecordReader(), new SchemaValidator(), new FieldExtractor(),
                new CsvTableWriter());
    }

    public CallRecordPipeline(FileDiscoverer discoverer, RecordReader reader, SchemaValidator validator,
                              FieldExtractor extractor, CsvTableWriter writer) {
        this.discoverer = discoverer;
        this.reader = reader;
        this.validator = validator;
        this.extractor = extractor;
        this.writer = writer;
    }

    /**
     * Runs the pipeline with the directories and filename from {@code config}.
     *
     * @throws IllegalArgumentException if {@code config} has no input directory
     */
    public PipelineResult run(PipelineConfig config) throws IOException {
        Preconditions.checkNotNull(config, "config");
        Preconditions.checkArgument(config.getInputDir() != null, "Input directory is not configured");
        return run(config.getInputDir(), config.getOutputDir(), config.getOutputFilename());
    }

    /**
     * Converts every record under {@code inputDir} and writes one CSV.
     *
     * @return the written path with counters; the CSV holds only a header when no record survived
     * @throws io.github.calltable.files.InputDirectoryNotFoundException if {@code inputDir} is not a directory
     * @throws IOException if discovery of the root or writing the CSV fails
     */
    public PipelineResult run(Path inputDir, Path outputDir, String outputFilename) throws IOException {
        LOG.info("Scanning for JSON/JSONL in {}", inputDir);
        List<Path> files = discoverer.discover(inputDir);

        List<CallRow> rows = new ArrayList<>();
        PipelineCounters counters = PipelineCounters.EMPTY;
        for (Path file : files) {
            LOG.info("Reading {}", file);
            counters = counters.plus(processFile(file, rows));
        }

        Path outPath = writer.write(rows, outputDir, outputFilename);
        LOG.info("Wrote {} rows (skipped {} of {}) to {}",
                counters.written(), counters.skipped(), counters.seen(), outPath);
        return new PipelineResult(outPath, counters, files.size());
    }

    private PipelineCounters processFile(Path file, List<CallRow> rows) {
        PipelineCounters counters = PipelineCounters.EMPTY;
        try (Stream<Map<String, Object>> records = reader.read(file)) {
            for (Map<String, Object> record : (Iterable<Map<String, Object>>) records::iterator) {
                ValidationResult validation = validator.validate(record);
                if (!validation.isValid()) {
                    LOG.warn("Schema validation failed for record in {}: {}", file, validation.formatErrors());
                    counters = counters.recordSkipped();
                    continue;
                }
                try {
                    rows.add(extractor.extract(record));
                    counters = counters.recordWritten();
                } catch (CoercionException e) {
                    LOG.error("Failed to extract row from {}: {}", file, e.getMessage());
                    counters = counters.recordSkipped();
                }
            }
        }
        LOG.debug("{}: {} records, {} written, {} skipped",
                file, counters.seen(), counters.written(), counters.skipped());
        return counters;
    }
}
