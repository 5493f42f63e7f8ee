package io.github.calltable;

import java.nio.file.Path;

/**
 * What a pipeline run produced.
 *
 * @param outputPath the CSV file that was written
 * @param counters record tallies over all files
 * @param filesRead number of input files discovered and read
 */
public record PipelineResult(Path outputPath, PipelineCounters counters, int filesRead) {
}
