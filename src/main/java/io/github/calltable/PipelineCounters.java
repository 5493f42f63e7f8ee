package io.github.calltable;

/**
 * Record tallies for one pipeline run, or for one file within it.
 *
 * <p>Immutable; {@code seen == written + skipped} always holds. Lines or elements that
 * never decode to a JSON object are not records and are not counted.</p>
 */
public record PipelineCounters(long seen, long written, long skipped) {

    public static final PipelineCounters EMPTY = new PipelineCounters(0, 0, 0);

    public PipelineCounters {
        if (seen != written + skipped) {
            throw new IllegalArgumentException(
                    "seen (" + seen + ") must equal written (" + written + ") + skipped (" + skipped + ")");
        }
    }

    public PipelineCounters recordWritten() {
        return new PipelineCounters(seen + 1, written + 1, skipped);
    }

    public PipelineCounters recordSkipped() {
        return new PipelineCounters(seen + 1, written, skipped + 1);
    }

    public PipelineCounters plus(PipelineCounters other) {
        return new PipelineCounters(seen + other.seen, written + other.written, skipped + other.skipped);
    }
}
