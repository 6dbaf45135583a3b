package com.phillippitts.streamscribe.service.pipeline;

/**
 * How submitted audio is grouped into inference calls.
 */
public enum PipelineMode {
    /** Every chunk is transcribed on its own; every result is final. */
    IMMEDIATE,
    /** Chunks accumulate into a rolling window; partial results until the window fills. */
    WINDOWED;

    /** Lower-case name used as a metric tag. */
    public String tag() {
        return name().toLowerCase();
    }
}
