package com.relay.notification.model;

/**
 * How a pipeline run ended.
 */
public enum FilterMode {
    /** Every enabled stage ran. */
    FULL,
    /** A stage failed; only rule filtering was applied to the input. */
    FALLBACK,
    /** The deadline passed; result is from the last completed stage. */
    PARTIAL
}
