package io.simconvert.core.engine;

/** What the driver does after rolling back a step that threw. */
public enum StepFailurePolicy {
    /** Continue with the next step; the document still reaches the latest version. */
    SKIP,
    /** Stop the chain; the document keeps the last version it fully reached. */
    ABORT
}
