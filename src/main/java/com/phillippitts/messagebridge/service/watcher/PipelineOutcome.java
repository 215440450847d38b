package com.phillippitts.messagebridge.service.watcher;

/** Result of pushing one line through {@link CallEventPipeline}. */
public enum PipelineOutcome {
    /** Line does not contain the trigger keyword. */
    IGNORED,
    /** Qualifying line, but the call id is still cooling down. */
    SUPPRESSED,
    /** Actions ran for this line. */
    TRIGGERED
}
