package com.phillippitts.messagebridge.service.orchestration;

import com.phillippitts.messagebridge.domain.CallEvent;

/** One side effect run when an incoming call triggers. */
public interface TriggerAction {
    /** @return false to skip this action (switched off by configuration) */
    boolean isEnabled();

    /** Perform the action; any exception counts as a failure of this action only. */
    void execute(CallEvent event);

    /** Name for logs/metrics; also fixes the position in the sequence. */
    String name();
}
