package com.phillippitts.messagebridge.service.orchestration;

import java.util.List;

/** Action names grouped by outcome for one trigger, in execution order. */
public record TriggerReport(List<String> succeeded, List<String> failed, List<String> skipped) {

    public TriggerReport {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
    }
}
