package org.rostilos.reviewpilot.pipelineagent.service;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Acknowledgment returned for every trigger, whether a run was started or not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResult(
        String status,
        boolean started,
        Long runId,
        String reason
) {

    public static TriggerResult started(Long runId) {
        return new TriggerResult("started", true, runId, null);
    }

    public static TriggerResult ignored(String reason) {
        return new TriggerResult("ignored", false, null, reason);
    }
}
