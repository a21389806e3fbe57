package com.jobgrid.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobgrid.model.JobResultStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Final state of one job execution as seen by the worker that ran it.
 */
public record ExecutionOutcome(
        UUID jobResultId,
        JobResultStatus status,
        JsonNode result,
        String traceback,
        String worker,
        OffsetDateTime dateDone) {
}
