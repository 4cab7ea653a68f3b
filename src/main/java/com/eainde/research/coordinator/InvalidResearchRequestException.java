package com.eainde.research.coordinator;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;

/**
 * A submitted request failed validation. The run has already been persisted
 * as failed under {@link #getRunId()}.
 */
public class InvalidResearchRequestException extends ResearchPipelineException {

    private final String runId;

    public InvalidResearchRequestException(String runId, String message) {
        super(ErrorKind.INVALID_REQUEST, message);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
