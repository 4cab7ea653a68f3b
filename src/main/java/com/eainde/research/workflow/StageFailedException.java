package com.eainde.research.workflow;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;
import com.eainde.research.model.RunStatus;

/**
 * A stage graph could not complete. Carries the stage, the failing step (null
 * when the failure happened outside any step) and the classification.
 */
public class StageFailedException extends ResearchPipelineException {

    private final RunStatus stage;
    private final String step;

    public StageFailedException(RunStatus stage, String step, ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        this.stage = stage;
        this.step = step;
    }

    public RunStatus getStage() {
        return stage;
    }

    public String getStep() {
        return step;
    }
}
