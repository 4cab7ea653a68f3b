package com.eainde.research.nodes;

import com.eainde.research.model.ErrorKind;
import com.eainde.research.model.ResearchPipelineException;

/**
 * A step of a stage graph failed. None of the step's writes were merged.
 */
public class StepFailedException extends ResearchPipelineException {

    private final String step;

    public StepFailedException(String step, ErrorKind kind, String message, Throwable cause) {
        super(kind, "Step '" + step + "' failed (" + kind + "): " + message, cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
