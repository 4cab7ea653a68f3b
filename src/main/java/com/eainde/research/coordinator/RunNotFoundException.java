package com.eainde.research.coordinator;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("No research run with id " + runId);
    }
}
