package com.eainde.research.coordinator;

import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Resumes every persisted non-terminal run once the application is up.
 */
@Log4j2
@Component
@ConditionalOnProperty(name = "research.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class RunRecoveryListener {

    private final PipelineCoordinator coordinator;

    public RunRecoveryListener(PipelineCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeIncompleteRuns() {
        int resumed = coordinator.resumeIncomplete();
        if (resumed > 0) {
            log.info("Resumed {} incomplete runs", resumed);
        }
    }
}
