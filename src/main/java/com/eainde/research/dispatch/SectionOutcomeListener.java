package com.eainde.research.dispatch;

import com.eainde.research.model.SectionOutcome;

/**
 * Receives section outcomes as they complete. Called on the dispatching
 * thread, one outcome at a time.
 */
@FunctionalInterface
public interface SectionOutcomeListener {

    void onOutcome(SectionOutcome outcome);
}
