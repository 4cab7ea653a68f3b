package com.eainde.research.dispatch;

import com.eainde.research.model.ResearchRequest;
import com.eainde.research.model.SectionResult;
import com.eainde.research.model.SectionSpec;

/**
 * Runs the research sub-pipeline of one section.
 */
@FunctionalInterface
public interface SectionRunner {

    /**
     * @return the section's result, carrying the same index as {@code section}
     * @throws com.eainde.research.model.ResearchPipelineException on a classified failure
     */
    SectionResult research(ResearchRequest request, SectionSpec section);
}
