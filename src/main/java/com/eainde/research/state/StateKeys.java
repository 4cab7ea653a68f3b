package com.eainde.research.state;

/**
 * Channel names of the stage states.
 */
public final class StateKeys {

    private StateKeys() {
    }

    // shared inputs
    public static final String REQUEST = "request";
    public static final String PLAN = "plan";

    // planning
    public static final String TOPIC_ANALYSIS = "topicAnalysis";

    // section research
    public static final String SECTION = "section";
    public static final String QUERIES = "queries";
    public static final String SEARCH_HITS = "searchHits";
    public static final String SECTION_RESULT = "sectionResult";

    // report
    public static final String SECTION_RESULTS = "sectionResults";
    public static final String OMITTED_SECTIONS = "omittedSections";
    public static final String EXECUTIVE_SUMMARY = "executiveSummary";
    public static final String BODY = "body";
    public static final String CONCLUSION = "conclusion";
    public static final String SOURCES = "sources";
    public static final String SOURCES_SECTION = "sourcesSection";
    public static final String FINAL_REPORT = "finalReport";
}
