package com.eainde.research.gateway;

/**
 * Input of one text-generation call.
 *
 * @param purpose name of the step issuing the call, used for logging and routing
 * @param prompt  the fully rendered prompt
 * @param model   model parameters
 */
public record GenerationRequest(String purpose, String prompt, ModelSettings model) {
}
