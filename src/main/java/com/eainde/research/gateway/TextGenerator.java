package com.eainde.research.gateway;

/**
 * Text-generation collaborator. Implementations make exactly one remote call
 * per invocation and never retry; failures may be thrown as
 * {@link ExternalCallException} to state their classification.
 */
@FunctionalInterface
public interface TextGenerator {

    String generate(GenerationRequest request);
}
