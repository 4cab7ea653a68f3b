package com.eainde.research.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request model parameters handed to the text-generation collaborator.
 */
@Value
@Builder
public class ModelSettings {

    String modelName;

    @Builder.Default
    double temperature = 0.1;
}
