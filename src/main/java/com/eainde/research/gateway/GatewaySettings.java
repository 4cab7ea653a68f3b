package com.eainde.research.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * Construction-time configuration of the {@link ExternalCallGateway}.
 */
@Value
@Builder
public class GatewaySettings {

    @Builder.Default
    CallPolicy generateTextPolicy = CallPolicy.defaults();

    @Builder.Default
    CallPolicy webSearchPolicy = CallPolicy.defaults();

    @Builder.Default
    ModelSettings model = ModelSettings.builder().build();

    public CallPolicy policyFor(CallKind kind) {
        return kind == CallKind.WEB_SEARCH ? webSearchPolicy : generateTextPolicy;
    }
}
