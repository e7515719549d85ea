package com.waterCompliance.complianceDemo.reasoning.client;

import com.waterCompliance.complianceDemo.reasoning.model.ReasoningDecision;

/**
 * Produces the narrative assessment of a pipeline stage. Implementations may call
 * out to a language model; failures surface as
 * {@link com.waterCompliance.complianceDemo.external.exception.ExternalCallException}.
 */
public interface ReasoningClient {

    ReasoningDecision reason(String systemPrompt, String stagePrompt);
}
