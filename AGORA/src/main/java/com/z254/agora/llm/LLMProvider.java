package com.z254.agora.llm;

import reactor.core.publisher.Mono;

/**
 * Backend chat-completion interface used by the deliberation engine.
 */
public interface LLMProvider {

    /**
     * Complete a prompt with the backend named by {@link LLMRequest#getModel()}.
     *
     * <p>Fails with {@link LLMProviderException} on a non-success HTTP status, an empty
     * choice list, a transport timeout or a transport-level error, once the provider's own
     * retry policy is exhausted.
     *
     * @param request the completion request
     * @return the completion response
     */
    Mono<LLMResponse> complete(LLMRequest request);

    /**
     * Get the provider ID.
     *
     * @return provider ID (e.g., "openrouter")
     */
    String getProviderId();

    /**
     * Check whether the provider has the credentials it needs to make calls.
     *
     * @return true if calls can be attempted
     */
    boolean isConfigured();
}
