package com.agentbench.core.model;

/**
 * Provider-specific model settings for a job.
 *
 * @param endpoint base URL of the model server (Ollama style providers), may be null
 * @param modelId  model identifier, e.g. "llama3.2" or "anthropic.claude-3-haiku-20240307-v1:0"
 * @param region   cloud region for hosted foundation models, may be null
 */
public record ProviderConfig(String endpoint, String modelId, String region) {

    private static final String[] FOUNDATION_MODEL_PREFIXES = {
            "anthropic.", "amazon.", "ai21.", "cohere.", "meta.", "mistral."
    };

    /**
     * Whether the model is a hosted foundation model that a managed runtime can serve.
     */
    public boolean isFoundationModel() {
        if (modelId == null) {
            return false;
        }
        for (String prefix : FOUNDATION_MODEL_PREFIXES) {
            if (modelId.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public ProviderConfig withRegion(String newRegion) {
        return new ProviderConfig(endpoint, modelId, newRegion);
    }
}
