package com.veriheal.llm;

/**
 * Single entry point for model calls.
 *
 * Implementations own the system prompt per role; callers only build the
 * task-specific prompt body. Responses are untrusted text.
 */
public interface LLMClient {

    /**
     * @return raw model output; never null, empty on empty model output
     * @throws LLMException if the model could not be reached
     */
    String generateWithRole(CollaboratorRole role, String userPrompt, double temperature);

    /**
     * GENERATOR 0.3, DIAGNOSER 0.1, PATCHER 0.0
     */
    default double getTemperatureForRole(CollaboratorRole role) {
        return switch (role) {
            case GENERATOR -> 0.3;
            case DIAGNOSER -> 0.1;
            case PATCHER   -> 0.0;
        };
    }
}
