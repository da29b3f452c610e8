package com.veriheal.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Offline stand-in: proposes nothing and reports no confidence, so every
 * failure that needs a model escalates to a human.
 */
@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    @Override
    public String generateWithRole(CollaboratorRole role, String userPrompt, double temperature) {
        return switch (role) {
            case GENERATOR -> """
                    {"code": null, "confidence": 0.0}
                    """;
            case DIAGNOSER -> """
                    {"category": "AMBIGUOUS_OR_COMPLEX", "scope": "FILE_WIDE", "confidence": 0.0,
                     "explanation": "Mock diagnosis"}
                    """;
            case PATCHER -> """
                    {"no_patch": true}
                    """;
        };
    }
}
