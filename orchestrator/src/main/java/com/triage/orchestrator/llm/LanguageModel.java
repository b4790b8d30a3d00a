package com.triage.orchestrator.llm;

/**
 * Narrow text-generation capability handed to the incident-responder nodes.
 */
@FunctionalInterface
public interface LanguageModel {

    /**
     * @param systemPrompt role and standing instructions for the model
     * @param prompt       the task for this call
     * @return the model's text reply
     * @throws LanguageModelException if the provider call fails
     */
    String generate(String systemPrompt, String prompt);
}
