package io.github.drompincen.durableagent.runtime.agent.llm;

public interface LlmService {

    /** Single-shot completion. Blocks until the provider answers; failures surface as runtime exceptions. */
    String complete(String systemPrompt, String userPrompt);

    /**
     * Returns true if this LLM service has a working provider configured.
     * Callers skip the call and use their own fallback otherwise.
     */
    default boolean isAvailable() { return true; }
}
