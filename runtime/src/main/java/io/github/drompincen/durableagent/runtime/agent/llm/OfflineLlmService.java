package io.github.drompincen.durableagent.runtime.agent.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/** Used when no provider is configured; every caller falls back to its unpolished text. */
@Service
@ConditionalOnProperty(name = "durableagent.llm.provider", havingValue = "none", matchIfMissing = true)
public class OfflineLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(OfflineLlmService.class);

    public OfflineLlmService() {
        log.info("No LLM provider configured, replies are sent as drafted");
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        throw new IllegalStateException("No LLM provider configured");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
