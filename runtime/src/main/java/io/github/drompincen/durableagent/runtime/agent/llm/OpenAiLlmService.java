package io.github.drompincen.durableagent.runtime.agent.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * OpenAI chat completions through Spring AI. The model is created on first use, so an
 * application without a real key still starts and simply reports itself unavailable.
 */
@Service
@ConditionalOnProperty(name = "durableagent.llm.provider", havingValue = "openai")
public class OpenAiLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmService.class);
    private static final String PLACEHOLDER_PREFIX = "sk-placeholder";

    private final String apiKey;
    private final String model;
    private final double temperature;
    private final int maxTokens;

    private volatile ChatModel chatModel;

    @Autowired
    public OpenAiLlmService(@Value("${spring.ai.openai.api-key:}") String apiKey,
                            @Value("${durableagent.llm.model:gpt-4o-mini}") String model,
                            @Value("${durableagent.llm.temperature:0.7}") double temperature,
                            @Value("${durableagent.llm.max-tokens:150}") int maxTokens) {
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        log.info("OpenAiLlmService initialized: model={}, key={}", model, hasRealKey() ? "present" : "missing");
    }

    OpenAiLlmService(ChatModel chatModel) {
        this("sk-test", "test-model", 0.7, 150);
        this.chatModel = chatModel;
    }

    private boolean hasRealKey() {
        return apiKey != null && !apiKey.isBlank() && !apiKey.startsWith(PLACEHOLDER_PREFIX);
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null || hasRealKey();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        ChatModel m = getOrCreateModel();
        Prompt prompt = new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)));
        var response = m.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Empty response from " + model);
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Blank completion from " + model);
        }
        return text.strip();
    }

    private ChatModel getOrCreateModel() {
        ChatModel m = chatModel;
        if (m != null) return m;
        if (!hasRealKey()) {
            throw new IllegalStateException("spring.ai.openai.api-key is not set");
        }
        synchronized (this) {
            if (chatModel == null) {
                OpenAiApi api = OpenAiApi.builder().apiKey(apiKey).build();
                OpenAiChatOptions options = OpenAiChatOptions.builder()
                        .model(model)
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .build();
                chatModel = OpenAiChatModel.builder().openAiApi(api).defaultOptions(options).build();
                log.info("Created OpenAI model {}", model);
            }
            return chatModel;
        }
    }
}
