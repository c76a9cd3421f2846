package io.github.drompincen.durableagent.runtime.agent.llm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenAiLlmServiceTest {

    @Mock
    private ChatModel chatModel;

    @Test
    void sendsSystemAndUserMessages() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(" Hi there! ")))));
        OpenAiLlmService service = new OpenAiLlmService(chatModel);

        String text = service.complete("be kind", "Customer: hi");

        assertThat(text).isEqualTo("Hi there!");
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertThat(captor.getValue().getInstructions()).hasSize(2);
        assertThat(captor.getValue().getInstructions().get(0).getText()).isEqualTo("be kind");
        assertThat(captor.getValue().getInstructions().get(1).getText()).isEqualTo("Customer: hi");
    }

    @Test
    void blankCompletionIsAnError() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("")))));
        OpenAiLlmService service = new OpenAiLlmService(chatModel);

        assertThatThrownBy(() -> service.complete("s", "u")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void placeholderKeyIsUnavailable() {
        OpenAiLlmService service = new OpenAiLlmService("sk-placeholder-123", "gpt-4o-mini", 0.7, 150);

        assertThat(service.isAvailable()).isFalse();
        assertThatThrownBy(() -> service.complete("s", "u"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }

    @Test
    void offlineServiceIsNeverAvailable() {
        OfflineLlmService offline = new OfflineLlmService();

        assertThat(offline.isAvailable()).isFalse();
        assertThatThrownBy(() -> offline.complete("s", "u")).isInstanceOf(IllegalStateException.class);
    }
}
