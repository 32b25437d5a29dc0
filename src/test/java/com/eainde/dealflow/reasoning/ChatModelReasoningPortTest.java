package com.eainde.dealflow.reasoning;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelReasoningPortTest {

    @Mock
    private ChatModel chatModel;

    private ChatModelReasoningPort port;

    @BeforeEach
    void setUp() {
        port = new ChatModelReasoningPort(chatModel);
    }

    @Test
    void submit_shouldSendPromptAsUserMessage_withTokenLimit() {
        // Arrange
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"ok\": true}"))
                .tokenUsage(new TokenUsage(120, 8))
                .build());

        // Act
        String answer = port.submit("Extract the requirements", 4096);

        // Assert
        assertThat(answer).isEqualTo("{\"ok\": true}");
        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        assertThat(request.getValue().maxOutputTokens()).isEqualTo(4096);
        assertThat(request.getValue().messages()).singleElement()
                .isInstanceOfSatisfying(UserMessage.class,
                        message -> assertThat(message.singleText()).isEqualTo("Extract the requirements"));
    }

    @Test
    void submit_shouldStripThinkingBlocks() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("<think>\nlet me see\n</think>\n\n{\"a\": 1}"))
                .build());

        assertThat(port.submit("prompt", 100)).isEqualTo("{\"a\": 1}");
    }

    @Test
    void submit_shouldWrapTransportFailures() {
        RuntimeException cause = new RuntimeException("connect timed out");
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(cause);

        assertThatThrownBy(() -> port.submit("prompt", 100))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("connect timed out")
                .hasCause(cause);
    }

    @Test
    void stripThinking_shouldRemoveEveryBlock_andTrim() {
        assertThat(ChatModelReasoningPort.stripThinking("  <think>a</think>x<think>b</think>  "))
                .isEqualTo("x");
        assertThat(ChatModelReasoningPort.stripThinking("no blocks")).isEqualTo("no blocks");
    }
}
