package com.eainde.dealflow.reasoning;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * {@link ReasoningPort} on top of a LangChain4j {@link ChatModel}. Sends the
 * prompt as a single user message and strips {@code <think>} blocks that
 * reasoning models put in front of their answer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatModelReasoningPort implements ReasoningPort {

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>.*?</think>", Pattern.DOTALL);

    private final ChatModel chatModel;

    @Override
    public String submit(String prompt, int maxOutputTokens) {
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .maxOutputTokens(maxOutputTokens)
                .build();

        long started = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new ReasoningException("Reasoning service call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - started;

        TokenUsage usage = response.tokenUsage();
        if (usage != null) {
            log.info("Reasoning call took {} ms, tokens in={} out={}",
                    elapsed, usage.inputTokenCount(), usage.outputTokenCount());
        } else {
            log.info("Reasoning call took {} ms", elapsed);
        }

        AiMessage message = response.aiMessage();
        if (message == null || message.text() == null) {
            return "";
        }
        return stripThinking(message.text());
    }

    static String stripThinking(String text) {
        return THINK_BLOCK.matcher(text).replaceAll("").strip();
    }
}
