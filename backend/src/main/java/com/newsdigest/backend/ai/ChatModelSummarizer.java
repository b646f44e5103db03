package com.newsdigest.backend.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Summarizer backed by the Spring AI chat model, when one is configured
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatModelSummarizer implements Summarizer {

    private final ObjectProvider<ChatModel> chatModelProvider;

    @Override
    public boolean isAvailable() {
        return chatModelProvider.getIfAvailable() != null;
    }

    @Override
    public String summarize(String prompt) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new SummarizationException("No chat model configured");
        }

        ChatResponse response;
        try {
            response = chatModel.call(new Prompt(prompt));
        } catch (RuntimeException e) {
            throw new SummarizationException("Chat model call failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new SummarizationException("Chat model returned no result");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new SummarizationException("Chat model returned an empty response");
        }
        log.debug("Chat model response: {} chars", text.length());
        return text.trim();
    }
}
