package com.example.AssessRec.service;

import com.example.AssessRec.exception.ExplanationGenerationException;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link ExplanationGenerator} that sends one prompt through a Spring AI {@link ChatClient}.
 */
public class ChatClientExplanationGenerator implements ExplanationGenerator {

    private final ChatClient chatClient;
    private final String modelName;

    public ChatClientExplanationGenerator(ChatClient chatClient, String modelName) {
        this.chatClient = chatClient;
        this.modelName = modelName;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt) {
        String content;
        try {
            content = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new ExplanationGenerationException(modelName + " chat call failed: " + e.getMessage(), e);
        }
        if (content == null || content.isBlank()) {
            throw new ExplanationGenerationException(modelName + " returned an empty explanation");
        }
        return content;
    }

    public String modelName() {
        return modelName;
    }
}
