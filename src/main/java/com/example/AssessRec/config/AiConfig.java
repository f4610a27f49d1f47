package com.example.AssessRec.config;

import com.example.AssessRec.service.ChatClientExplanationGenerator;
import com.example.AssessRec.service.ExplanationGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    /**
     * Explanation generator over the configured chat model.
     * The preferred provider ("openai" or "deepseek") is used when its model bean exists,
     * otherwise the other one. Without any chat model the generator always fails and
     * recommendations are returned without explanations.
     */
    @Bean
    public ExplanationGenerator explanationGenerator(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            RecommenderProperties properties
    ) {
        String preferred = properties.getExplanation().getProvider();
        DeepSeekChatModel deepSeekModel = deepSeekProvider.getIfAvailable();
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();

        if ("deepseek".equalsIgnoreCase(preferred) && deepSeekModel != null) {
            return generator(deepSeekModel, "deepseek");
        }
        if (openAiModel != null) {
            return generator(openAiModel, "openai");
        }
        if (deepSeekModel != null) {
            return generator(deepSeekModel, "deepseek");
        }

        log.warn("No chat model configured; recommendations will be returned without explanations");
        return ExplanationGenerator.unavailable("No chat model is configured");
    }

    /**
     * The system prompt is sent per call by {@link ChatClientExplanationGenerator}, so the
     * client carries no default one.
     */
    private static ExplanationGenerator generator(ChatModel model, String name) {
        log.info("Explanations generated with the {} chat model", name);
        return new ChatClientExplanationGenerator(ChatClient.builder(model).build(), name);
    }
}
