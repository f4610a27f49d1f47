package com.example.AssessRec.config;

import com.example.AssessRec.exception.ExplanationGenerationException;
import com.example.AssessRec.service.ExplanationGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AiConfigTest {

    private final AiConfig aiConfig = new AiConfig();

    @Test
    @DisplayName("Each explanation call carries exactly one system message")
    @SuppressWarnings("unchecked")
    void singleSystemMessage() {
        OpenAiChatModel openAiModel = mock(OpenAiChatModel.class);
        when(openAiModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("1. Java Test")))));
        ObjectProvider<DeepSeekChatModel> deepSeek = mock(ObjectProvider.class);
        ObjectProvider<OpenAiChatModel> openAi = mock(ObjectProvider.class);
        when(openAi.getIfAvailable()).thenReturn(openAiModel);

        ExplanationGenerator generator = aiConfig.explanationGenerator(deepSeek, openAi, new RecommenderProperties());

        assertThat(generator.generate("You are an HR consultant.", "HIRING QUERY: java")).isEqualTo("1. Java Test");
        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(openAiModel).call(prompt.capture());
        assertThat(prompt.getValue().getInstructions())
                .filteredOn(m -> m instanceof SystemMessage)
                .singleElement()
                .extracting(m -> m.getText())
                .isEqualTo("You are an HR consultant.");
    }

    @Test
    @DisplayName("Without any chat model the generator always fails")
    @SuppressWarnings("unchecked")
    void noChatModel() {
        ObjectProvider<DeepSeekChatModel> deepSeek = mock(ObjectProvider.class);
        ObjectProvider<OpenAiChatModel> openAi = mock(ObjectProvider.class);

        ExplanationGenerator generator = aiConfig.explanationGenerator(deepSeek, openAi, new RecommenderProperties());

        assertThatThrownBy(() -> generator.generate("s", "u")).isInstanceOf(ExplanationGenerationException.class);
    }
}
