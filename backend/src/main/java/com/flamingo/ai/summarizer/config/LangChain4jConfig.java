package com.flamingo.ai.summarizer.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The chat model is only created when an OpenAI API key is set. Without one the application
 * runs against the simulated backend (see {@link AiAgentConfig}).
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:1000}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.temperature:0.3}")
  private double temperature;

  @Bean
  @ConditionalOnExpression("'${langchain4j.openai.api-key:}' != ''")
  public ChatModel chatModel(SummarizerConfig summarizerConfig) {
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(temperature)
        .timeout(summarizerConfig.getReduce().getCallTimeout())
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
