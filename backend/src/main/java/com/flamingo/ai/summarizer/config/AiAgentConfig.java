package com.flamingo.ai.summarizer.config;

import com.flamingo.ai.summarizer.agent.SummaryGenerationAgent;
import com.flamingo.ai.summarizer.service.summary.backend.AgentGenerationBackend;
import com.flamingo.ai.summarizer.service.summary.backend.GenerationBackend;
import com.flamingo.ai.summarizer.service.summary.backend.SimulatedGenerationBackend;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generation backend.
 *
 * <p>Pattern: the agent interface declares its messages with @SystemMessage/@UserMessage and
 * AiServices.builder() builds the implementation. Without a chat model the simulated backend is
 * used instead.
 */
@Configuration
@Slf4j
public class AiAgentConfig {

  @Bean
  public GenerationBackend generationBackend(
      ObjectProvider<ChatModel> chatModel,
      @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}") String modelName) {
    ChatModel model = chatModel.getIfAvailable();
    if (model == null) {
      log.warn("No OpenAI API key configured, summaries will be simulated");
      return new SimulatedGenerationBackend();
    }
    SummaryGenerationAgent agent =
        AiServices.builder(SummaryGenerationAgent.class).chatModel(model).build();
    log.info("Using generation backend model {}", modelName);
    return new AgentGenerationBackend(agent, modelName);
  }
}
