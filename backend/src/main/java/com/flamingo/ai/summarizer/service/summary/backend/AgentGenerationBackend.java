package com.flamingo.ai.summarizer.service.summary.backend;

import com.flamingo.ai.summarizer.agent.SummaryGenerationAgent;
import com.flamingo.ai.summarizer.service.summary.CancellationSignal;
import lombok.RequiredArgsConstructor;

/** {@link GenerationBackend} backed by a LangChain4j {@link SummaryGenerationAgent}. */
@RequiredArgsConstructor
public class AgentGenerationBackend implements GenerationBackend {

  private final SummaryGenerationAgent agent;
  private final String modelName;

  @Override
  public String generate(String prompt, CancellationSignal cancellation) {
    return agent.generate(prompt);
  }

  @Override
  public String description() {
    return modelName;
  }
}
