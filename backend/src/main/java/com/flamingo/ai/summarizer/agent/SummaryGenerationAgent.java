package com.flamingo.ai.summarizer.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that runs one summarization prompt.
 *
 * <p>The prompt arrives fully assembled (template plus content), so the user message is the prompt
 * itself.
 */
public interface SummaryGenerationAgent {

  @SystemMessage(
      """
        You are a document summarization expert. Follow the instructions in the user message
        exactly. Write in clear, concise language, keep the logical order of the source material,
        and do not invent facts that are not present in the provided content.
        """)
  @UserMessage("{{prompt}}")
  String generate(@V("prompt") String prompt);
}
