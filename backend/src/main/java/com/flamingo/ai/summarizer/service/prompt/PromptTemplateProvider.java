package com.flamingo.ai.summarizer.service.prompt;

/** Looks up prompt templates by name. Templates use {@code {{key}}} placeholders. */
public interface PromptTemplateProvider {

  /**
   * Loads the template called {@code name}.
   *
   * @param name template name without extension, e.g. {@code chunk_summary_prompt}
   * @return the template text; a default template when {@code name} cannot be found, never null
   */
  String loadTemplate(String name);
}
