package com.flamingo.ai.summarizer.service.document;

import java.util.Map;
import lombok.Builder;

/**
 * Caller choices for summarizing one document.
 *
 * @param title document title, exposed to prompts as {@code {{title}}}
 * @param sourcePath where the text came from, exposed as {@code {{source_path}}}
 * @param video whether the text is a video transcript
 * @param promptName explicit final prompt; overrides the choice made from {@code video}
 * @param variables additional prompt variables
 */
@Builder
public record SummaryOptions(
    String title,
    String sourcePath,
    boolean video,
    String promptName,
    Map<String, String> variables) {

  public SummaryOptions {
    variables = variables == null ? Map.of() : variables;
  }

  public static SummaryOptions titled(String title) {
    return SummaryOptions.builder().title(title).build();
  }
}
