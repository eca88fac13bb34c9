package com.flamingo.ai.summarizer.service.prompt;

import com.flamingo.ai.summarizer.config.SummarizerConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * {@link PromptTemplateProvider} reading {@code <name>.md} files.
 *
 * <p>Lookup order: the configured {@code summarizer.prompts.directory}, then {@code prompts/} on
 * the classpath, then the built-in defaults. Unknown names resolve to the default final prompt.
 * Names other than letters, digits, {@code _} and {@code -} are never looked up on disk or on the
 * classpath.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FilePromptTemplateProvider implements PromptTemplateProvider {

  static final String CHUNK_SUMMARY = "chunk_summary_prompt";
  static final String FINAL_SUMMARY = "final_summary_prompt";
  static final String FINAL_SUMMARY_VIDEO = "final_summary_prompt_video";

  static final String DEFAULT_CHUNK_PROMPT =
      """
      You are an expert academic summarizer. Summarize the following content for a study note, \
      focusing on key concepts, main arguments, and actionable insights. Use clear, concise \
      language suitable for graduate-level students.

      {{chunk_context}}

      Content:
      {{content}}
      """;

  static final String DEFAULT_FINAL_PROMPT =
      """
      You are an expert academic summarizer. Write a comprehensive summary for the following \
      material, synthesizing the main points, arguments, and conclusions. Highlight the most \
      important takeaways and any recommended actions or next steps.

      Content:
      {{content}}
      """;

  static final String DEFAULT_VIDEO_FINAL_PROMPT =
      """
      You are an educational content summarizer for video materials. Create a comprehensive \
      final summary in markdown with these sections: Topics Covered (3-5 bullets), Key Concepts \
      Explained (3-5 paragraphs), Important Takeaways (3-5 bullets), Summary (one paragraph), \
      Notable Quotes / Insights (1-2 blockquotes) and Questions.

      Content:
      {{content}}
      """;

  private static final Map<String, String> DEFAULTS =
      Map.of(
          CHUNK_SUMMARY, DEFAULT_CHUNK_PROMPT,
          FINAL_SUMMARY, DEFAULT_FINAL_PROMPT,
          FINAL_SUMMARY_VIDEO, DEFAULT_VIDEO_FINAL_PROMPT);

  private static final Pattern TEMPLATE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

  private final SummarizerConfig summarizerConfig;

  @Override
  public String loadTemplate(String name) {
    if (name == null || !TEMPLATE_NAME.matcher(name).matches()) {
      log.warn("Rejected template name '{}'", name);
      return defaultTemplate(name);
    }
    String fileName = name + ".md";

    try {
      String directory = summarizerConfig.getPrompts().getDirectory();
      if (directory != null && !directory.isBlank()) {
        Path path = Path.of(directory, fileName);
        if (Files.isRegularFile(path)) {
          log.debug("Loaded template '{}' from {}", name, path);
          return Files.readString(path, StandardCharsets.UTF_8);
        }
      }

      ClassPathResource resource = new ClassPathResource("prompts/" + fileName);
      if (resource.exists()) {
        try (InputStream in = resource.getInputStream()) {
          log.debug("Loaded template '{}' from classpath", name);
          return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
      }
    } catch (IOException e) {
      log.error("Error loading template '{}': {}", name, e.getMessage(), e);
    }

    return defaultTemplate(name);
  }

  private String defaultTemplate(String name) {
    log.warn("Using default template for '{}'", name);
    if (name == null) {
      return DEFAULT_FINAL_PROMPT;
    }
    return DEFAULTS.getOrDefault(name, DEFAULT_FINAL_PROMPT);
  }
}
