package com.flamingo.ai.summarizer.service.document;

import com.flamingo.ai.summarizer.config.SummarizerConfig;
import com.flamingo.ai.summarizer.service.summary.ChunkSummarizer;
import com.flamingo.ai.summarizer.service.summary.ReduceCoordinator;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link DocumentSummaryService} on top of {@link ReduceCoordinator}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentSummaryServiceImpl implements DocumentSummaryService {

  private final ReduceCoordinator reduceCoordinator;
  private final ChunkSummarizer chunkSummarizer;
  private final SummarizerConfig summarizerConfig;

  @Override
  public DocumentSummary summarize(String fullText, SummaryOptions options) {
    String promptName = finalPromptName(options);
    Map<String, String> variables = new HashMap<>(options.variables());
    if (options.title() != null) {
      variables.put("title", options.title());
    }
    if (options.sourcePath() != null) {
      variables.put("source_path", options.sourcePath());
    }

    log.debug(
        "Summarizing '{}' ({} chars) with prompt '{}'",
        options.title(),
        fullText != null ? fullText.length() : 0,
        promptName);
    String summary = reduceCoordinator.summarize(fullText, promptName, variables);
    log.debug(
        "Summary complete for '{}': {} chars",
        options.title(),
        summary != null ? summary.length() : 0);
    return new DocumentSummary(summary, chunkSummarizer.isSimulated());
  }

  private String finalPromptName(SummaryOptions options) {
    if (options.promptName() != null && !options.promptName().isBlank()) {
      return options.promptName();
    }
    SummarizerConfig.Prompts prompts = summarizerConfig.getPrompts();
    return options.video() ? prompts.getVideoFinalTemplate() : prompts.getFinalTemplate();
  }
}
