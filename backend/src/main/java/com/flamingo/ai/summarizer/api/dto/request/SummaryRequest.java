package com.flamingo.ai.summarizer.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for summarizing a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryRequest {

  @NotBlank(message = "Text is required")
  private String text;

  /** Final prompt template name; chosen from {@link #video} when absent. */
  private String promptName;

  private String title;

  private String sourcePath;

  private boolean video;

  private Map<String, String> variables;
}
