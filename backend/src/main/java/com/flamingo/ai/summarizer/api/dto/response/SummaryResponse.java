package com.flamingo.ai.summarizer.api.dto.response;

import com.flamingo.ai.summarizer.service.document.DocumentSummary;

/** Response DTO for a generated summary. */
public record SummaryResponse(String summary, boolean simulated) {

  public static SummaryResponse from(DocumentSummary documentSummary) {
    return new SummaryResponse(documentSummary.summary(), documentSummary.simulated());
  }
}
