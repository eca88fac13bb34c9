package com.flamingo.ai.summarizer.api.rest;

import com.flamingo.ai.summarizer.api.dto.request.SummaryRequest;
import com.flamingo.ai.summarizer.api.dto.response.SummaryResponse;
import com.flamingo.ai.summarizer.service.document.DocumentSummaryService;
import com.flamingo.ai.summarizer.service.document.SummaryOptions;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document summarization. */
@RestController
@RequestMapping("/api/summaries")
@RequiredArgsConstructor
public class SummaryController {

  private final DocumentSummaryService documentSummaryService;

  /** Summarizes the posted text. Blocks until the summary is complete. */
  @PostMapping
  public ResponseEntity<SummaryResponse> summarize(@Valid @RequestBody SummaryRequest request) {
    SummaryOptions options =
        SummaryOptions.builder()
            .title(request.getTitle())
            .sourcePath(request.getSourcePath())
            .video(request.isVideo())
            .promptName(request.getPromptName())
            .variables(request.getVariables())
            .build();
    return ResponseEntity.ok(
        SummaryResponse.from(documentSummaryService.summarize(request.getText(), options)));
  }
}
