package com.flamingo.ai.summarizer.service.document;

/**
 * Service for generating document summaries.
 *
 * <p>Documents of any length are accepted: long text is summarized chunk by chunk and the chunk
 * summaries are merged into one final summary.
 */
public interface DocumentSummaryService {

  /**
   * Generates a summary for the given document content.
   *
   * @param fileName the document filename, passed to the prompts as the title
   * @param fullText the full extracted text of the document
   * @return the summary, or empty string for a document without text
   */
  default String generateSummary(String fileName, String fullText) {
    return summarize(fullText, SummaryOptions.titled(fileName)).summary();
  }

  /**
   * Summarizes {@code fullText}, picking the final prompt from {@code options}.
   *
   * @throws com.flamingo.ai.summarizer.exception.SummarizationException if the backend fails
   */
  DocumentSummary summarize(String fullText, SummaryOptions options);
}
