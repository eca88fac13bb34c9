package com.flamingo.ai.summarizer.service.document;

/**
 * Result of summarizing one document.
 *
 * @param summary the final summary, or {@code ""} for a document without text
 * @param simulated whether the summary came from the simulated backend
 */
public record DocumentSummary(String summary, boolean simulated) {}
