package com.flamingo.ai.summarizer.service.summary.chunking;

import org.springframework.stereotype.Component;

/**
 * Cheap check for markdown structure in extracted text.
 *
 * <p>Only the first {@value #SAMPLE_CHARS} characters are inspected, with plain substring tests
 * for headers, list markers, code, links, emphasis, blockquotes and tables.
 */
@Component
public class MarkdownDetector {

  static final int SAMPLE_CHARS = 5000;

  public boolean looksLikeMarkdown(String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    String sample = text.length() > SAMPLE_CHARS ? text.substring(0, SAMPLE_CHARS) : text;
    // a leading newline lets "# Title" on the first line count as a header
    String s = "\n" + sample;

    boolean headers =
        s.contains("\n# ") || s.contains("\n## ") || s.contains("\n=====") || s.contains("\n---");
    boolean lists =
        s.contains("\n- ") || s.contains("\n* ") || s.contains("\n1. ") || s.contains("\n+ ");
    boolean code = s.contains("`") || s.contains("\n    ");
    boolean links = s.contains("[") && s.contains("](");
    boolean formatting = links || s.contains("**") || s.contains("__") || s.contains("\n>");
    boolean tables = s.contains("\n|") && (s.contains("|--") || s.contains("--|"));

    return headers || lists || code || formatting || tables;
  }
}
