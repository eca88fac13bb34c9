package com.flamingo.ai.summarizer.service.summary.chunking;

import java.util.List;

/**
 * Ordered delimiters tried from strongest (section breaks) to weakest (single characters).
 *
 * <p>An empty string is the character-level separator. It is only honoured in last position, where
 * it triggers fixed-width character slicing.
 *
 * @param separators delimiters in descending strength
 */
public record SeparatorHierarchy(List<String> separators) {

  /** General prose: paragraph and line breaks, sentence ends, clause punctuation, words. */
  public static final SeparatorHierarchy PROSE =
      new SeparatorHierarchy(
          List.of("\n\n\n", "\n\n", "\n", ". ", "! ", "? ", ";", ",", " ", ""));

  /** Markdown: heading levels 2 to 6 before the generic breaks. */
  public static final SeparatorHierarchy MARKDOWN =
      new SeparatorHierarchy(
          List.of(
              "\n## ", "\n### ", "\n#### ", "\n##### ", "\n###### ", "\n\n", "\n", " ", ""));

  /** Source code: blank lines, lines, then statement and block delimiters. */
  public static final SeparatorHierarchy CODE =
      new SeparatorHierarchy(List.of("\n\n\n", "\n\n", "\n", ";", "{", "}", " ", ""));

  public SeparatorHierarchy {
    if (separators == null || separators.isEmpty()) {
      throw new IllegalArgumentException("Separator hierarchy must not be empty");
    }
    separators = List.copyOf(separators);
  }

  public int size() {
    return separators.size();
  }

  public String get(int index) {
    return separators.get(index);
  }

  /** Whether {@code index} is the last position and holds the character-level separator. */
  public boolean isCharacterLevel(int index) {
    return index == separators.size() - 1 && separators.get(index).isEmpty();
  }
}
