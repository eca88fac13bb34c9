package com.flamingo.ai.summarizer.service.summary.chunking;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A structural region of the text that should not be split internally when avoidable.
 *
 * <p>Patterns are evaluated highest priority first. A fenced code block outranks list items, and
 * list items outrank markdown headers, so a {@code #} comment inside a code fence is never taken
 * for a heading.
 *
 * @param name short label used in log output
 * @param matcher the region pattern
 * @param priority evaluation rank, higher first
 */
public record SpecialPattern(String name, Pattern matcher, int priority) {

  public static final SpecialPattern CODE_BLOCK =
      new SpecialPattern("code-block", Pattern.compile("```[\\s\\S]*?```", Pattern.MULTILINE), 20);

  public static final SpecialPattern BULLET_LIST_ITEM =
      new SpecialPattern(
          "bullet-list", Pattern.compile("^\\s*[-*+]\\s+.+$", Pattern.MULTILINE), 15);

  public static final SpecialPattern NUMBERED_LIST_ITEM =
      new SpecialPattern(
          "numbered-list", Pattern.compile("^\\s*\\d+\\.\\s+.+$", Pattern.MULTILINE), 15);

  public static final SpecialPattern HEADER =
      new SpecialPattern("header", Pattern.compile("^\\s*(#{1,6})\\s+.+$", Pattern.MULTILINE), 10);

  /** Evaluation order: descending priority, declaration order among equals. */
  public static final Comparator<SpecialPattern> BY_PRIORITY =
      Comparator.comparingInt(SpecialPattern::priority).reversed();

  /** Headers, code blocks, bullet lists and numbered lists. */
  public static List<SpecialPattern> defaults() {
    return List.of(HEADER, CODE_BLOCK, BULLET_LIST_ITEM, NUMBERED_LIST_ITEM);
  }
}
