package com.flamingo.ai.summarizer.service.summary.chunking;

import org.springframework.stereotype.Component;

/**
 * Heuristic token sizing that never calls an external tokenizer.
 *
 * <p>Words of three or more characters weigh 1.0, shorter words 0.5, and every punctuation or
 * symbol character another 0.5. The weighted sum is multiplied by a 1.2 safety factor and
 * truncated, so the estimate errs on the high side of what the generation backend will count.
 */
@Component
public class TokenEstimator {

  /** Rough number of characters per estimated token, used for character-based sizing. */
  public static final int ESTIMATED_CHARS_PER_TOKEN = 4;

  private static final double LONG_WORD_WEIGHT = 1.0;
  private static final double SHORT_WORD_WEIGHT = 0.5;
  private static final double PUNCTUATION_WEIGHT = 0.5;
  private static final double SAFETY_FACTOR = 1.2;
  private static final int SHORT_WORD_LENGTH = 3;

  /**
   * Estimates the token count of {@code text}.
   *
   * @param text any text, may be null
   * @return the estimated token count, 0 for null or empty text
   */
  public int estimate(String text) {
    return toTokens(weigh(text));
  }

  /**
   * Returns the weighted word and punctuation count of {@code text} before the safety factor is
   * applied. Weights of texts joined by whitespace add up exactly.
   */
  public double weigh(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }

    int longWords = 0;
    int shortWords = 0;
    int punctuation = 0;
    int wordLength = 0;

    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (isWordBreak(c)) {
        if (wordLength > 0) {
          if (wordLength < SHORT_WORD_LENGTH) {
            shortWords++;
          } else {
            longWords++;
          }
          wordLength = 0;
        }
        continue;
      }
      wordLength++;
      if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c)) {
        punctuation++;
      }
    }
    if (wordLength > 0) {
      if (wordLength < SHORT_WORD_LENGTH) {
        shortWords++;
      } else {
        longWords++;
      }
    }

    return longWords * LONG_WORD_WEIGHT
        + shortWords * SHORT_WORD_WEIGHT
        + punctuation * PUNCTUATION_WEIGHT;
  }

  /** Converts a {@link #weigh} result into an estimate. */
  public int toTokens(double weight) {
    return (int) (weight * SAFETY_FACTOR);
  }

  private static boolean isWordBreak(char c) {
    return c == ' ' || c == '\n' || c == '\r' || c == '\t';
  }
}
