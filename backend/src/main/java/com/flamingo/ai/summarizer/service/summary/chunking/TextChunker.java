package com.flamingo.ai.summarizer.service.summary.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits text into ordered chunks whose token estimate stays within {@code chunkSize}.
 *
 * <p>The algorithm, in order:
 *
 * <ol>
 *   <li>Text that already fits is returned whole.
 *   <li>Structural regions ({@link SpecialPattern}) are tried highest priority first. The first
 *       pattern with a match splits the text into matched regions and the non-blank text between
 *       them; consecutive segments are then merged back up to {@code chunkSize}, and segments that
 *       alone exceed it are split by the separator hierarchy.
 *   <li>Otherwise the {@link SeparatorHierarchy} is walked strongest first. The first separator
 *       that yields more than one fragment wins; fragments over budget are split again with the
 *       weaker separators that follow it.
 *   <li>The trailing character-level separator slices the text into fixed-width pieces of {@code
 *       chunkSize * 4} characters, one less where the cut would split a surrogate pair. Such
 *       pieces are bounded by length, not by estimate.
 *   <li>Every chunk after the first is prefixed with the last {@code chunkOverlap * 4} characters
 *       of the chunk before it, minus a leading low surrogate.
 * </ol>
 *
 * <p>An atomic unit that no remaining separator can break is emitted as a single oversized chunk.
 * Instances are immutable and safe to share between threads.
 */
@Slf4j
@Getter
public class TextChunker {

  public static final int DEFAULT_CHUNK_SIZE = 3000;
  public static final int DEFAULT_CHUNK_OVERLAP = 500;

  private final int chunkSize;
  private final int chunkOverlap;
  private final SeparatorHierarchy separators;
  private final boolean keepSeparator;
  private final List<SpecialPattern> specialPatterns;
  private final TokenEstimator tokenEstimator;

  /**
   * Creates a chunker.
   *
   * @throws IllegalArgumentException if {@code chunkSize <= 0}, {@code chunkOverlap < 0} or {@code
   *     chunkOverlap >= chunkSize}
   */
  public TextChunker(
      int chunkSize,
      int chunkOverlap,
      SeparatorHierarchy separators,
      boolean keepSeparator,
      List<SpecialPattern> specialPatterns,
      TokenEstimator tokenEstimator) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
    }
    if (chunkOverlap < 0) {
      throw new IllegalArgumentException("Chunk overlap must be non-negative: " + chunkOverlap);
    }
    if (chunkOverlap >= chunkSize) {
      throw new IllegalArgumentException(
          "Chunk overlap ("
              + chunkOverlap
              + ") must be smaller than chunk size ("
              + chunkSize
              + ")");
    }
    this.chunkSize = chunkSize;
    this.chunkOverlap = chunkOverlap;
    this.separators = separators != null ? separators : SeparatorHierarchy.PROSE;
    this.keepSeparator = keepSeparator;
    this.specialPatterns =
        specialPatterns == null
            ? List.of()
            : specialPatterns.stream().sorted(SpecialPattern.BY_PRIORITY).toList();
    this.tokenEstimator = tokenEstimator != null ? tokenEstimator : new TokenEstimator();
  }

  /** Chunker tuned for prose, keeping separators and the default structural patterns. */
  public static TextChunker forProse(int chunkSize, int chunkOverlap) {
    return new TextChunker(
        chunkSize,
        chunkOverlap,
        SeparatorHierarchy.PROSE,
        true,
        SpecialPattern.defaults(),
        new TokenEstimator());
  }

  /** Chunker that prefers markdown heading boundaries over generic breaks. */
  public static TextChunker forMarkdown(int chunkSize, int chunkOverlap) {
    return new TextChunker(
        chunkSize,
        chunkOverlap,
        SeparatorHierarchy.MARKDOWN,
        true,
        SpecialPattern.defaults(),
        new TokenEstimator());
  }

  /** Chunker that prefers statement and block delimiters. */
  public static TextChunker forCode(int chunkSize, int chunkOverlap) {
    return new TextChunker(
        chunkSize,
        chunkOverlap,
        SeparatorHierarchy.CODE,
        true,
        SpecialPattern.defaults(),
        new TokenEstimator());
  }

  /**
   * Splits {@code text} into ordered chunk strings, overlap included.
   *
   * @param text the source text, may be null
   * @return chunks in document order; empty for null or empty input
   */
  public List<String> splitText(String text) {
    return split(text).stream().map(Chunk::text).toList();
  }

  /**
   * Splits {@code text} into ordered {@link Chunk}s carrying their index, overlap length and token
   * estimate.
   *
   * @param text the source text, may be null
   * @return chunks in document order; empty for null or empty input
   */
  public List<Chunk> split(String text) {
    if (text == null || text.isEmpty()) {
      log.warn("Empty text provided to TextChunker, returning no chunks");
      return List.of();
    }

    int estimate = tokenEstimator.estimate(text);
    if (estimate <= chunkSize) {
      log.debug("Text fits in a single chunk ({} chars, ~{} tokens)", text.length(), estimate);
      return List.of(new Chunk(0, text, 0, estimate));
    }

    log.info(
        "Splitting text of {} chars (~{} tokens) into chunks (max tokens: {}, overlap: {})",
        text.length(),
        estimate,
        chunkSize,
        chunkOverlap);

    List<String> segments = splitBySpecialPatterns(text);
    List<String> pieces;
    if (!segments.isEmpty()) {
      log.debug("Special patterns produced {} initial segments", segments.size());
      pieces = mergeSegments(segments);
    } else {
      pieces = splitBySeparators(text, 0);
    }

    List<Chunk> chunks = applyOverlap(pieces);
    log.info("Produced {} chunks", chunks.size());
    return chunks;
  }

  // ---- structural regions ----

  private List<String> splitBySpecialPatterns(String text) {
    List<String> result = new ArrayList<>();

    for (SpecialPattern pattern : specialPatterns) {
      Matcher matcher = pattern.matcher().matcher(text);
      int lastEnd = 0;
      int matches = 0;

      while (matcher.find()) {
        matches++;
        if (matcher.start() > lastEnd) {
          addIfNotBlank(result, text.substring(lastEnd, matcher.start()));
        }
        result.add(matcher.group());
        lastEnd = matcher.end();
      }

      if (matches == 0) {
        continue;
      }
      if (lastEnd < text.length()) {
        addIfNotBlank(result, text.substring(lastEnd));
      }

      log.debug("Found {} matches for pattern '{}'", matches, pattern.name());
      if (!result.isEmpty()) {
        return result;
      }
    }
    return result;
  }

  private static void addIfNotBlank(List<String> target, String segment) {
    if (!segment.isBlank()) {
      target.add(segment);
    }
  }

  /**
   * Packs consecutive segments into pieces of at most {@code chunkSize}. Segments are joined with a
   * newline, since every gap dropped between them was whitespace.
   *
   * <p>The running size is the unrounded {@link TokenEstimator#weigh weight} of the joined text, so
   * a merged piece never estimates above {@code chunkSize}.
   */
  private List<String> mergeSegments(List<String> segments) {
    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    double currentWeight = 0;

    for (String segment : segments) {
      double segmentWeight = tokenEstimator.weigh(segment);

      if (tokenEstimator.toTokens(segmentWeight) > chunkSize) {
        if (current.length() > 0) {
          pieces.add(current.toString());
          current.setLength(0);
          currentWeight = 0;
        }
        pieces.addAll(splitBySeparators(segment, 0));
      } else if (current.length() > 0
          && tokenEstimator.toTokens(currentWeight + segmentWeight) > chunkSize) {
        pieces.add(current.toString());
        current.setLength(0);
        current.append(segment);
        currentWeight = segmentWeight;
      } else {
        if (current.length() > 0) {
          current.append('\n');
        }
        current.append(segment);
        currentWeight += segmentWeight;
      }
    }

    if (current.length() > 0) {
      pieces.add(current.toString());
    }
    return pieces;
  }

  // ---- separator hierarchy ----

  private List<String> splitBySeparators(String text, int fromIndex) {
    for (int i = fromIndex; i < separators.size(); i++) {
      String separator = separators.get(i);
      boolean characterLevel = separator.isEmpty();
      if (characterLevel && !separators.isCharacterLevel(i)) {
        continue;
      }

      List<String> fragments =
          characterLevel ? splitByCharacters(text) : splitOnSeparator(text, separator);
      if (fragments.size() <= 1) {
        continue;
      }

      log.debug(
          "Split into {} fragments using separator '{}'", fragments.size(), printable(separator));

      List<String> result = new ArrayList<>();
      for (String fragment : fragments) {
        if (i + 1 < separators.size() && tokenEstimator.estimate(fragment) > chunkSize) {
          result.addAll(splitBySeparators(fragment, i + 1));
        } else {
          result.add(fragment);
        }
      }
      return result;
    }

    log.debug("No separator could split a {}-char fragment, keeping it whole", text.length());
    return List.of(text);
  }

  private List<String> splitOnSeparator(String text, String separator) {
    List<String> fragments = new ArrayList<>();
    int start = 0;
    int found;

    while ((found = text.indexOf(separator, start)) >= 0) {
      int end = keepSeparator ? found + separator.length() : found;
      addIfNotEmpty(fragments, text.substring(start, end));
      start = found + separator.length();
    }
    addIfNotEmpty(fragments, text.substring(start));
    return fragments;
  }

  private static void addIfNotEmpty(List<String> target, String fragment) {
    if (!fragment.isEmpty()) {
      target.add(fragment);
    }
  }

  private List<String> splitByCharacters(String text) {
    int width = chunkSize * TokenEstimator.ESTIMATED_CHARS_PER_TOKEN;
    List<String> slices = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(start + width, text.length());
      if (splitsSurrogatePair(text, end) && end - 1 > start) {
        end--;
      }
      slices.add(text.substring(start, end));
      start = end;
    }
    return slices;
  }

  /** Whether cutting {@code text} at {@code index} would separate a surrogate pair. */
  private static boolean splitsSurrogatePair(String text, int index) {
    return index > 0
        && index < text.length()
        && Character.isHighSurrogate(text.charAt(index - 1))
        && Character.isLowSurrogate(text.charAt(index));
  }

  // ---- overlap ----

  private List<Chunk> applyOverlap(List<String> pieces) {
    int overlapChars = chunkOverlap * TokenEstimator.ESTIMATED_CHARS_PER_TOKEN;
    List<Chunk> chunks = new ArrayList<>(pieces.size());

    for (int i = 0; i < pieces.size(); i++) {
      String piece = pieces.get(i);
      String overlap = "";
      if (i > 0 && overlapChars > 0) {
        String previous = pieces.get(i - 1);
        int from = previous.length() - Math.min(overlapChars, previous.length());
        if (splitsSurrogatePair(previous, from)) {
          from++;
        }
        overlap = previous.substring(from);
      }
      String text = overlap + piece;
      chunks.add(new Chunk(i, text, overlap.length(), tokenEstimator.estimate(text)));
    }
    return chunks;
  }

  private static String printable(String separator) {
    return separator.replace("\n", "\\n");
  }
}
