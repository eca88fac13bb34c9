package com.flamingo.ai.summarizer.service.summary.chunking;

import com.flamingo.ai.summarizer.config.SummarizerConfig;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the {@link TextChunker} preset for a piece of text.
 *
 * <p>All presets are built once from {@link SummarizerConfig} when the bean is created, so an
 * invalid size/overlap pair fails application start-up rather than the first summarization.
 */
@Component
@Slf4j
public class TextChunkerRouter {

  private final Map<ChunkingStrategy, TextChunker> chunkers = new EnumMap<>(ChunkingStrategy.class);
  private final ChunkingStrategy configuredStrategy;
  private final MarkdownDetector markdownDetector;

  public TextChunkerRouter(
      SummarizerConfig config, TokenEstimator tokenEstimator, MarkdownDetector markdownDetector) {
    SummarizerConfig.Chunking chunking = config.getChunking();
    this.configuredStrategy = chunking.getStrategy();
    this.markdownDetector = markdownDetector;

    chunkers.put(ChunkingStrategy.PROSE, build(chunking, SeparatorHierarchy.PROSE, tokenEstimator));
    chunkers.put(
        ChunkingStrategy.MARKDOWN, build(chunking, SeparatorHierarchy.MARKDOWN, tokenEstimator));
    chunkers.put(ChunkingStrategy.CODE, build(chunking, SeparatorHierarchy.CODE, tokenEstimator));
  }

  private static TextChunker build(
      SummarizerConfig.Chunking chunking,
      SeparatorHierarchy separators,
      TokenEstimator tokenEstimator) {
    return new TextChunker(
        chunking.getSize(),
        chunking.getOverlap(),
        separators,
        chunking.isKeepSeparator(),
        SpecialPattern.defaults(),
        tokenEstimator);
  }

  /**
   * Returns the chunker for {@code text} under the configured strategy.
   *
   * @param text the text about to be split
   * @return the chunker to use, never null
   */
  public TextChunker route(String text) {
    return chunker(resolve(text));
  }

  /**
   * Resolves the configured strategy for {@code text}; {@code AUTO} becomes {@code MARKDOWN} or
   * {@code PROSE}.
   */
  public ChunkingStrategy resolve(String text) {
    if (configuredStrategy != ChunkingStrategy.AUTO) {
      return configuredStrategy;
    }
    ChunkingStrategy strategy =
        markdownDetector.looksLikeMarkdown(text)
            ? ChunkingStrategy.MARKDOWN
            : ChunkingStrategy.PROSE;
    log.debug("Auto-selected {} chunking", strategy);
    return strategy;
  }

  /** The preset for a resolved strategy. */
  public TextChunker chunker(ChunkingStrategy strategy) {
    TextChunker chunker = chunkers.get(strategy);
    if (chunker == null) {
      throw new IllegalArgumentException("No chunker for unresolved strategy " + strategy);
    }
    return chunker;
  }

  /** The configured chunk size shared by every preset. */
  public int chunkSize() {
    return chunkers.get(ChunkingStrategy.PROSE).getChunkSize();
  }
}
