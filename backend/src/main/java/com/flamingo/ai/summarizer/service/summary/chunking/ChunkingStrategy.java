package com.flamingo.ai.summarizer.service.summary.chunking;

/** Separator preset used to build a {@link TextChunker}. */
public enum ChunkingStrategy {
  PROSE,
  MARKDOWN,
  CODE,
  /** Markdown preset when the text looks like markdown, prose preset otherwise. */
  AUTO
}
