package com.flamingo.ai.summarizer.config;

import com.flamingo.ai.summarizer.service.summary.chunking.ChunkingStrategy;
import com.flamingo.ai.summarizer.service.summary.chunking.TextChunker;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the summarization pipeline. */
@Configuration
@ConfigurationProperties(prefix = "summarizer")
@Getter
@Setter
public class SummarizerConfig {

  private Chunking chunking = new Chunking();
  private Reduce reduce = new Reduce();
  private Prompts prompts = new Prompts();

  @Getter
  @Setter
  public static class Chunking {
    /** Maximum estimated tokens per chunk and per backend call. */
    private int size = TextChunker.DEFAULT_CHUNK_SIZE;

    /** Estimated tokens carried from one chunk into the next; must be smaller than size. */
    private int overlap = TextChunker.DEFAULT_CHUNK_OVERLAP;

    private boolean keepSeparator = true;

    /** Separator preset; AUTO picks markdown or prose by sampling the text. */
    private ChunkingStrategy strategy = ChunkingStrategy.AUTO;
  }

  @Getter
  @Setter
  public static class Reduce {
    /** Maximum concurrent backend calls during the map step. */
    private int concurrency = 4;

    /** Threads shared by all pipelines for running map-step tasks. */
    private int executorThreads = 16;

    private Duration callTimeout = Duration.ofSeconds(120);

    /** Upper bound on reduce rounds before the pipeline gives up. */
    private int maxRounds = 10;
  }

  @Getter
  @Setter
  public static class Prompts {
    /** Optional directory holding {@code <name>.md} templates; classpath defaults otherwise. */
    private String directory;

    private String chunkTemplate = "chunk_summary_prompt";
    private String finalTemplate = "final_summary_prompt";
    private String videoFinalTemplate = "final_summary_prompt_video";
  }
}
