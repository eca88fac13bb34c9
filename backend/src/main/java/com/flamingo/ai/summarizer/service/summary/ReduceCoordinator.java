package com.flamingo.ai.summarizer.service.summary;

import com.flamingo.ai.summarizer.config.SummarizerConfig;
import com.flamingo.ai.summarizer.exception.LlmServiceException;
import com.flamingo.ai.summarizer.exception.SummarizationCancelledException;
import com.flamingo.ai.summarizer.exception.SummarizationException;
import com.flamingo.ai.summarizer.service.prompt.PromptTemplateProvider;
import com.flamingo.ai.summarizer.service.summary.chunking.Chunk;
import com.flamingo.ai.summarizer.service.summary.chunking.ChunkingStrategy;
import com.flamingo.ai.summarizer.service.summary.chunking.TextChunkerRouter;
import com.flamingo.ai.summarizer.service.summary.chunking.TokenEstimator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Summarizes a whole document through chunked map-reduce.
 *
 * <p>Text that fits one backend call is summarized directly with the final prompt. Longer text is
 * split by {@link TextChunkerRouter}, each chunk is summarized with the chunk prompt under bounded
 * concurrency (map), and the ordered summaries are concatenated. While the concatenation is still
 * too large it is split and summarized again (reduce). One last call with the final prompt
 * produces the returned summary.
 *
 * <p>Any backend failure fails the whole run with {@link SummarizationException}; a partial
 * summary is never returned. When the backend is simulated, the first simulated answer is returned
 * without further calls.
 */
@Service
@Slf4j
public class ReduceCoordinator {

  private final TextChunkerRouter chunkerRouter;
  private final TokenEstimator tokenEstimator;
  private final ChunkSummarizer chunkSummarizer;
  private final PromptTemplateProvider promptTemplateProvider;
  private final SummarizerConfig summarizerConfig;
  private final ExecutorService mapExecutor;
  private final MeterRegistry meterRegistry;

  public ReduceCoordinator(
      TextChunkerRouter chunkerRouter,
      TokenEstimator tokenEstimator,
      ChunkSummarizer chunkSummarizer,
      PromptTemplateProvider promptTemplateProvider,
      SummarizerConfig summarizerConfig,
      @Qualifier("chunkSummaryExecutor") ExecutorService mapExecutor,
      MeterRegistry meterRegistry) {
    if (summarizerConfig.getReduce().getConcurrency() < 1) {
      throw new IllegalArgumentException(
          "Map concurrency must be positive: " + summarizerConfig.getReduce().getConcurrency());
    }
    this.chunkerRouter = chunkerRouter;
    this.tokenEstimator = tokenEstimator;
    this.chunkSummarizer = chunkSummarizer;
    this.promptTemplateProvider = promptTemplateProvider;
    this.summarizerConfig = summarizerConfig;
    this.mapExecutor = mapExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Summarizes {@code text} with the final prompt {@code promptName}.
   *
   * @see #summarize(SummarizationRequest)
   */
  @Timed(value = "summary.pipeline", description = "Time to summarize one document")
  public String summarize(String text, String promptName, Map<String, String> variables) {
    return summarize(SummarizationRequest.of(text, promptName, variables));
  }

  /**
   * Runs one summarization pipeline.
   *
   * @param request text, prompt name, variables, cancellation signal and state listener
   * @return the final summary, the simulated sentinel, or {@code ""} for empty input
   * @throws SummarizationException if any backend call fails, or the reduce step cannot make the
   *     summaries fit
   * @throws SummarizationCancelledException if the request's cancellation signal fires
   */
  @Timed(value = "summary.pipeline", description = "Time to summarize one document")
  public String summarize(SummarizationRequest request) {
    return new PipelineRun(request).execute();
  }

  /** Mutable state of one invocation; never shared between invocations. */
  private final class PipelineRun {

    private final SummarizationRequest request;
    private final CancellationSignal cancellation;
    private volatile ReductionState state = ReductionState.IDLE;

    private PipelineRun(SummarizationRequest request) {
      this.request = request;
      this.cancellation = request.cancellation();
    }

    String execute() {
      try {
        return run();
      } catch (SummarizationException e) {
        fail();
        throw e;
      } catch (CancellationException e) {
        ReductionState failedIn = state;
        fail();
        throw new SummarizationCancelledException(failedIn);
      } catch (LlmServiceException e) {
        ReductionState failedIn = state;
        fail();
        if (cancellation.isCancelled()) {
          throw new SummarizationCancelledException(failedIn);
        }
        log.error("Summarization failed during {}: {}", failedIn, e.getMessage());
        throw new SummarizationException(
            failedIn, "Backend failure during " + failedIn + ": " + e.getMessage(), e);
      }
    }

    private String run() {
      moveTo(ReductionState.ESTIMATING);
      String text = request.text();

      if (text == null || text.isBlank()) {
        log.warn("Cannot summarize empty text");
        countPath("empty");
        moveTo(ReductionState.DONE);
        return "";
      }

      String finalPromptName =
          request.promptName() != null && !request.promptName().isBlank()
              ? request.promptName()
              : summarizerConfig.getPrompts().getFinalTemplate();
      String finalTemplate = promptTemplateProvider.loadTemplate(finalPromptName);
      int chunkSize = chunkerRouter.chunkSize();
      int estimate = tokenEstimator.estimate(text);

      if (estimate <= chunkSize) {
        log.info(
            "Text fits in one call ({} chars, ~{} tokens), summarizing directly",
            text.length(),
            estimate);
        countPath("direct");
        moveTo(ReductionState.DIRECT_SUMMARIZING);
        String summary = call(text, finalTemplate, request.variables());
        moveTo(ReductionState.DONE);
        return summary;
      }

      log.info(
          "Text of {} chars (~{} tokens) exceeds {} tokens, using chunked summarization",
          text.length(),
          estimate,
          chunkSize);
      countPath("chunked");
      String chunkTemplate =
          promptTemplateProvider.loadTemplate(summarizerConfig.getPrompts().getChunkTemplate());

      moveTo(ReductionState.CHUNKING);
      // reduce rounds reuse the strategy resolved for the source text
      ChunkingStrategy strategy = chunkerRouter.resolve(text);
      List<Chunk> chunks = chunkerRouter.chunker(strategy).split(text);
      log.info("Text split into {} chunks", chunks.size());

      moveTo(ReductionState.MAP_SUMMARIZING);
      if (chunkSummarizer.isSimulated()) {
        String simulated = call(chunks.get(0).text(), chunkTemplate, request.variables());
        log.info("Generation backend is simulated, skipping remaining chunks");
        moveTo(ReductionState.DONE);
        return simulated;
      }

      ReductionRound round = mapStep(chunks, 1, chunkTemplate);
      String combined = round.combined();
      int maxRounds = summarizerConfig.getReduce().getMaxRounds();

      while (tokenEstimator.estimate(combined) > chunkSize) {
        moveTo(ReductionState.REDUCE_MERGING);
        if (round.round() > maxRounds) {
          throw new SummarizationException(
              state,
              "Chunk summaries still exceed "
                  + chunkSize
                  + " tokens after "
                  + maxRounds
                  + " reduce rounds");
        }
        meterRegistry.counter("summary.reduce.rounds").increment();
        List<Chunk> secondary = chunkerRouter.chunker(strategy).split(combined);
        log.info(
            "Reduce round {}: {} summaries re-split into {} chunks",
            round.round(),
            round.summaries().size(),
            secondary.size());

        moveTo(ReductionState.MAP_SUMMARIZING);
        round = mapStep(secondary, round.round() + 1, chunkTemplate);
        combined = round.combined();
      }

      moveTo(ReductionState.FINAL_SUMMARIZING);
      log.info("Generating final summary from {} chunk summaries", round.summaries().size());
      String summary = call(combined, finalTemplate, request.variables());
      moveTo(ReductionState.DONE);
      return summary;
    }

    /**
     * Summarizes every chunk with at most {@code concurrency} calls in flight. Results are
     * collected in completion order and reordered by chunk index.
     */
    private ReductionRound mapStep(List<Chunk> chunks, int roundNumber, String chunkTemplate) {
      int concurrency = summarizerConfig.getReduce().getConcurrency();
      int total = chunks.size();
      CompletionService<ChunkSummary> completion = new ExecutorCompletionService<>(mapExecutor);
      List<Future<ChunkSummary>> inFlight = new CopyOnWriteArrayList<>();
      List<ChunkSummary> summaries = new ArrayList<>(total);
      int submitted = 0;

      try (CancellationSignal.Registration ignored =
          cancellation.onCancel(() -> cancelAll(inFlight))) {
        while (submitted < total && submitted < concurrency) {
          inFlight.add(completion.submit(mapTask(chunks.get(submitted), total, chunkTemplate)));
          submitted++;
        }
        while (summaries.size() < total) {
          cancellation.throwIfCancelled(state);
          Future<ChunkSummary> done = completion.take();
          inFlight.remove(done);
          summaries.add(done.get());
          if (submitted < total) {
            inFlight.add(completion.submit(mapTask(chunks.get(submitted), total, chunkTemplate)));
            submitted++;
          }
        }
      } catch (ExecutionException e) {
        cancelAll(inFlight);
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
          throw runtime;
        }
        throw new LlmServiceException("Chunk summarization failed: " + cause, cause);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelAll(inFlight);
        throw new CancellationException("Interrupted while waiting for chunk summaries");
      } catch (RuntimeException e) {
        cancelAll(inFlight);
        throw e;
      }

      meterRegistry.counter("summary.map.chunks").increment(total);
      log.debug("Map round {} summarized {} chunks", roundNumber, total);
      return new ReductionRound(roundNumber, summaries);
    }

    private Callable<ChunkSummary> mapTask(
        Chunk chunk, int total, String chunkTemplate) {
      Map<String, String> variables = chunkVariables(chunk.index(), total);
      return () -> {
        log.debug("Summarizing chunk {}/{}", chunk.index() + 1, total);
        try {
          String summary = call(chunk.text(), chunkTemplate, variables);
          return new ChunkSummary(chunk.index(), summary);
        } catch (LlmServiceException e) {
          log.error("Chunk {}/{} failed: {}", chunk.index() + 1, total, e.getMessage());
          throw e;
        }
      };
    }

    /** Caller variables plus positional context; positional values win on name clashes. */
    private Map<String, String> chunkVariables(int index, int total) {
      Map<String, String> variables = new HashMap<>(request.variables());
      variables.put("chunk_num", String.valueOf(index + 1));
      variables.put("total_chunks", String.valueOf(total));
      variables.put("chunk_context", chunkContext(index, total));
      return variables;
    }

    private String call(String content, String template, Map<String, String> variables) {
      cancellation.throwIfCancelled(state);
      return chunkSummarizer.summarize(content, template, variables, cancellation);
    }

    private void moveTo(ReductionState next) {
      ReductionState previous = state;
      state = next;
      log.debug("Pipeline state {} -> {}", previous, next);
      request.stateListener().onTransition(previous, next);
    }

    private void fail() {
      if (!state.isTerminal()) {
        meterRegistry
            .counter("summary.pipeline.failures", "state", state.name().toLowerCase())
            .increment();
        moveTo(ReductionState.FAILED);
      }
    }

    private void countPath(String path) {
      meterRegistry
          .counter(
              "summary.pipeline.path",
              "path",
              path,
              "mode",
              chunkSummarizer.isSimulated() ? "simulated" : "live")
          .increment();
    }
  }

  static String chunkContext(int index, int total) {
    if (total <= 1) {
      return "";
    }
    String position;
    if (index == 0) {
      position = "This is the beginning of the document.";
    } else if (index == total - 1) {
      position = "This is the end of the document.";
    } else {
      position = "This is a middle section of the document.";
    }
    return "This is part " + (index + 1) + " of " + total + ". " + position;
  }

  private static void cancelAll(List<Future<ChunkSummary>> futures) {
    for (Future<ChunkSummary> future : futures) {
      future.cancel(true);
    }
  }
}
