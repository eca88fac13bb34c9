package com.flamingo.ai.summarizer.service.summary;

import com.flamingo.ai.summarizer.exception.LlmServiceException;
import com.flamingo.ai.summarizer.service.prompt.PromptTemplates;
import com.flamingo.ai.summarizer.service.summary.backend.GenerationBackend;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Issues exactly one generation backend call for one unit of text and one prompt template.
 *
 * <p>Failures are never substituted: a failed, timed-out or empty call raises {@link
 * LlmServiceException}, and a cancelled call raises {@link CancellationException}. Retrying is left
 * to whoever drives the pipeline.
 */
@Service
@Slf4j
public class ChunkSummarizer {

  private static final String FALLBACK_INSTRUCTION = "Summarize the following text:";

  private final GenerationBackend backend;
  private final TimeLimiter timeLimiter;
  private final ExecutorService callExecutor;
  private final MeterRegistry meterRegistry;

  public ChunkSummarizer(
      GenerationBackend backend,
      TimeLimiter generationTimeLimiter,
      @Qualifier("backendCallExecutor") ExecutorService callExecutor,
      MeterRegistry meterRegistry) {
    this.backend = backend;
    this.timeLimiter = generationTimeLimiter;
    this.callExecutor = callExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Summarizes {@code text} with {@code promptTemplate}.
   *
   * @param text the content to summarize; bound to the {@code {{content}}} placeholder
   * @param promptTemplate template with {@code {{key}}} placeholders
   * @param variables values for the placeholders; unresolved placeholders are left verbatim
   * @param cancellation interrupts the in-flight call when cancelled
   * @return the generated text, or {@code "[Simulated AI summary]"} when no backend is configured
   * @throws LlmServiceException if the backend call fails, times out or returns nothing
   * @throws CancellationException if {@code cancellation} fires before the call completes
   */
  public String summarize(
      String text,
      String promptTemplate,
      Map<String, String> variables,
      CancellationSignal cancellation) {
    String prompt = assemblePrompt(text, promptTemplate, variables);

    if (backend.isSimulated()) {
      meterRegistry.counter("summary.backend.calls", "outcome", "simulated").increment();
      log.debug("No generation backend configured, returning simulated summary");
      return backend.generate(prompt, cancellation);
    }

    if (cancellation.isCancelled()) {
      throw new CancellationException("Summarization cancelled before backend call");
    }

    log.debug("Calling {} with a {}-char prompt", backend.description(), prompt.length());
    AtomicReference<Future<String>> inFlight = new AtomicReference<>();

    try (CancellationSignal.Registration ignored =
        cancellation.onCancel(() -> cancelInFlight(inFlight))) {
      String result =
          timeLimiter.executeFutureSupplier(
              () -> {
                Future<String> future =
                    callExecutor.submit(() -> backend.generate(prompt, cancellation));
                inFlight.set(future);
                if (cancellation.isCancelled()) {
                  future.cancel(true);
                }
                return future;
              });

      if (result == null || result.isBlank()) {
        meterRegistry.counter("summary.backend.calls", "outcome", "failure").increment();
        throw new LlmServiceException("Generation backend returned an empty response");
      }
      meterRegistry.counter("summary.backend.calls", "outcome", "success").increment();
      return result;

    } catch (TimeoutException e) {
      meterRegistry.counter("summary.backend.calls", "outcome", "timeout").increment();
      log.error(
          "Generation backend call timed out after {}",
          timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
      throw new LlmServiceException("Generation backend call timed out", e, true);
    } catch (CancellationException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelInFlight(inFlight);
      throw new CancellationException("Interrupted while waiting for generation backend");
    } catch (LlmServiceException e) {
      throw e;
    } catch (Exception e) {
      meterRegistry.counter("summary.backend.calls", "outcome", "failure").increment();
      log.error("Generation backend call failed: {}", e.getMessage(), e);
      throw new LlmServiceException("Generation backend call failed: " + e.getMessage(), e);
    }
  }

  /** Whether the configured backend is the simulated stand-in. */
  public boolean isSimulated() {
    return backend.isSimulated();
  }

  public String backendDescription() {
    return backend.description();
  }

  /**
   * Binds {@code text} to {@code {{content}}} and substitutes the variables. A template without a
   * content placeholder gets the text appended after a blank line.
   */
  static String assemblePrompt(String text, String promptTemplate, Map<String, String> variables) {
    String content = text != null ? text : "";
    if (promptTemplate == null || promptTemplate.isBlank()) {
      return FALLBACK_INSTRUCTION + "\n\n" + content;
    }

    Map<String, String> values = new HashMap<>();
    if (variables != null) {
      values.putAll(variables);
    }
    values.put(PromptTemplates.CONTENT, content);

    String prompt = PromptTemplates.substitute(promptTemplate, values);
    if (!PromptTemplates.hasPlaceholder(promptTemplate, PromptTemplates.CONTENT)
        && !content.isEmpty()) {
      prompt = prompt + "\n\n" + content;
    }
    return prompt;
  }

  private static void cancelInFlight(AtomicReference<Future<String>> inFlight) {
    Future<String> future = inFlight.get();
    if (future != null) {
      future.cancel(true);
    }
  }
}
