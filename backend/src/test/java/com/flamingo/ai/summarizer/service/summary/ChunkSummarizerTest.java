package com.flamingo.ai.summarizer.service.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.summarizer.exception.LlmServiceException;
import com.flamingo.ai.summarizer.service.summary.backend.GenerationBackend;
import com.flamingo.ai.summarizer.service.summary.backend.SimulatedGenerationBackend;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkSummarizer Tests")
class ChunkSummarizerTest {

  @Mock private GenerationBackend backend;

  private ExecutorService callExecutor;
  private MeterRegistry meterRegistry;
  private ChunkSummarizer summarizer;

  @BeforeEach
  void setUp() {
    callExecutor = Executors.newCachedThreadPool();
    meterRegistry = new SimpleMeterRegistry();
    summarizer = summarizerWithTimeout(backend, Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() {
    callExecutor.shutdownNow();
  }

  private ChunkSummarizer summarizerWithTimeout(
      GenerationBackend generationBackend, Duration timeout) {
    TimeLimiter timeLimiter =
        TimeLimiter.of(
            TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build());
    return new ChunkSummarizer(generationBackend, timeLimiter, callExecutor, meterRegistry);
  }

  private String summarizeWithoutCancellation(String text) {
    return summarizer.summarize(text, "{{content}}", Map.of(), CancellationSignal.none());
  }

  private double backendCalls(String outcome) {
    return meterRegistry.counter("summary.backend.calls", "outcome", outcome).count();
  }

  @Nested
  @DisplayName("Prompt assembly")
  class PromptAssembly {

    @Test
    @DisplayName("should substitute content and variables into the template")
    void shouldSubstituteContentAndVariables() {
      when(backend.generate(anyString(), any())).thenReturn("A summary.");

      String result =
          summarizer.summarize(
              "Body text.",
              "Summarize {{title}}:\n{{content}}",
              Map.of("title", "Report"),
              CancellationSignal.none());

      ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
      verify(backend).generate(prompt.capture(), any());
      assertThat(prompt.getValue()).isEqualTo("Summarize Report:\nBody text.");
      assertThat(result).isEqualTo("A summary.");
      assertThat(backendCalls("success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should let the text win over a caller variable named content")
    void shouldPreferTextOverContentVariable() {
      String prompt =
          ChunkSummarizer.assemblePrompt("real", "{{content}}", Map.of("content", "fake"));

      assertThat(prompt).isEqualTo("real");
    }

    @Test
    @DisplayName("should append the text when the template has no content placeholder")
    void shouldAppendText_whenNoContentPlaceholder() {
      String prompt = ChunkSummarizer.assemblePrompt("Body.", "Summarize {{missing}}.", Map.of());

      assertThat(prompt).isEqualTo("Summarize {{missing}}.\n\nBody.");
    }

    @Test
    @DisplayName("should use a generic instruction for a blank template")
    void shouldUseGenericInstruction_whenTemplateBlank() {
      assertThat(ChunkSummarizer.assemblePrompt("Body.", " ", null))
          .isEqualTo("Summarize the following text:\n\nBody.");
    }
  }

  @Nested
  @DisplayName("Simulated backend")
  class Simulated {

    @Test
    @DisplayName("should return the sentinel when no backend is configured")
    void shouldReturnSentinel() {
      ChunkSummarizer simulated =
          summarizerWithTimeout(new SimulatedGenerationBackend(), Duration.ofSeconds(5));

      String result =
          simulated.summarize("Any text.", "{{content}}", Map.of(), CancellationSignal.none());

      assertThat(result).isEqualTo("[Simulated AI summary]");
      assertThat(simulated.isSimulated()).isTrue();
      assertThat(simulated.backendDescription()).isEqualTo("simulated");
      assertThat(backendCalls("simulated")).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("should wrap a backend error in LlmServiceException")
    void shouldWrapBackendError() {
      when(backend.generate(anyString(), any())).thenThrow(new IllegalStateException("HTTP 500"));

      assertThatThrownBy(() -> summarizeWithoutCancellation("text"))
          .isInstanceOf(LlmServiceException.class)
          .hasMessageContaining("HTTP 500")
          .hasCauseInstanceOf(IllegalStateException.class);
      assertThat(backendCalls("failure")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat a blank response as a failure")
    void shouldFail_whenResponseBlank() {
      when(backend.generate(anyString(), any())).thenReturn("  ");

      assertThatThrownBy(() -> summarizeWithoutCancellation("text"))
          .isInstanceOf(LlmServiceException.class)
          .hasMessageContaining("empty response");
    }

    @Test
    @DisplayName("should fail with a timed-out LlmServiceException when the call is too slow")
    void shouldTimeOut_whenBackendTooSlow() {
      when(backend.generate(anyString(), any()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(5_000);
                return "late";
              });
      ChunkSummarizer impatient = summarizerWithTimeout(backend, Duration.ofMillis(100));

      assertThatThrownBy(
              () -> impatient.summarize("text", "{{content}}", Map.of(), CancellationSignal.none()))
          .isInstanceOfSatisfying(
              LlmServiceException.class, e -> assertThat(e.isTimedOut()).isTrue());
      assertThat(backendCalls("timeout")).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Cancellation")
  class Cancellation {

    @Test
    @DisplayName("should not call the backend when already cancelled")
    void shouldSkipCall_whenAlreadyCancelled() {
      CancellationSignal signal = new CancellationSignal();
      signal.cancel();

      assertThatThrownBy(() -> summarizer.summarize("text", "{{content}}", Map.of(), signal))
          .isInstanceOf(CancellationException.class);
      verify(backend, never()).generate(anyString(), any());
    }

    @Test
    @DisplayName("should interrupt an in-flight call on cancellation")
    void shouldInterruptInFlightCall() throws Exception {
      CountDownLatch started = new CountDownLatch(1);
      CountDownLatch interrupted = new CountDownLatch(1);
      when(backend.generate(anyString(), any()))
          .thenAnswer(
              invocation -> {
                started.countDown();
                try {
                  Thread.sleep(30_000);
                } catch (InterruptedException e) {
                  interrupted.countDown();
                  throw e;
                }
                return "never";
              });
      CancellationSignal signal = new CancellationSignal();
      ExecutorService caller = Executors.newSingleThreadExecutor();
      try {
        Future<String> result =
            caller.submit(() -> summarizer.summarize("text", "{{content}}", Map.of(), signal));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        signal.cancel();

        assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(CancellationException.class);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
      } finally {
        caller.shutdownNow();
      }
    }
  }
}
