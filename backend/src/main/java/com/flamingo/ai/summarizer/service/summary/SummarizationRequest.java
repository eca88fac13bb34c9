package com.flamingo.ai.summarizer.service.summary;

import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;

/**
 * Input of one {@link ReduceCoordinator#summarize(SummarizationRequest)} call.
 *
 * @param text the extracted document text
 * @param promptName name of the final prompt template; the configured default when null
 * @param variables caller variables substituted into the prompts (e.g. {@code title})
 * @param cancellation cancellation signal propagated to every in-flight backend call
 * @param stateListener observer of state transitions
 */
@Builder
public record SummarizationRequest(
    String text,
    String promptName,
    Map<String, String> variables,
    CancellationSignal cancellation,
    PipelineStateListener stateListener) {

  public SummarizationRequest {
    variables =
        variables == null
            ? Map.of()
            : variables.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
    stateListener = stateListener == null ? PipelineStateListener.NO_OP : stateListener;
  }

  public static SummarizationRequest of(
      String text, String promptName, Map<String, String> variables) {
    return new SummarizationRequest(text, promptName, variables, null, null);
  }
}
