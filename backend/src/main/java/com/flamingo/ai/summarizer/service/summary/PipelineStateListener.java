package com.flamingo.ai.summarizer.service.summary;

/** Observer of pipeline state transitions, called on the pipeline's own thread. */
@FunctionalInterface
public interface PipelineStateListener {

  PipelineStateListener NO_OP = (from, to) -> {};

  void onTransition(ReductionState from, ReductionState to);
}
