package com.flamingo.ai.opsguru.service.rag.pipeline;

/** One step of the answering pipeline. */
public interface PipelineStage {

  /** Short name used in logs, metrics and error entries. */
  String name();

  /**
   * Computes this stage's contribution from the current state.
   *
   * @param state state produced by the previous stages
   * @return the fields this stage sets, plus any diagnostics
   */
  StateUpdate apply(AgentState state);
}
