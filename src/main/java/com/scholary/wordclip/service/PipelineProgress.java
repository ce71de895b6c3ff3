package com.scholary.wordclip.service;

/** Receives coarse progress updates from a running pipeline. */
@FunctionalInterface
public interface PipelineProgress {

  PipelineProgress NONE = (percent, phase) -> {};

  void update(int percent, String phase);
}
