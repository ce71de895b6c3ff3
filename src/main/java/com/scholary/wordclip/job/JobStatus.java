package com.scholary.wordclip.job;

/** Lifecycle of an asynchronous clip job. */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
