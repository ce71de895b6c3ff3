package com.scholary.wordclip.job;

import com.scholary.wordclip.config.RunSettings;
import com.scholary.wordclip.service.ClipRunResult;
import java.time.Instant;

/**
 * Represents an async clip job.
 *
 * <p>Tracks the job's state, progress, and result. Written by the job thread and read by request
 * threads, so the mutable fields are volatile.
 */
public class ClipJob {

  private final String jobId;
  private final RunSettings settings;
  private final Instant createdAt;

  private volatile JobStatus status;
  private volatile int progress; // 0-100
  private volatile String phase;
  private volatile ClipRunResult result;
  private volatile String error;

  public ClipJob(String jobId, RunSettings settings) {
    this.jobId = jobId;
    this.settings = settings;
    this.createdAt = Instant.now();
    this.status = JobStatus.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public RunSettings getSettings() {
    return settings;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  public void setStatus(JobStatus status) {
    this.status = status;
  }

  public int getProgress() {
    return progress;
  }

  public void setProgress(int progress) {
    this.progress = progress;
  }

  public String getPhase() {
    return phase;
  }

  public void setPhase(String phase) {
    this.phase = phase;
  }

  public ClipRunResult getResult() {
    return result;
  }

  public void setResult(ClipRunResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
