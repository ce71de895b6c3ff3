package com.scholary.wordclip.api;

import com.scholary.wordclip.job.ClipJob;
import com.scholary.wordclip.job.JobStatus;
import com.scholary.wordclip.service.ClipRunResult;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
public record JobStatusResponse(
    String jobId,
    JobStatus status,
    int progress,
    String phase,
    ClipRunResult result,
    String error) {

  public static JobStatusResponse from(ClipJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getProgress(),
        job.getPhase(),
        job.getResult(),
        job.getError());
  }
}
