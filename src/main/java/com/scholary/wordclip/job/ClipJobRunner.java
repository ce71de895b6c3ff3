package com.scholary.wordclip.job;

import com.scholary.wordclip.logging.StructuredLogger;
import com.scholary.wordclip.service.ClipPipeline;
import com.scholary.wordclip.service.ClipRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs accepted clip jobs on the {@code jobExecutor} pool.
 *
 * <p>Lives in its own bean so that {@code @Async} goes through the Spring proxy; a call from the
 * controller to one of its own methods would run synchronously.
 */
@Service
public class ClipJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipJobRunner.class);

  private final ClipPipeline pipeline;
  private final JobRepository jobRepository;
  private final StructuredLogger structuredLogger;

  public ClipJobRunner(ClipPipeline pipeline, JobRepository jobRepository) {
    this.pipeline = pipeline;
    this.jobRepository = jobRepository;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  @Async("jobExecutor")
  public void process(ClipJob job) {
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(JobStatus.PROCESSING);
      jobRepository.save(job);

      ClipRunResult result =
          pipeline.run(
              job.getSettings(),
              (percent, phase) -> {
                job.setProgress(percent);
                job.setPhase(phase);
                structuredLogger.logJobProgress(job.getJobId(), percent, phase);
              });

      job.setResult(result);
      job.setProgress(100);
      job.setPhase("done");
      job.setStatus(JobStatus.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {}", job.getJobId());
    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(JobStatus.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    }
  }
}
