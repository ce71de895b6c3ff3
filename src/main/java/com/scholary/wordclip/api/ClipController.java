package com.scholary.wordclip.api;

import com.scholary.wordclip.cache.ArtifactCache;
import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.config.RunSettings;
import com.scholary.wordclip.config.RunSettingsResolver;
import com.scholary.wordclip.job.ClipJob;
import com.scholary.wordclip.job.ClipJobRunner;
import com.scholary.wordclip.job.JobRepository;
import com.scholary.wordclip.job.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for clip jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a clip job (returns a job id immediately)
 *   <li>Job status polling
 *   <li>Reading and dropping the cached artifacts of an input
 * </ul>
 *
 * <p>Settings are resolved and validated before a job is accepted, so a bad request fails with
 * 400 instead of a FAILED job. A job the executor cannot queue is stored as FAILED and answered
 * with 503.
 */
@RestController
@Tag(name = "Clips", description = "Keyword and semantic clip extraction API")
public class ClipController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipController.class);

  private final RunSettingsResolver settingsResolver;
  private final JobRepository jobRepository;
  private final ClipJobRunner jobRunner;
  private final ArtifactCache artifactCache;

  public ClipController(
      RunSettingsResolver settingsResolver,
      JobRepository jobRepository,
      ClipJobRunner jobRunner,
      ArtifactCache artifactCache) {
    this.settingsResolver = settingsResolver;
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
    this.artifactCache = artifactCache;
  }

  @PostMapping("/api/clips")
  @Operation(
      summary = "Start clip job",
      description = "Validate settings, start an asynchronous clip job and return its id")
  public ResponseEntity<AsyncJobResponse> createClips(@Valid @RequestBody ClipRequest request) {
    RunSettings settings = settingsResolver.resolve(request.toOverrides());

    ClipJob job = new ClipJob(UUID.randomUUID().toString(), settings);
    jobRepository.save(job);
    LOGGER.info("Created clip job {} for {}", job.getJobId(), settings.input());

    try {
      jobRunner.process(job);
    } catch (TaskRejectedException e) {
      job.setStatus(JobStatus.FAILED);
      job.setError("Job queue is full");
      jobRepository.save(job);
      throw e;
    }
    return ResponseEntity.accepted().body(new AsyncJobResponse(job.getJobId()));
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async clip job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/api/clips/{inputId}")
  @Operation(summary = "Get cached clips", description = "Read the cached clip list of an input")
  public List<Clip> getClips(@PathVariable String inputId) {
    return artifactCache.loadClips(inputId);
  }

  @DeleteMapping("/api/cache/{inputId}")
  @Operation(
      summary = "Drop cached artifacts",
      description = "Delete the extracted audio, transcript and clip list of an input")
  public ResponseEntity<Void> deleteCache(@PathVariable String inputId) {
    artifactCache.cleanupFor(inputId);
    return ResponseEntity.noContent().build();
  }
}
