package com.scholary.wordclip.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.wordclip.asr.ModelName;
import com.scholary.wordclip.cache.ArtifactCache;
import com.scholary.wordclip.cache.ArtifactNotFoundException;
import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.config.MatchMode;
import com.scholary.wordclip.config.RunOverrides;
import com.scholary.wordclip.config.RunSettings;
import com.scholary.wordclip.config.RunSettingsResolver;
import com.scholary.wordclip.exception.ValidationException;
import com.scholary.wordclip.job.ClipJob;
import com.scholary.wordclip.job.ClipJobRunner;
import com.scholary.wordclip.job.JobRepository;
import com.scholary.wordclip.job.JobStatus;
import com.scholary.wordclip.match.MatchConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ClipController.class)
class ClipControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private RunSettingsResolver settingsResolver;
  @MockBean private JobRepository jobRepository;
  @MockBean private ClipJobRunner jobRunner;
  @MockBean private ArtifactCache artifactCache;

  @Test
  void createClips_shouldAcceptJob() throws Exception {
    when(settingsResolver.resolve(any(RunOverrides.class))).thenReturn(settings());

    mockMvc
        .perform(
            post("/api/clips")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"inputPath": "/media/talk.mp4",
                     "mode": "KEYWORD",
                     "keywords": [{"text": "hello", "paddingBefore": 10}]}
                    """))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty());

    verify(jobRepository).save(any(ClipJob.class));
    verify(jobRunner).process(any(ClipJob.class));
  }

  @Test
  void createClips_shouldRejectInvalidSettings() throws Exception {
    when(settingsResolver.resolve(any(RunOverrides.class)))
        .thenThrow(new ValidationException("Invalid model name: huge"));

    mockMvc
        .perform(
            post("/api/clips")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputPath\": \"/media/talk.mp4\", \"model\": \"huge\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_error"))
        .andExpect(jsonPath("$.message").value("Invalid model name: huge"));

    verify(jobRunner, never()).process(any());
  }

  @Test
  void createClips_shouldRejectMissingInputPath() throws Exception {
    mockMvc
        .perform(
            post("/api/clips").contentType(MediaType.APPLICATION_JSON).content("{\"mode\": \"SEMANTIC\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_error"));
  }

  @Test
  void createClips_shouldRejectMalformedBody() throws Exception {
    mockMvc
        .perform(post("/api/clips").contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }

  @Test
  void createClips_shouldFailJobWhenQueueIsFull() throws Exception {
    when(settingsResolver.resolve(any(RunOverrides.class))).thenReturn(settings());
    doThrow(new TaskRejectedException("queue full")).when(jobRunner).process(any(ClipJob.class));

    mockMvc
        .perform(
            post("/api/clips")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"inputPath\": \"/media/talk.mp4\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.error").value("service_unavailable"));

    ArgumentCaptor<ClipJob> saved = ArgumentCaptor.forClass(ClipJob.class);
    verify(jobRepository, times(2)).save(saved.capture());
    assertThat(saved.getValue().getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(saved.getValue().getError()).isEqualTo("Job queue is full");
  }

  @Test
  void getJobStatus_shouldReturnJob() throws Exception {
    ClipJob job = new ClipJob("job-1", settings());
    job.setStatus(JobStatus.PROCESSING);
    job.setProgress(60);
    job.setPhase("transcribed");
    when(jobRepository.findById("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.status").value("PROCESSING"))
        .andExpect(jsonPath("$.progress").value(60))
        .andExpect(jsonPath("$.phase").value("transcribed"));
  }

  @Test
  void getJobStatus_shouldReturn404ForUnknownJob() throws Exception {
    when(jobRepository.findById("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/jobs/nope")).andExpect(status().isNotFound());
  }

  @Test
  void getClips_shouldReturnCachedClipsWithKeywordField() throws Exception {
    when(artifactCache.loadClips("talk")).thenReturn(List.of(new Clip(5, 45, "hello")));

    mockMvc
        .perform(get("/api/clips/talk"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].start").value(5.0))
        .andExpect(jsonPath("$[0].end").value(45.0))
        .andExpect(jsonPath("$[0].keyword").value("hello"));
  }

  @Test
  void getClips_shouldReturn404WhenNothingIsCached() throws Exception {
    when(artifactCache.loadClips("talk"))
        .thenThrow(new ArtifactNotFoundException(Path.of("clips/talk_clips.json")));

    mockMvc
        .perform(get("/api/clips/talk"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void deleteCache_shouldReturnNoContent() throws Exception {
    mockMvc.perform(delete("/api/cache/talk")).andExpect(status().isNoContent());

    verify(artifactCache).cleanupFor("talk");
  }

  private static RunSettings settings() {
    return new RunSettings(
        Path.of("/media/talk.mp4"),
        ModelName.BASE,
        MatchMode.KEYWORD,
        List.of(1),
        Map.of("hello", new MatchConfig(10, 30)),
        List.of(),
        Path.of("output"),
        5,
        5,
        false,
        true);
  }
}
