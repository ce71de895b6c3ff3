package com.scholary.wordclip.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.wordclip.config.MatchMode;
import com.scholary.wordclip.config.RunOverrides;
import com.scholary.wordclip.exception.ValidationException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class CliOptionsTest {

  @Test
  void toOverrides_shouldReadAllOptions() {
    RunOverrides overrides =
        CliOptions.toOverrides(
            new DefaultApplicationArguments(
                "--input=talk.mp4",
                "--output=clips",
                "--model=small.en",
                "--mode=semantic",
                "--tracks=1,2",
                "--tracks=3",
                "--clips=a goal, the weather",
                "--neighbors-before=2",
                "--neighbors-after=1",
                "--reuse-transcript",
                "--no-cleanup"));

    assertThat(overrides.input()).isEqualTo(Path.of("talk.mp4"));
    assertThat(overrides.outputDirectory()).isEqualTo(Path.of("clips"));
    assertThat(overrides.model()).isEqualTo("small.en");
    assertThat(overrides.mode()).isEqualTo(MatchMode.SEMANTIC);
    assertThat(overrides.tracks()).containsExactly(1, 2, 3);
    assertThat(overrides.clips()).containsExactly("a goal", "the weather");
    assertThat(overrides.neighborsBefore()).isEqualTo(2);
    assertThat(overrides.neighborsAfter()).isEqualTo(1);
    assertThat(overrides.reuseTranscript()).isTrue();
    assertThat(overrides.cleanupAfterRun()).isFalse();
  }

  @Test
  void toOverrides_shouldLeaveUnsetOptionsNull() {
    RunOverrides overrides =
        CliOptions.toOverrides(new DefaultApplicationArguments("--input=talk.mp4"));

    assertThat(overrides.model()).isNull();
    assertThat(overrides.mode()).isNull();
    assertThat(overrides.tracks()).isNull();
    assertThat(overrides.clips()).isNull();
    assertThat(overrides.outputDirectory()).isNull();
    assertThat(overrides.reuseTranscript()).isFalse();
    assertThat(overrides.cleanupAfterRun()).isNull();
  }

  @Test
  void toOverrides_shouldRejectBadNumbers() {
    assertThatThrownBy(
            () ->
                CliOptions.toOverrides(
                    new DefaultApplicationArguments("--input=talk.mp4", "--tracks=one")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("--tracks");
  }

  @Test
  void toOverrides_shouldRejectUnknownMode() {
    assertThatThrownBy(
            () ->
                CliOptions.toOverrides(
                    new DefaultApplicationArguments("--input=talk.mp4", "--mode=fuzzy")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("--mode");
  }

  @Test
  void purgeCache_shouldDetectFlag() {
    assertThat(CliOptions.purgeCache(new DefaultApplicationArguments("--purge-cache"))).isTrue();
    assertThat(CliOptions.hasInput(new DefaultApplicationArguments("--purge-cache"))).isFalse();
  }
}
