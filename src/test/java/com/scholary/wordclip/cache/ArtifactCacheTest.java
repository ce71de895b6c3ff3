package com.scholary.wordclip.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.transcript.TimestampedUnit;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactCacheTest {

  @TempDir Path tempDir;

  private Path root;
  private ArtifactCache cache;

  @BeforeEach
  void setUp() {
    root = tempDir.resolve("wordclip");
    cache = new ArtifactCache(root.toString(), new ObjectMapper());
    cache.init();
  }

  @Test
  void init_shouldCreateCacheLayout() {
    assertThat(root.resolve("models")).isDirectory();
    assertThat(root.resolve("audio")).isDirectory();
    assertThat(root.resolve("transcriptions")).isDirectory();
    assertThat(root.resolve("clips")).isDirectory();
  }

  @Test
  void paths_shouldFollowNamingConvention() {
    assertThat(cache.audioPath("talk", 2)).isEqualTo(root.resolve("audio/talk_track_2.wav"));
    assertThat(cache.transcriptPath("talk")).isEqualTo(root.resolve("transcriptions/talk.json"));
    assertThat(cache.clipsPath("talk")).isEqualTo(root.resolve("clips/talk_clips.json"));
    assertThat(cache.modelPath("base.en")).isEqualTo(root.resolve("models/whisper-base.en.bin"));
  }

  @Test
  void saveTranscript_shouldRoundTripFieldForField() {
    List<TimestampedUnit> units =
        List.of(
            new TimestampedUnit(0.0, 0.42, "Hello"),
            new TimestampedUnit(0.42, 1.337, "world, again"),
            new TimestampedUnit(2.5, 2.5, "ünïcode"));

    cache.saveTranscript("talk", units);

    assertThat(cache.loadTranscript("talk")).isEqualTo(units);
  }

  @Test
  void saveTranscript_shouldOverwriteWithoutLeavingTempFiles() throws Exception {
    cache.saveTranscript("talk", List.of(new TimestampedUnit(0, 1, "old")));
    cache.saveTranscript("talk", List.of(new TimestampedUnit(0, 1, "new")));

    assertThat(cache.loadTranscript("talk")).extracting(TimestampedUnit::text).containsExactly("new");
    try (Stream<Path> files = Files.list(root.resolve("transcriptions"))) {
      assertThat(files).containsExactly(cache.transcriptPath("talk"));
    }
  }

  @Test
  void saveClips_shouldWriteLabelAsKeyword() throws Exception {
    List<Clip> clips = List.of(new Clip(0, 20, "a, b"), new Clip(30, 40, "c"));

    cache.saveClips("talk", clips);

    assertThat(Files.readString(cache.clipsPath("talk"))).contains("\"keyword\" : \"a, b\"");
    assertThat(cache.loadClips("talk")).isEqualTo(clips);
  }

  @Test
  void loadTranscript_shouldFailWhenMissing() {
    assertThatThrownBy(() -> cache.loadTranscript("nothing"))
        .isInstanceOf(ArtifactNotFoundException.class);
  }

  @Test
  void loadTranscript_shouldFailOnUnparsableContent() throws Exception {
    Files.writeString(cache.transcriptPath("talk"), "[{\"start\": 0, \"end\": ");

    assertThatThrownBy(() -> cache.loadTranscript("talk"))
        .isInstanceOf(CorruptArtifactException.class);
  }

  @Test
  void loadTranscript_shouldFailOnInvariantViolation() throws Exception {
    Files.writeString(cache.transcriptPath("talk"), "[{\"start\": 5, \"end\": 1, \"text\": \"x\"}]");

    assertThatThrownBy(() -> cache.loadTranscript("talk"))
        .isInstanceOf(CorruptArtifactException.class);
  }

  @Test
  void loadClips_shouldFailOnNullEntry() throws Exception {
    Files.writeString(cache.clipsPath("talk"), "[null]");

    assertThatThrownBy(() -> cache.loadClips("talk")).isInstanceOf(CorruptArtifactException.class);
  }

  @Test
  void cleanupFor_shouldRemoveOnlyThatInputsArtifacts() throws Exception {
    Files.writeString(cache.audioPath("talk", 1), "wav");
    Files.writeString(cache.audioPath("talk", 2), "wav");
    Files.writeString(cache.audioPath("other", 1), "wav");
    Files.writeString(cache.modelPath("base"), "model");
    cache.saveTranscript("talk", List.of(new TimestampedUnit(0, 1, "x")));
    cache.saveClips("talk", List.of(new Clip(0, 1, "x")));
    cache.saveTranscript("other", List.of(new TimestampedUnit(0, 1, "y")));

    int deleted = cache.cleanupFor("talk");

    assertThat(deleted).isEqualTo(4);
    assertThat(cache.audioPath("talk", 1)).doesNotExist();
    assertThat(cache.audioPath("talk", 2)).doesNotExist();
    assertThat(cache.transcriptPath("talk")).doesNotExist();
    assertThat(cache.clipsPath("talk")).doesNotExist();
    assertThat(cache.audioPath("other", 1)).exists();
    assertThat(cache.transcriptPath("other")).exists();
    assertThat(cache.modelPath("base")).exists();
  }

  @Test
  void cleanupFor_shouldKeepAudioOfInputWhoseStemExtendsTheId() throws Exception {
    Files.writeString(cache.audioPath("talk", 1), "wav");
    Files.writeString(cache.audioPath("talk_track_1", 1), "wav");

    int deleted = cache.cleanupFor("talk");

    assertThat(deleted).isEqualTo(1);
    assertThat(cache.audioPath("talk", 1)).doesNotExist();
    assertThat(cache.audioPath("talk_track_1", 1)).exists();
  }

  @Test
  void cleanupFor_shouldSucceedWhenNothingIsCached() {
    assertThat(cache.cleanupFor("never-seen")).isZero();
  }

  @Test
  void cleanupAll_shouldDeleteRoot() throws Exception {
    Files.writeString(cache.modelPath("base"), "model");
    cache.saveTranscript("talk", List.of(new TimestampedUnit(0, 1, "x")));

    cache.cleanupAll();

    assertThat(root).doesNotExist();
  }
}
