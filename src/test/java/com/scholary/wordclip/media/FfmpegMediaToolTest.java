package com.scholary.wordclip.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class FfmpegMediaToolTest {

  private final FfmpegMediaTool tool = new FfmpegMediaTool(new FfmpegProperties("ffmpeg", 16000));

  @Test
  void extractCommand_shouldSelectZeroBasedAudioStreamAsMonoPcm() {
    assertThat(tool.extractCommand(Path.of("in.mkv"), Path.of("out.wav"), 2))
        .containsExactly(
            "ffmpeg", "-i", "in.mkv", "-map", "0:a:1", "-f", "wav", "-acodec", "pcm_s16le", "-ar",
            "16000", "-ac", "1", "-vn", "-y", "out.wav");
  }

  @Test
  void cutCommand_shouldStreamCopyTheRange() {
    assertThat(tool.cutCommand(Path.of("in.mp4"), Path.of("clip_1_in.mp4"), 12.5, 40.25))
        .containsExactly(
            "ffmpeg", "-i", "in.mp4", "-ss", "12.500", "-t", "27.750", "-c:v", "copy", "-c:a",
            "copy", "-y", "clip_1_in.mp4");
  }

  @Test
  void extractAudioTrack_shouldRejectZeroTrack() {
    assertThatThrownBy(() -> tool.extractAudioTrack(Path.of("in.mp4"), Path.of("out.wav"), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void checkAvailable_shouldFailWhenBinaryIsMissing() {
    FfmpegMediaTool missing =
        new FfmpegMediaTool(new FfmpegProperties("wordclip-no-such-ffmpeg-binary", 16000));

    assertThatThrownBy(missing::checkAvailable)
        .isInstanceOf(MediaToolException.class)
        .hasMessageContaining("Is ffmpeg installed?");
  }
}
