package com.scholary.wordclip.media;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link MediaTool} backed by the ffmpeg command line.
 *
 * <p>Commands are passed as argument lists, never through a shell, so file names with spaces are
 * safe. ffmpeg's combined output is drained while it runs; the last lines are kept for the error
 * message when it exits non-zero.
 */
@Component
public class FfmpegMediaTool implements MediaTool {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaTool.class);

  private static final int OUTPUT_TAIL_LINES = 10;

  private final FfmpegProperties properties;

  public FfmpegMediaTool(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void checkAvailable() {
    run(List.of(properties.binary(), "-version"), "ffmpeg availability check");
  }

  @Override
  public void extractAudioTrack(Path input, Path output, int track) {
    if (track < 1) {
      throw new IllegalArgumentException("Track index is 1-based: " + track);
    }
    LOGGER.info("Extracting audio track {} from {} to {}", track, input.getFileName(), output);
    run(extractCommand(input, output, track), "Audio extraction of track " + track);
  }

  @Override
  public void cut(Path input, Path output, double start, double end) {
    LOGGER.info("Cutting clip [{}-{}] to {}", format(start), format(end), output.getFileName());
    run(cutCommand(input, output, start, end), "Clip cut to " + output.getFileName());
  }

  List<String> extractCommand(Path input, Path output, int track) {
    return List.of(
        properties.binary(),
        "-i",
        input.toString(),
        "-map",
        "0:a:" + (track - 1),
        "-f",
        "wav",
        "-acodec",
        "pcm_s16le",
        "-ar",
        String.valueOf(properties.sampleRate()),
        "-ac",
        "1",
        "-vn",
        "-y",
        output.toString());
  }

  List<String> cutCommand(Path input, Path output, double start, double end) {
    return List.of(
        properties.binary(),
        "-i",
        input.toString(),
        "-ss",
        format(start),
        "-t",
        format(end - start),
        "-c:v",
        "copy",
        "-c:a",
        "copy",
        "-y",
        output.toString());
  }

  private void run(List<String> command, String action) {
    LOGGER.debug("Running: {}", String.join(" ", command));

    Process process;
    try {
      process = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new MediaToolException(
          action + " failed: could not start " + properties.binary() + ". Is ffmpeg installed?", e);
    }

    Deque<String> tail = new ArrayDeque<>();
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (tail.size() == OUTPUT_TAIL_LINES) {
          tail.removeFirst();
        }
        tail.addLast(line);
      }

      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new MediaToolException(
            String.format(
                "%s failed with exit code %d: %s",
                action, exitCode, String.join("\n", tail)));
      }
    } catch (IOException e) {
      process.destroy();
      throw new MediaToolException(action + " failed while reading ffmpeg output", e);
    } catch (InterruptedException e) {
      process.destroy();
      Thread.currentThread().interrupt();
      throw new MediaToolException(action + " interrupted", e);
    }
  }

  private static String format(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }
}
