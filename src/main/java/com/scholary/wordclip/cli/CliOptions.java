package com.scholary.wordclip.cli;

import com.scholary.wordclip.config.MatchMode;
import com.scholary.wordclip.config.RunOverrides;
import com.scholary.wordclip.exception.ValidationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.ApplicationArguments;

/**
 * Translates command line options into {@link RunOverrides}.
 *
 * <p>List options accept comma-separated values and may be repeated: {@code --tracks=1,2} and
 * {@code --tracks=1 --tracks=2} are equivalent.
 */
final class CliOptions {

  private CliOptions() {}

  static boolean purgeCache(ApplicationArguments args) {
    return args.containsOption("purge-cache");
  }

  static boolean hasInput(ApplicationArguments args) {
    return args.containsOption("input");
  }

  static RunOverrides toOverrides(ApplicationArguments args) {
    String input = single(args, "input");
    if (input == null || input.isBlank()) {
      throw new ValidationException("--input requires a file path");
    }
    String output = single(args, "output");

    return new RunOverrides(
        Path.of(input),
        single(args, "model"),
        mode(single(args, "mode")),
        tracks(list(args, "tracks")),
        list(args, "clips"),
        null,
        null,
        output != null ? Path.of(output) : null,
        integer(args, "neighbors-before"),
        integer(args, "neighbors-after"),
        args.containsOption("reuse-transcript"),
        args.containsOption("no-cleanup") ? Boolean.FALSE : null);
  }

  private static String single(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.get(values.size() - 1);
  }

  private static List<String> list(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null) {
      return null;
    }
    List<String> items = new ArrayList<>();
    for (String value : values) {
      for (String item : value.split(",")) {
        if (!item.isBlank()) {
          items.add(item.trim());
        }
      }
    }
    return items;
  }

  private static List<Integer> tracks(List<String> values) {
    if (values == null) {
      return null;
    }
    List<Integer> tracks = new ArrayList<>();
    for (String value : values) {
      tracks.add(parseInt("--tracks", value));
    }
    return tracks;
  }

  private static Integer integer(ApplicationArguments args, String name) {
    String value = single(args, name);
    return value == null ? null : parseInt("--" + name, value);
  }

  private static int parseInt(String option, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException(option + " expects a number, got: " + value);
    }
  }

  private static MatchMode mode(String value) {
    if (value == null) {
      return null;
    }
    try {
      return MatchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("--mode must be keyword or semantic, got: " + value);
    }
  }
}
