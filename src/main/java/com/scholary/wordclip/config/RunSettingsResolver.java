package com.scholary.wordclip.config;

import com.scholary.wordclip.asr.ModelName;
import com.scholary.wordclip.config.WordclipProperties.KeywordProperties;
import com.scholary.wordclip.config.WordclipProperties.MomentProperties;
import com.scholary.wordclip.exception.ValidationException;
import com.scholary.wordclip.match.MatchConfig;
import com.scholary.wordclip.semantic.Moment;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Merges per-run overrides with the configured defaults and validates the result.
 *
 * <p>Precedence: the run's input is authoritative. A {@code clips} list replaces the configured
 * keywords (in keyword mode, each with 30/30 seconds of padding) or moments (in semantic mode,
 * with the run's neighbor window and no padding). Fully configured keyword or moment lists win
 * over {@code clips}. Every other override applies only when given.
 *
 * <p>Validation happens here, before any file is touched.
 */
@Component
public class RunSettingsResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(RunSettingsResolver.class);

  private final WordclipProperties properties;
  private final boolean cleanupAfterRun;

  public RunSettingsResolver(
      WordclipProperties properties,
      @Value("${wordclip.cache.cleanup-after-run:true}") boolean cleanupAfterRun) {
    this.properties = properties;
    this.cleanupAfterRun = cleanupAfterRun;
  }

  /**
   * @throws ValidationException if the merged settings cannot produce a run
   */
  public RunSettings resolve(RunOverrides overrides) {
    Path input = validateInput(overrides.input());
    ModelName model =
        ModelName.fromId(overrides.model() != null ? overrides.model() : properties.model());
    MatchMode mode = overrides.mode() != null ? overrides.mode() : properties.mode();
    List<Integer> tracks =
        validateTracks(overrides.tracks() != null ? overrides.tracks() : properties.tracks());

    int neighborsBefore =
        nonNegative(
            "neighbors before",
            overrides.neighborsBefore() != null
                ? overrides.neighborsBefore()
                : properties.neighbors().before());
    int neighborsAfter =
        nonNegative(
            "neighbors after",
            overrides.neighborsAfter() != null
                ? overrides.neighborsAfter()
                : properties.neighbors().after());

    Map<String, MatchConfig> keywords = Map.of();
    List<Moment> moments = List.of();
    if (mode == MatchMode.KEYWORD) {
      keywords = resolveKeywords(overrides);
      if (keywords.isEmpty()) {
        throw new ValidationException("Keyword mode needs at least one keyword");
      }
    } else {
      moments = resolveMoments(overrides);
      if (moments.isEmpty()) {
        throw new ValidationException("Semantic mode needs at least one moment");
      }
    }

    Path outputDirectory =
        overrides.outputDirectory() != null
            ? overrides.outputDirectory()
            : Paths.get(properties.outputDirectory());
    if (Files.exists(outputDirectory) && !Files.isDirectory(outputDirectory)) {
      throw new ValidationException("Output path is not a directory: " + outputDirectory);
    }

    RunSettings settings =
        new RunSettings(
            input,
            model,
            mode,
            tracks,
            keywords,
            moments,
            outputDirectory,
            neighborsBefore,
            neighborsAfter,
            overrides.reuseTranscript(),
            overrides.cleanupAfterRun() != null ? overrides.cleanupAfterRun() : cleanupAfterRun);

    LOGGER.debug("Resolved run settings: {}", settings);
    return settings;
  }

  private Map<String, MatchConfig> resolveKeywords(RunOverrides overrides) {
    List<KeywordProperties> configured;
    if (overrides.keywords() != null && !overrides.keywords().isEmpty()) {
      configured = overrides.keywords();
    } else if (overrides.clips() != null && !overrides.clips().isEmpty()) {
      configured =
          overrides.clips().stream().map(text -> new KeywordProperties(text, null, null)).toList();
    } else {
      configured = properties.keywords();
    }

    Map<String, MatchConfig> keywords = new LinkedHashMap<>();
    for (KeywordProperties keyword : configured) {
      String text = requireText("Keyword", keyword.text());
      keywords.put(
          text,
          new MatchConfig(
              nonNegative("padding before", keyword.paddingBefore()),
              nonNegative("padding after", keyword.paddingAfter())));
    }
    return Collections.unmodifiableMap(keywords);
  }

  private List<Moment> resolveMoments(RunOverrides overrides) {
    List<MomentProperties> configured;
    if (overrides.moments() != null && !overrides.moments().isEmpty()) {
      configured = overrides.moments();
    } else if (overrides.clips() != null && !overrides.clips().isEmpty()) {
      configured =
          overrides.clips().stream()
              .map(text -> new MomentProperties(text, null, null, null, null))
              .toList();
    } else {
      configured = properties.moments();
    }

    return configured.stream()
        .map(
            moment ->
                new Moment(
                    requireText("Moment", moment.text()),
                    new MatchConfig(
                        nonNegative("padding before", moment.paddingBefore()),
                        nonNegative("padding after", moment.paddingAfter())),
                    optionalNonNegative("neighbors before", moment.neighborsBefore()),
                    optionalNonNegative("neighbors after", moment.neighborsAfter())))
        .toList();
  }

  private static Path validateInput(Path input) {
    if (input == null) {
      throw new ValidationException("An input file is required");
    }
    if (!Files.isRegularFile(input)) {
      throw new ValidationException("Input file does not exist: " + input);
    }
    return input;
  }

  private static List<Integer> validateTracks(List<Integer> tracks) {
    if (tracks == null || tracks.isEmpty()) {
      throw new ValidationException("At least one audio track is required");
    }
    Set<Integer> seen = new HashSet<>();
    for (Integer track : tracks) {
      if (track == null || track < 1) {
        throw new ValidationException("Track indices are 1-based, got: " + track);
      }
      if (!seen.add(track)) {
        throw new ValidationException("Track " + track + " is listed more than once");
      }
    }
    return List.copyOf(tracks);
  }

  private static String requireText(String what, String text) {
    if (text == null || text.isBlank()) {
      throw new ValidationException(what + " text cannot be blank");
    }
    return text.trim();
  }

  private static int nonNegative(String what, Integer value) {
    if (value == null || value < 0) {
      throw new ValidationException(what + " must be zero or more, got: " + value);
    }
    return value;
  }

  private static Integer optionalNonNegative(String what, Integer value) {
    return value == null ? null : nonNegative(what, value);
  }
}
