package com.scholary.wordclip.cli;

import com.scholary.wordclip.cache.ArtifactCache;
import com.scholary.wordclip.config.RunSettings;
import com.scholary.wordclip.config.RunSettingsResolver;
import com.scholary.wordclip.exception.ValidationException;
import com.scholary.wordclip.service.ClipPipeline;
import com.scholary.wordclip.service.ClipRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * One-shot command line run.
 *
 * <p>Does nothing unless {@code --input} or {@code --purge-cache} is given. Settings are resolved
 * before the cache is purged, so invalid settings leave the cache untouched. Exit codes: 0 on
 * success, 2 for invalid settings, 1 when the pipeline fails.
 */
@Component
public class ClipCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipCommandRunner.class);

  static final int EXIT_FAILURE = 1;
  static final int EXIT_INVALID = 2;

  private final RunSettingsResolver settingsResolver;
  private final ClipPipeline pipeline;
  private final ArtifactCache artifactCache;

  private int exitCode;

  public ClipCommandRunner(
      RunSettingsResolver settingsResolver, ClipPipeline pipeline, ArtifactCache artifactCache) {
    this.settingsResolver = settingsResolver;
    this.pipeline = pipeline;
    this.artifactCache = artifactCache;
  }

  @Override
  public void run(ApplicationArguments args) {
    try {
      RunSettings settings =
          CliOptions.hasInput(args) ? settingsResolver.resolve(CliOptions.toOverrides(args)) : null;

      if (CliOptions.purgeCache(args)) {
        artifactCache.cleanupAll();
      }
      if (settings == null) {
        return;
      }

      ClipRunResult result = pipeline.run(settings);

      LOGGER.info(
          "Wrote {} clips to {}", result.clipFiles().size(), settings.outputDirectory());
    } catch (ValidationException e) {
      LOGGER.error("Invalid settings: {}", e.getMessage());
      exitCode = EXIT_INVALID;
    } catch (RuntimeException e) {
      LOGGER.error("Run failed: {}", e.getMessage(), e);
      exitCode = EXIT_FAILURE;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
