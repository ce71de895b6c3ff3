package com.scholary.wordclip.service;

import com.scholary.wordclip.asr.AsrService;
import com.scholary.wordclip.asr.AsrTranscription;
import com.scholary.wordclip.cache.ArtifactCache;
import com.scholary.wordclip.cache.ArtifactKeys;
import com.scholary.wordclip.cache.ArtifactNotFoundException;
import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.clip.ClipAssembler;
import com.scholary.wordclip.config.MatchMode;
import com.scholary.wordclip.config.RunSettings;
import com.scholary.wordclip.config.WordclipProperties;
import com.scholary.wordclip.embedding.Embedder;
import com.scholary.wordclip.embedding.EmbeddingProperties;
import com.scholary.wordclip.exception.WordclipException;
import com.scholary.wordclip.logging.StructuredLogger;
import com.scholary.wordclip.match.KeywordMatcher;
import com.scholary.wordclip.media.MediaTool;
import com.scholary.wordclip.semantic.SemanticIndex;
import com.scholary.wordclip.semantic.SemanticMatcher;
import com.scholary.wordclip.transcript.TimestampedUnit;
import com.scholary.wordclip.transcript.TrackCombiner;
import com.scholary.wordclip.transcript.TranscriptReconstructor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one input through the whole clip pipeline.
 *
 * <p>Stages, in order:
 *
 * <ol>
 *   <li>extract each requested audio track and transcribe it (tracks run in parallel)
 *   <li>reconstruct word units per track and combine the tracks into one timeline
 *   <li>find candidate windows by keyword or by semantic search
 *   <li>merge the windows and cut one clip file per merged window
 * </ol>
 *
 * <p>The transcript and the clip list are written to the {@link ArtifactCache} along the way. Any
 * stage failure aborts the run and propagates; artifacts already written stay on disk.
 */
@Service
public class ClipPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipPipeline.class);

  private final ArtifactCache cache;
  private final ArtifactKeys keys;
  private final MediaTool mediaTool;
  private final AsrService asrService;
  private final TranscriptReconstructor reconstructor;
  private final TrackCombiner trackCombiner;
  private final KeywordMatcher keywordMatcher;
  private final SemanticMatcher semanticMatcher;
  private final ClipAssembler clipAssembler;
  private final Embedder embedder;
  private final Executor transcriptionExecutor;
  private final WordclipProperties properties;
  private final int embeddingDimension;
  private final StructuredLogger structuredLogger;

  public ClipPipeline(
      ArtifactCache cache,
      ArtifactKeys keys,
      MediaTool mediaTool,
      AsrService asrService,
      TranscriptReconstructor reconstructor,
      TrackCombiner trackCombiner,
      KeywordMatcher keywordMatcher,
      SemanticMatcher semanticMatcher,
      ClipAssembler clipAssembler,
      Embedder embedder,
      @Qualifier("transcriptionExecutor") Executor transcriptionExecutor,
      WordclipProperties properties,
      EmbeddingProperties embeddingProperties) {
    this.cache = cache;
    this.keys = keys;
    this.mediaTool = mediaTool;
    this.asrService = asrService;
    this.reconstructor = reconstructor;
    this.trackCombiner = trackCombiner;
    this.keywordMatcher = keywordMatcher;
    this.semanticMatcher = semanticMatcher;
    this.clipAssembler = clipAssembler;
    this.embedder = embedder;
    this.transcriptionExecutor = transcriptionExecutor;
    this.properties = properties;
    this.embeddingDimension = embeddingProperties.dimension();
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  public ClipRunResult run(RunSettings settings) {
    return run(settings, PipelineProgress.NONE);
  }

  /**
   * Run the pipeline.
   *
   * @param settings resolved and validated settings
   * @param progress receives coarse progress updates
   * @return the clips and the files written
   */
  public ClipRunResult run(RunSettings settings, PipelineProgress progress) {
    String runId = UUID.randomUUID().toString();
    String inputId = keys.inputId(settings.input());
    StructuredLogger.setRunContext(runId, inputId);
    long startTime = System.currentTimeMillis();

    try {
      LOGGER.info(
          "Starting run: input={}, mode={}, model={}, tracks={}",
          settings.input(),
          settings.mode(),
          settings.model(),
          settings.tracks());

      mediaTool.checkAvailable();
      cache.init();
      createOutputDirectory(settings.outputDirectory());
      progress.update(5, "prepared");

      List<TimestampedUnit> units = loadOrTranscribe(settings, inputId);
      progress.update(60, "transcribed");

      List<Clip> candidates = findCandidates(settings, units);
      progress.update(75, "matched");

      List<Clip> clips = clipAssembler.merge(candidates);
      structuredLogger.logClipsAssembled(candidates.size(), clips.size(), totalSeconds(clips));
      cache.saveClips(inputId, clips);

      List<String> clipFiles = cutClips(settings, clips);
      progress.update(95, "cut");

      if (settings.cleanupAfterRun()) {
        cache.cleanupFor(inputId);
      }

      LOGGER.info(
          "Run finished: {} clips from {} units in {}ms",
          clips.size(),
          units.size(),
          System.currentTimeMillis() - startTime);
      return new ClipRunResult(inputId, units.size(), clips, clipFiles);
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private List<TimestampedUnit> loadOrTranscribe(RunSettings settings, String inputId) {
    if (settings.reuseTranscript()) {
      try {
        List<TimestampedUnit> cached = cache.loadTranscript(inputId);
        LOGGER.info("Reusing cached transcript: {} units", cached.size());
        return cached;
      } catch (ArtifactNotFoundException e) {
        LOGGER.info("No cached transcript for {}, transcribing", inputId);
      }
    }

    List<TimestampedUnit> units = transcribeTracks(settings, inputId);
    cache.saveTranscript(inputId, units);
    return units;
  }

  private List<TimestampedUnit> transcribeTracks(RunSettings settings, String inputId) {
    Map<String, String> mdc = MDC.getCopyOfContextMap();

    List<CompletableFuture<List<TimestampedUnit>>> futures = new ArrayList<>();
    for (int track : settings.tracks()) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                restoreMdc(mdc);
                try {
                  return transcribeTrack(settings, inputId, track);
                } finally {
                  restoreMdc(previous);
                }
              },
              transcriptionExecutor));
    }

    List<List<TimestampedUnit>> perTrack = new ArrayList<>();
    for (CompletableFuture<List<TimestampedUnit>> future : futures) {
      perTrack.add(await(future));
    }
    return trackCombiner.combine(perTrack);
  }

  private List<TimestampedUnit> transcribeTrack(RunSettings settings, String inputId, int track) {
    long startTime = System.currentTimeMillis();
    Path audio = cache.audioPath(inputId, track);
    mediaTool.extractAudioTrack(settings.input(), audio, track);

    AsrTranscription transcription = asrService.transcribe(audio, settings.model());
    List<TimestampedUnit> units = reconstructor.reconstruct(transcription.segments());

    structuredLogger.logTrackTranscribed(
        track,
        transcription.segments().size(),
        units.size(),
        System.currentTimeMillis() - startTime);
    return units;
  }

  private List<Clip> findCandidates(RunSettings settings, List<TimestampedUnit> units) {
    List<Clip> candidates;
    if (settings.mode() == MatchMode.KEYWORD) {
      candidates = keywordMatcher.findCandidates(units, settings.keywords());
      structuredLogger.logCandidatesFound(
          settings.mode().name(), settings.keywords().size(), candidates.size());
      return candidates;
    }

    SemanticIndex index = new SemanticIndex(embeddingDimension);
    index.populate(units, embedder, properties.semantic().batchSize(), transcriptionExecutor);
    candidates =
        semanticMatcher.findCandidates(
            index,
            embedder,
            settings.moments(),
            properties.semantic().topK(),
            settings.neighborsBefore(),
            settings.neighborsAfter());
    structuredLogger.logCandidatesFound(
        settings.mode().name(), settings.moments().size(), candidates.size());
    return candidates;
  }

  private List<String> cutClips(RunSettings settings, List<Clip> clips) {
    String stem = ArtifactKeys.stem(settings.input());
    String extension = ArtifactKeys.extension(settings.input());
    String suffix = extension.isEmpty() ? "" : "." + extension;

    List<String> files = new ArrayList<>();
    for (int i = 0; i < clips.size(); i++) {
      Clip clip = clips.get(i);
      Path output = settings.outputDirectory().resolve("clip_" + (i + 1) + "_" + stem + suffix);
      mediaTool.cut(settings.input(), output, clip.start(), clip.end());
      structuredLogger.logClipCut(i + 1, clip.start(), clip.end(), output.toString());
      files.add(output.toString());
    }
    return files;
  }

  private static void createOutputDirectory(Path outputDirectory) {
    try {
      Files.createDirectories(outputDirectory);
    } catch (IOException e) {
      throw new WordclipException("Failed to create output directory: " + outputDirectory, e);
    }
  }

  private static void restoreMdc(Map<String, String> context) {
    if (context != null) {
      MDC.setContextMap(context);
    } else {
      MDC.clear();
    }
  }

  private static double totalSeconds(List<Clip> clips) {
    return clips.stream().mapToDouble(Clip::duration).sum();
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw new WordclipException("Track transcription failed", e.getCause());
    }
  }
}
