package com.scholary.wordclip;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.wordclip.cache.ArtifactCache;
import com.scholary.wordclip.config.WordclipProperties;
import com.scholary.wordclip.embedding.CachingEmbedder;
import com.scholary.wordclip.service.ClipPipeline;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "wordclip.cache.root=${java.io.tmpdir}/wordclip-context-test",
      "wordclip.semantic.top-k=5"
    })
class WordclipApplicationTest {

  @Autowired private ClipPipeline pipeline;
  @Autowired private ArtifactCache artifactCache;
  @Autowired private CachingEmbedder embedder;
  @Autowired private WordclipProperties properties;

  @Test
  void contextLoads() {
    assertThat(pipeline).isNotNull();
    assertThat(embedder).isNotNull();
    assertThat(artifactCache.root())
        .isEqualTo(Path.of(System.getProperty("java.io.tmpdir"), "wordclip-context-test"));
    assertThat(properties.semantic().topK()).isEqualTo(5);
    assertThat(properties.tracks()).containsExactly(1);
  }
}
