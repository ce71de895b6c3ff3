package com.scholary.wordclip.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CachingEmbedderTest {

  @Mock private Embedder delegate;

  private CachingEmbedder embedder;

  @BeforeEach
  void setUp() {
    embedder = new CachingEmbedder(delegate, 100, Duration.ofMinutes(5));
  }

  @Test
  void embed_shouldCallDelegateOncePerText() {
    when(delegate.embed("hello")).thenReturn(new float[] {1, 0});

    embedder.embed("hello");
    float[] second = embedder.embed("hello");

    assertThat(second).containsExactly(1, 0);
    verify(delegate, times(1)).embed("hello");
  }

  @Test
  void batchEmbed_shouldSendOnlyMissingDistinctTexts() {
    when(delegate.embed("yes")).thenReturn(new float[] {1, 1});
    embedder.embed("yes");
    when(delegate.batchEmbed(List.of("no", "maybe")))
        .thenReturn(List.of(new float[] {0, 1}, new float[] {1, 0}));

    List<float[]> vectors = embedder.batchEmbed(List.of("yes", "no", "maybe", "no"));

    assertThat(vectors).hasSize(4);
    assertThat(vectors.get(0)).containsExactly(1, 1);
    assertThat(vectors.get(1)).containsExactly(0, 1);
    assertThat(vectors.get(2)).containsExactly(1, 0);
    assertThat(vectors.get(3)).isSameAs(vectors.get(1));
  }

  @Test
  void batchEmbed_shouldSkipDelegateWhenEverythingIsCached() {
    when(delegate.batchEmbed(List.of("a"))).thenReturn(List.of(new float[] {1}));
    embedder.batchEmbed(List.of("a"));

    embedder.batchEmbed(List.of("a", "a"));

    verify(delegate, times(1)).batchEmbed(anyList());
    verify(delegate, never()).embed("a");
    assertThat(embedder.getStats()).contains("hits=");
  }
}
