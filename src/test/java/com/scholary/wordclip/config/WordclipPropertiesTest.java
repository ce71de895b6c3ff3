package com.scholary.wordclip.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.wordclip.config.WordclipProperties.KeywordProperties;
import com.scholary.wordclip.config.WordclipProperties.MomentProperties;
import org.junit.jupiter.api.Test;

class WordclipPropertiesTest {

  @Test
  void constructor_shouldApplyDefaults() {
    WordclipProperties properties =
        new WordclipProperties(null, null, null, null, null, null, null, null);

    assertThat(properties.model()).isEqualTo("base");
    assertThat(properties.mode()).isEqualTo(MatchMode.KEYWORD);
    assertThat(properties.tracks()).containsExactly(1);
    assertThat(properties.outputDirectory()).isEqualTo("output");
    assertThat(properties.neighbors().before()).isEqualTo(5);
    assertThat(properties.neighbors().after()).isEqualTo(5);
    assertThat(properties.semantic().topK()).isEqualTo(3);
    assertThat(properties.semantic().batchSize()).isEqualTo(64);
  }

  @Test
  void keywordAndMomentPadding_shouldDefaultDifferently() {
    assertThat(new KeywordProperties("hello", null, null).paddingBefore()).isEqualTo(30);
    assertThat(new MomentProperties("a moment", null, null, null, null).paddingAfter()).isZero();
  }
}
