package com.scholary.wordclip.asr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.wordclip.exception.ValidationException;
import org.junit.jupiter.api.Test;

class ModelNameTest {

  @Test
  void fromId_shouldAcceptEveryKnownModel() {
    assertThat(ModelName.fromId("tiny.en")).isEqualTo(ModelName.TINY_EN);
    assertThat(ModelName.fromId(" Large ")).isEqualTo(ModelName.LARGE);
    assertThat(ModelName.MEDIUM_EN.id()).isEqualTo("medium.en");
  }

  @Test
  void fromId_shouldListValidModelsOnError() {
    assertThatThrownBy(() -> ModelName.fromId("large-v9"))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("tiny, tiny.en, base");
    assertThatThrownBy(() -> ModelName.fromId(null)).isInstanceOf(ValidationException.class);
  }
}
