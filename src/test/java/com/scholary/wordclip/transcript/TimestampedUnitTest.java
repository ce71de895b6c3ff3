package com.scholary.wordclip.transcript;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimestampedUnitTest {

  @Test
  void constructor_shouldRejectEndBeforeStart() {
    assertThatThrownBy(() -> new TimestampedUnit(2.0, 1.0, "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(() -> new TimestampedUnit(-0.5, 1.0, "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_shouldRejectNullText() {
    assertThatThrownBy(() -> new TimestampedUnit(0, 1, null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
