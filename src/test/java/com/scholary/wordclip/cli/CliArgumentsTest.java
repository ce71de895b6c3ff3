package com.scholary.wordclip.cli;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CliArgumentsTest {

  @Test
  void toSpringArgs_shouldRewriteConfigAndVerbose() {
    String[] rewritten =
        CliArguments.toSpringArgs(
            new String[] {"--config=/etc/wordclip.yml", "--verbose", "--input=talk.mp4"});

    assertThat(rewritten)
        .containsExactly(
            "--spring.config.additional-location=file:/etc/wordclip.yml",
            "--logging.level.com.scholary.wordclip=DEBUG",
            "--input=talk.mp4");
  }

  @Test
  void isCliInvocation_shouldDetectInputOrPurge() {
    assertThat(CliArguments.isCliInvocation(new String[] {"--input=talk.mp4"})).isTrue();
    assertThat(CliArguments.isCliInvocation(new String[] {"--purge-cache"})).isTrue();
    assertThat(CliArguments.isCliInvocation(new String[] {"--server.port=9090"})).isFalse();
    assertThat(CliArguments.isCliInvocation(new String[0])).isFalse();
  }
}
