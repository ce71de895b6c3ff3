package com.scholary.wordclip.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Rewrites the few command line options that must take effect before the Spring context starts.
 *
 * <ul>
 *   <li>{@code --config=path} becomes {@code --spring.config.additional-location=file:path}
 *   <li>{@code --verbose} becomes {@code --logging.level.com.scholary.wordclip=DEBUG}
 * </ul>
 *
 * <p>Other arguments pass through unchanged.
 */
public final class CliArguments {

  private static final String CONFIG = "--config=";
  private static final String VERBOSE = "--verbose";

  private CliArguments() {}

  public static String[] toSpringArgs(String[] args) {
    List<String> rewritten = new ArrayList<>(args.length);
    for (String arg : args) {
      if (arg.startsWith(CONFIG)) {
        rewritten.add(
            "--spring.config.additional-location=file:" + arg.substring(CONFIG.length()));
      } else if (arg.equals(VERBOSE)) {
        rewritten.add("--logging.level.com.scholary.wordclip=DEBUG");
      } else {
        rewritten.add(arg);
      }
    }
    return rewritten.toArray(new String[0]);
  }

  /** True when the arguments ask for a one-shot run rather than the REST service. */
  public static boolean isCliInvocation(String[] args) {
    return Arrays.stream(args)
        .anyMatch(arg -> arg.startsWith("--input=") || arg.equals("--purge-cache"));
  }
}
