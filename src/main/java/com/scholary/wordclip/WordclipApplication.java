package com.scholary.wordclip;

import com.scholary.wordclip.cli.CliArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for wordclip.
 *
 * <p>With {@code --input} (or {@code --purge-cache}) it runs once without a web server and exits
 * with the run's status code. Otherwise it serves the asynchronous clip job API.
 */
@SpringBootApplication
@EnableAsync
public class WordclipApplication {

  public static void main(String[] args) {
    SpringApplication application = new SpringApplication(WordclipApplication.class);
    String[] springArgs = CliArguments.toSpringArgs(args);

    if (CliArguments.isCliInvocation(args)) {
      application.setWebApplicationType(WebApplicationType.NONE);
      System.exit(SpringApplication.exit(application.run(springArgs)));
    }
    application.run(springArgs);
  }
}
