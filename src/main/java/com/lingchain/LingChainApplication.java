package com.lingchain;

import com.lingchain.interfaces.cli.ChainCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Starts the REST service, or performs a single search when run as
 * {@code lingchain <dictionary-file> <word>}.
 */
@SpringBootApplication
public class LingChainApplication {

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(LingChainApplication.class);
    if (ChainCommandRunner.isCommandLine(args)) {
      // stdout carries only the chains
      app.setWebApplicationType(WebApplicationType.NONE);
      app.setLogStartupInfo(false);
      ConfigurableApplicationContext ctx = app.run(ChainCommandRunner.toSpringArgs(args));
      ctx.close();
      return;
    }
    app.run(args);
  }
}
