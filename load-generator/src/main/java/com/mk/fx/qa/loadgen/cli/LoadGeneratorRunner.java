package com.mk.fx.qa.loadgen.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/** Hands the process arguments to the CLI and keeps its exit status for the application exit. */
@Component
public class LoadGeneratorRunner implements CommandLineRunner, ExitCodeGenerator {

  private final LoadGeneratorCli cli;
  private int exitCode;

  public LoadGeneratorRunner(LoadGeneratorCli cli) {
    this.cli = cli;
  }

  @Override
  public void run(String... args) {
    exitCode = cli.run(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
