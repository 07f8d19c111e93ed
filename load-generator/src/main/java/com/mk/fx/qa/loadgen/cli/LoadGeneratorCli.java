package com.mk.fx.qa.loadgen.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.loadgen.cfg.LoadGeneratorCfg;
import com.mk.fx.qa.loadgen.service.LoadRunService;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.aesh.command.AeshCommandRuntimeBuilder;
import org.aesh.command.CommandNotFoundException;
import org.aesh.command.CommandResult;
import org.aesh.command.CommandRuntime;
import org.aesh.command.impl.registry.AeshCommandRegistryBuilder;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.registry.CommandRegistry;
import org.springframework.stereotype.Component;

/**
 * Parses the process arguments with aesh and runs the {@link LoadCommand}. Returns a process exit
 * status: 0 on success or when only usage was printed, 1 otherwise.
 */
@Slf4j
@Component
public class LoadGeneratorCli {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;

  private final LoadRunService loadRunService;
  private final LoadGeneratorCfg cfg;
  private final ObjectMapper objectMapper;

  public LoadGeneratorCli(LoadRunService loadRunService, LoadGeneratorCfg cfg, ObjectMapper objectMapper) {
    this.loadRunService = loadRunService;
    this.cfg = cfg;
    this.objectMapper = objectMapper;
  }

  public int run(String... args) {
    CommandRuntime<CommandInvocation> runtime = null;
    String commandLine = LoadCommand.NAME + " " + commandArguments(args);
    try {
      CommandRegistry<CommandInvocation> registry =
          AeshCommandRegistryBuilder.<CommandInvocation>builder()
              .command(new LoadCommand(loadRunService, cfg, objectMapper))
              .create();
      AeshCommandRuntimeBuilder<CommandInvocation> builder = AeshCommandRuntimeBuilder.builder();
      runtime = builder.commandRegistry(registry).build();

      log.debug("Executing command line: {}", commandLine);
      CommandResult result = runtime.executeCommand(commandLine);
      return result != null && result.getResultValue() == CommandResult.SUCCESS.getResultValue()
          ? EXIT_OK
          : EXIT_FAILURE;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      System.out.println("Interrupted while running " + commandLine);
      return EXIT_FAILURE;
    } catch (Exception e) {
      System.out.println("Failed to execute command: " + e.getMessage());
      log.debug("Command failure detail", e);
      if (runtime != null) {
        try {
          System.out.println(
              runtime.getCommandRegistry().getCommand(LoadCommand.NAME, LoadCommand.NAME).printHelp(LoadCommand.NAME));
        } catch (CommandNotFoundException ex) {
          throw new IllegalStateException(ex);
        }
      }
      return EXIT_FAILURE;
    }
  }

  /**
   * Joins the arguments meant for the command. Spring property overrides such as {@code
   * --load.generator.concurrency=25} are left to Spring; spaces inside arguments are escaped.
   */
  @VisibleForTesting
  static String commandArguments(String... args) {
    return Stream.of(args)
        .filter(arg -> !isPropertyOverride(arg))
        .map(arg -> arg.replaceAll(" ", "\\\\ "))
        .collect(Collectors.joining(" "));
  }

  private static boolean isPropertyOverride(String arg) {
    if (!arg.startsWith("--")) {
      return false;
    }
    int equals = arg.indexOf('=');
    return equals > 2 && arg.substring(2, equals).contains(".");
  }
}
