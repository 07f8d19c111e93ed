package com.mk.fx.qa.loadgen.cli;

import static com.mk.fx.qa.loadgen.utils.LoadUtils.parseDuration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.loadgen.cfg.LoadGeneratorCfg;
import com.mk.fx.qa.loadgen.metrics.BenchmarkReportBuilder;
import com.mk.fx.qa.loadgen.report.ConsoleReportFormatter;
import com.mk.fx.qa.loadgen.service.LoadRunRequest;
import com.mk.fx.qa.loadgen.service.LoadRunService;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.aesh.command.Command;
import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Argument;
import org.aesh.command.option.Option;

@Slf4j
@CommandDefinition(
    name = LoadCommand.NAME,
    description = "Fetches one URL repeatedly with a fixed number of requests in flight")
public class LoadCommand implements Command<CommandInvocation> {

  static final String NAME = "loadgen";

  @Option(shortName = 'c', description = "Number of requests kept in flight")
  Integer concurrency;

  @Option(shortName = 'r', description = "Total number of requests to issue")
  Integer repetitions;

  @Option(shortName = 't', description = "Deadline for a single request, e.g. 500ms, 10s, 1m")
  String timeout;

  @Option(shortName = 'j', hasValue = false, description = "Print the report as JSON")
  boolean json;

  @Option(shortName = 'h', hasValue = false, description = "Show this help")
  boolean help;

  @Argument(description = "URL that should be fetched")
  String url;

  private final LoadRunService loadRunService;
  private final LoadGeneratorCfg cfg;
  private final ObjectMapper objectMapper;

  public LoadCommand(LoadRunService loadRunService, LoadGeneratorCfg cfg, ObjectMapper objectMapper) {
    this.loadRunService = loadRunService;
    this.cfg = cfg;
    this.objectMapper = objectMapper;
  }

  @Override
  public CommandResult execute(CommandInvocation invocation) throws InterruptedException {
    // a missing URL is not an error: print usage and leave with status 0
    if (help || url == null || url.isBlank()) {
      invocation.println(invocation.getHelpInfo(NAME));
      return CommandResult.SUCCESS;
    }

    URI target;
    try {
      target = parseTarget(url);
    } catch (URISyntaxException | IllegalArgumentException e) {
      invocation.println("Failed to parse URL: " + e.getMessage());
      return CommandResult.FAILURE;
    }

    int effectiveConcurrency = concurrency != null ? concurrency : cfg.getConcurrency();
    int effectiveRepetitions = repetitions != null ? repetitions : cfg.getRepetitions();
    if (effectiveConcurrency < 1 || effectiveRepetitions < 1) {
      invocation.println("Concurrency and repetitions must both be at least 1");
      invocation.println(invocation.getHelpInfo(NAME));
      return CommandResult.FAILURE;
    }
    if (effectiveConcurrency > LoadGeneratorCfg.MAX_CONCURRENCY) {
      invocation.println("Concurrency must not exceed " + LoadGeneratorCfg.MAX_CONCURRENCY);
      invocation.println(invocation.getHelpInfo(NAME));
      return CommandResult.FAILURE;
    }

    Duration requestTimeout;
    try {
      requestTimeout = timeout != null ? parseDuration(timeout) : cfg.getRequestTimeout();
    } catch (IllegalArgumentException e) {
      invocation.println(e.getMessage());
      return CommandResult.FAILURE;
    }
    if (requestTimeout.isZero() || requestTimeout.isNegative()) {
      invocation.println("Timeout must be positive, got " + timeout);
      return CommandResult.FAILURE;
    }

    try {
      var result =
          loadRunService.execute(
              new LoadRunRequest(target, effectiveConcurrency, effectiveRepetitions, requestTimeout));
      var report = new BenchmarkReportBuilder().build(result);
      if (json) {
        invocation.println(objectMapper.writeValueAsString(report));
      } else {
        ConsoleReportFormatter.format(report).forEach(invocation::println);
      }
      return CommandResult.SUCCESS;
    } catch (JsonProcessingException e) {
      log.error("Failed to serialise report: {}", e.getMessage(), e);
      invocation.println("Failed to serialise report: " + e.getOriginalMessage());
      return CommandResult.FAILURE;
    } catch (RuntimeException e) {
      log.error("Load run against {} failed: {}", target, e.getMessage(), e);
      invocation.println("Load run failed: " + e.getMessage());
      return CommandResult.FAILURE;
    }
  }

  /** Prepends {@code http://} to a URL without scheme and requires a host. */
  static URI parseTarget(String value) throws URISyntaxException {
    var candidate = value.trim();
    if (!candidate.startsWith("http://") && !candidate.startsWith("https://")) {
      candidate = "http://" + candidate;
    }
    var uri = new URI(candidate);
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("no host in " + value);
    }
    return uri;
  }
}
