package com.mk.fx.qa.loadgen.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults for a load run, bound from {@code load.generator.*}. Command-line options override the
 * concurrency, repetitions and request timeout per run.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "load.generator")
public class LoadGeneratorCfg {

  public static final int MAX_CONCURRENCY = 10_000;

  @Min(1)
  @Max(MAX_CONCURRENCY)
  private int concurrency = 5;

  @Positive private int repetitions = 300;

  /** Deadline for one probe, body included. */
  @NotNull private Duration requestTimeout = Duration.ofSeconds(30);

  @NotNull private Duration connectionTimeout = Duration.ofSeconds(5);

  /** Interval between progress log lines; zero disables them. */
  @NotNull private Duration progressInterval = Duration.ofSeconds(5);

  /** Headers sent with every request. */
  private Map<String, String> headers = new LinkedHashMap<>(Map.of("User-Agent", "loadgen"));
}
