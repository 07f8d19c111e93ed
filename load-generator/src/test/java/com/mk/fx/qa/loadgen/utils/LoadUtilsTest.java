package com.mk.fx.qa.loadgen.utils;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoadUtilsTest {

  @Test
  void parseDuration_acceptsUnitSuffixes() {
    assertEquals(Duration.ofMillis(500), LoadUtils.parseDuration("500ms"));
    assertEquals(Duration.ofSeconds(10), LoadUtils.parseDuration("10s"));
    assertEquals(Duration.ofMinutes(1), LoadUtils.parseDuration("1m"));
    assertEquals(Duration.ofHours(2), LoadUtils.parseDuration(" 2H "));
  }

  @Test
  void parseDuration_readsBareNumberAsSeconds() {
    assertEquals(Duration.ofSeconds(30), LoadUtils.parseDuration("30"));
  }

  @Test
  void parseDuration_blankIsZero() {
    assertEquals(Duration.ZERO, LoadUtils.parseDuration(null));
    assertEquals(Duration.ZERO, LoadUtils.parseDuration("  "));
  }

  @Test
  void parseDuration_rejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("fast"));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("10d"));
    assertThrows(IllegalArgumentException.class, () -> LoadUtils.parseDuration("ms"));
  }

  @Test
  void toDuration_replacesNullWithZero() {
    assertEquals(Duration.ZERO, LoadUtils.toDuration(null));
    assertEquals(Duration.ofSeconds(3), LoadUtils.toDuration(Duration.ofSeconds(3)));
  }
}
