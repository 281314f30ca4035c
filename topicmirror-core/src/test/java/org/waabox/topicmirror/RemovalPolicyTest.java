package org.waabox.topicmirror;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RemovalPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RemovalPolicyTest {

  @Test
  void whenUsingDefault_shouldRequireOneSubscriberForOneMinute() {
    final RemovalPolicy policy = RemovalPolicy.defaultPolicy();

    assertEquals(1, policy.subscriptions());
    assertEquals(Duration.ofMinutes(1), policy.duration());
    assertEquals("when subscriptions < 1 for 1m", policy.toExpression());
  }

  @Test
  void whenRendering_givenDurations_shouldPickLargestWholeUnit() {
    assertEquals("when subscriptions < 2 for 2h",
        RemovalPolicy.of(2, Duration.ofHours(2)).toExpression());
    assertEquals("when subscriptions < 1 for 90m",
        RemovalPolicy.of(1, Duration.ofMinutes(90)).toExpression());
    assertEquals("when subscriptions < 3 for 45s",
        RemovalPolicy.of(3, Duration.ofSeconds(45)).toExpression());
  }

  @Test
  void whenParsing_givenValidExpression_shouldReadThresholdAndPeriod() {
    final RemovalPolicy policy =
        RemovalPolicy.parse("when subscriptions < 5 for 10s");

    assertEquals(5, policy.subscriptions());
    assertEquals(Duration.ofSeconds(10), policy.duration());
    assertEquals(RemovalPolicy.defaultPolicy(),
        RemovalPolicy.parse("  when   subscriptions<1 for 1m "));
  }

  @Test
  void whenParsing_givenUnsupportedExpression_shouldThrowException() {
    assertThrows(IllegalArgumentException.class,
        () -> RemovalPolicy.parse("when no updates for 1m"));
    assertThrows(IllegalArgumentException.class,
        () -> RemovalPolicy.parse("when subscriptions < 1 for 1d"));
  }

  @Test
  void whenCreating_givenInvalidValues_shouldThrowException() {
    assertThrows(IllegalArgumentException.class,
        () -> RemovalPolicy.of(0, Duration.ofMinutes(1)));
    assertThrows(IllegalArgumentException.class,
        () -> RemovalPolicy.of(1, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> RemovalPolicy.of(1, Duration.ofMillis(1500)));
  }
}
