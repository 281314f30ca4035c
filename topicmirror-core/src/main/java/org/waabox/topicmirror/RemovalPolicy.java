package org.waabox.topicmirror;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A server-enforced rule that removes a topic once its subscriber count has
 * stayed below a threshold for a continuous period.
 *
 * <p>The mirror attaches the policy to every topic it creates as the
 * {@code REMOVAL} property, rendered as
 * {@code when subscriptions < N for D}, where {@code D} is expressed in
 * hours ({@code h}), minutes ({@code m}) or seconds ({@code s}). The mirror
 * itself never enforces it.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RemovalPolicy {

  /** The expression grammar understood by {@link #parse(String)}. */
  private static final Pattern EXPRESSION = Pattern.compile(
      "\\s*when\\s+subscriptions\\s*<\\s*(\\d+)\\s+for\\s+(\\d+)\\s*([smh])\\s*");

  /** The default policy: no subscribers for one minute. */
  private static final RemovalPolicy DEFAULT =
      new RemovalPolicy(1, Duration.ofMinutes(1));

  /** The subscriber count the topic must stay below. */
  private final int subscriptions;

  /** How long the count must stay below the threshold. */
  private final Duration duration;

  /**
   * Creates a new removal policy.
   *
   * @param theSubscriptions the subscriber threshold
   * @param theDuration      the period, never null
   */
  private RemovalPolicy(final int theSubscriptions,
      final Duration theDuration) {
    subscriptions = theSubscriptions;
    duration = theDuration;
  }

  /**
   * Creates a removal policy.
   *
   * @param subscriptions the subscriber count the topic must stay below,
   *                      must be greater than zero
   * @param duration      the period, a positive whole number of seconds,
   *                      never null
   *
   * @return the policy, never null
   *
   * @throws IllegalArgumentException if subscriptions is not positive or
   *                                  the duration is not a positive whole
   *                                  number of seconds
   */
  public static RemovalPolicy of(final int subscriptions,
      final Duration duration) {
    Objects.requireNonNull(duration, "duration must not be null");
    if (subscriptions <= 0) {
      throw new IllegalArgumentException(
          "subscriptions must be greater than 0, got: " + subscriptions);
    }
    if (duration.isNegative() || duration.isZero()
        || duration.toMillis() % 1000 != 0) {
      throw new IllegalArgumentException(
          "duration must be a positive whole number of seconds, got: "
              + duration);
    }
    return new RemovalPolicy(subscriptions, duration);
  }

  /**
   * Returns the default policy: fewer than one subscriber for one minute.
   *
   * @return the default policy, never null
   */
  public static RemovalPolicy defaultPolicy() {
    return DEFAULT;
  }

  /**
   * Parses a policy expression such as {@code when subscriptions < 1 for 1m}.
   *
   * @param expression the expression, never null
   *
   * @return the policy, never null
   *
   * @throws IllegalArgumentException if the expression is not understood
   */
  public static RemovalPolicy parse(final String expression) {
    Objects.requireNonNull(expression, "expression must not be null");
    final Matcher matcher = EXPRESSION.matcher(expression);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(
          "Unsupported removal policy: '" + expression + "'");
    }
    final long amount = Long.parseLong(matcher.group(2));
    final Duration duration = switch (matcher.group(3)) {
      case "h" -> Duration.ofHours(amount);
      case "m" -> Duration.ofMinutes(amount);
      default -> Duration.ofSeconds(amount);
    };
    return of(Integer.parseInt(matcher.group(1)), duration);
  }

  /**
   * Returns the subscriber count the topic must stay below.
   *
   * @return the threshold, always greater than zero
   */
  public int subscriptions() {
    return subscriptions;
  }

  /**
   * Returns how long the count must stay below the threshold.
   *
   * @return the period, never null
   */
  public Duration duration() {
    return duration;
  }

  /**
   * Renders the policy in the server's expression syntax.
   *
   * @return the expression, never null
   */
  public String toExpression() {
    final long seconds = duration.getSeconds();
    final String period;
    if (seconds % 3600 == 0) {
      period = (seconds / 3600) + "h";
    } else if (seconds % 60 == 0) {
      period = (seconds / 60) + "m";
    } else {
      period = seconds + "s";
    }
    return "when subscriptions < " + subscriptions + " for " + period;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RemovalPolicy)) {
      return false;
    }
    final RemovalPolicy that = (RemovalPolicy) other;
    return subscriptions == that.subscriptions
        && duration.equals(that.duration);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return Objects.hash(subscriptions, duration);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return toExpression();
  }
}
