package com.scholary.syncmap.timing;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An exact point in time, in seconds.
 *
 * <p>Backed by {@link BigDecimal} so that repeated offsets and boundary moves never accumulate
 * floating point drift. Two values are equal when they are numerically equal, regardless of scale
 * ({@code 1.0} equals {@code 1.000}).
 */
public record TimeValue(BigDecimal seconds) implements Comparable<TimeValue> {

  public static final TimeValue ZERO = new TimeValue(BigDecimal.ZERO);

  public TimeValue {
    Objects.requireNonNull(seconds, "seconds must not be null");
  }

  public static TimeValue of(String seconds) {
    Objects.requireNonNull(seconds, "seconds must not be null");
    try {
      return new TimeValue(new BigDecimal(seconds.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a valid time value: '" + seconds + "'", e);
    }
  }

  public static TimeValue of(BigDecimal seconds) {
    return new TimeValue(seconds);
  }

  /**
   * Create a time value from a double, using its canonical decimal representation.
   *
   * <p>{@code ofSeconds(0.1)} is exactly {@code 0.1}, not the nearest binary fraction.
   */
  public static TimeValue ofSeconds(double seconds) {
    return new TimeValue(BigDecimal.valueOf(seconds));
  }

  public TimeValue plus(TimeValue other) {
    return new TimeValue(seconds.add(other.seconds));
  }

  public TimeValue minus(TimeValue other) {
    return new TimeValue(seconds.subtract(other.seconds));
  }

  public boolean isZero() {
    return seconds.signum() == 0;
  }

  public boolean isNegative() {
    return seconds.signum() < 0;
  }

  public boolean isPositive() {
    return seconds.signum() > 0;
  }

  public boolean isBefore(TimeValue other) {
    return compareTo(other) < 0;
  }

  public boolean isAfter(TimeValue other) {
    return compareTo(other) > 0;
  }

  public TimeValue min(TimeValue other) {
    return compareTo(other) <= 0 ? this : other;
  }

  public TimeValue max(TimeValue other) {
    return compareTo(other) >= 0 ? this : other;
  }

  public double toSeconds() {
    return seconds.doubleValue();
  }

  @Override
  public int compareTo(TimeValue other) {
    return seconds.compareTo(other.seconds);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeValue other)) {
      return false;
    }
    return seconds.compareTo(other.seconds) == 0;
  }

  @Override
  public int hashCode() {
    return isZero() ? 0 : seconds.stripTrailingZeros().hashCode();
  }

  @Override
  public String toString() {
    return seconds.toPlainString();
  }
}
