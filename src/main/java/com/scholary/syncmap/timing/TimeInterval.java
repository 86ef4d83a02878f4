package com.scholary.syncmap.timing;

import java.util.Comparator;
import java.util.Objects;

/**
 * A closed time interval {@code [begin, end]} with exact boundaries.
 *
 * <p>Used for fragment boundaries in a sync map. Both boundaries are non-negative and {@code begin
 * <= end}; an interval with {@code begin == end} is a point (zero length).
 *
 * <p>Intervals are immutable. The geometry operations ({@link #offset}, {@link #shrink}, {@link
 * #enlarge}, {@link #moveEndTo}) return a new interval and leave this one untouched.
 */
public record TimeInterval(TimeValue begin, TimeValue end) implements Comparable<TimeInterval> {

  private static final Comparator<TimeInterval> ORDER =
      Comparator.comparing(TimeInterval::begin).thenComparing(TimeInterval::end);

  public TimeInterval {
    Objects.requireNonNull(begin, "begin must not be null");
    Objects.requireNonNull(end, "end must not be null");
    if (begin.isNegative()) {
      throw new IllegalArgumentException("Begin time cannot be negative: " + begin);
    }
    if (end.isBefore(begin)) {
      throw new IllegalArgumentException("End time must be >= begin time: " + begin + " > " + end);
    }
  }

  public static TimeInterval of(String begin, String end) {
    return new TimeInterval(TimeValue.of(begin), TimeValue.of(end));
  }

  public TimeValue length() {
    return end.minus(begin);
  }

  public boolean hasZeroLength() {
    return begin.equals(end);
  }

  /**
   * Check if this interval contains a given time point.
   *
   * @param time the time to check
   * @return true if time is within [begin, end]
   */
  public boolean contains(TimeValue time) {
    return !time.isBefore(begin) && !time.isAfter(end);
  }

  /** True if this interval ends exactly where {@code other} begins. */
  public boolean isAdjacentBefore(TimeInterval other) {
    return end.equals(other.begin);
  }

  /** True if this interval begins exactly where {@code other} ends. */
  public boolean isAdjacentAfter(TimeInterval other) {
    return begin.equals(other.end);
  }

  /**
   * Classify where {@code other} lies with respect to this interval.
   *
   * @param other the interval to locate
   * @return the relative position of {@code other}
   */
  public RelativePosition relativePositionOf(TimeInterval other) {
    return RelativePosition.of(this, other);
  }

  public TimeInterval offset(TimeValue delta) {
    return offset(delta, null, null);
  }

  /**
   * Shift both boundaries by {@code delta}, then clamp.
   *
   * <p>Each boundary is first clamped at zero. Then, when given, {@code minBegin} and {@code
   * maxEnd} bound the result: {@code begin} is kept within {@code [minBegin, maxEnd]} and {@code
   * end} is kept at or below {@code maxEnd}. If clamping pushed {@code end} before {@code begin},
   * the result collapses to the point {@code begin}.
   *
   * @param delta the shift, possibly negative
   * @param minBegin lowest allowed begin, or null for no lower bound besides zero
   * @param maxEnd highest allowed end, or null for no upper bound
   * @return the shifted interval
   */
  public TimeInterval offset(TimeValue delta, TimeValue minBegin, TimeValue maxEnd) {
    Objects.requireNonNull(delta, "delta must not be null");
    TimeValue newBegin = begin.plus(delta).max(TimeValue.ZERO);
    TimeValue newEnd = end.plus(delta).max(TimeValue.ZERO);
    if (minBegin != null) {
      newBegin = newBegin.max(minBegin);
    }
    if (maxEnd != null) {
      newBegin = newBegin.min(maxEnd);
      newEnd = newEnd.min(maxEnd);
    }
    return new TimeInterval(newBegin, newEnd.max(newBegin));
  }

  /**
   * Move {@code begin} forward by {@code amount}, keeping {@code end}.
   *
   * @throws IllegalArgumentException if amount is negative or longer than this interval
   */
  public TimeInterval shrink(TimeValue amount) {
    requireNonNegative(amount);
    if (amount.isAfter(length())) {
      throw new IllegalArgumentException(
          "Cannot shrink interval of length " + length() + " by " + amount);
    }
    return new TimeInterval(begin.plus(amount), end);
  }

  /**
   * Move {@code begin} backward by {@code amount}, keeping {@code end}.
   *
   * @throws IllegalArgumentException if amount is negative or begin would become negative
   */
  public TimeInterval enlarge(TimeValue amount) {
    requireNonNegative(amount);
    return new TimeInterval(begin.minus(amount), end);
  }

  /**
   * Translate this interval so that it ends at {@code point}. The length is preserved.
   *
   * @throws IllegalArgumentException if the translated begin would be negative
   */
  public TimeInterval moveEndTo(TimeValue point) {
    Objects.requireNonNull(point, "point must not be null");
    return new TimeInterval(point.minus(length()), point);
  }

  @Override
  public int compareTo(TimeInterval other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "[" + begin + ", " + end + "]";
  }

  private static void requireNonNegative(TimeValue amount) {
    Objects.requireNonNull(amount, "amount must not be null");
    if (amount.isNegative()) {
      throw new IllegalArgumentException("Amount cannot be negative: " + amount);
    }
  }
}
