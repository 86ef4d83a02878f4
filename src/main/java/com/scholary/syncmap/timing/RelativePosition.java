package com.scholary.syncmap.timing;

/**
 * Qualitative position of an interval ({@code other}) with respect to a reference interval.
 *
 * <p>Categories are split by the shape of the two operands, since a zero-length interval (a point)
 * can sit on a boundary without sharing any length:
 *
 * <ul>
 *   <li>{@code POINT_*_POINT}: both are points
 *   <li>{@code POINT_*}: the reference is an interval, {@code other} is a point
 *   <li>{@code INTERVAL_*_POINT}: the reference is a point, {@code other} is an interval
 *   <li>{@code INTERVAL_*}: both are intervals
 * </ul>
 *
 * <p>A position is <em>allowed</em> when the two intervals are disjoint except for possibly one
 * shared boundary point. Fragments of a sync map may only be in allowed positions with respect to
 * each other.
 */
public enum RelativePosition {
  POINT_BEFORE_POINT,
  POINT_AT_POINT,
  POINT_AFTER_POINT,

  POINT_BEFORE_INTERVAL,
  POINT_AT_BEGIN,
  POINT_INSIDE,
  POINT_AT_END,
  POINT_AFTER_INTERVAL,

  INTERVAL_BEFORE_POINT,
  INTERVAL_ENDING_AT_POINT,
  INTERVAL_CONTAINING_POINT,
  INTERVAL_STARTING_AT_POINT,
  INTERVAL_AFTER_POINT,

  /** Other ends before the reference begins. */
  INTERVAL_BEFORE,
  /** Other ends exactly where the reference begins. */
  INTERVAL_MEETS_BEGIN,
  /** Other begins before the reference and ends inside it. */
  INTERVAL_OVERLAPS_BEGIN,
  /** Other begins before the reference and ends with it. */
  INTERVAL_ENCLOSES_TO_END,
  /** Other begins before and ends after the reference. */
  INTERVAL_ENCLOSES,
  /** Same begin, other ends inside the reference. */
  INTERVAL_STARTS,
  /** Same begin and end. */
  INTERVAL_EQUALS,
  /** Same begin, other ends after the reference. */
  INTERVAL_STARTS_AND_EXTENDS,
  /** Other lies strictly inside the reference. */
  INTERVAL_DURING,
  /** Other begins inside the reference and ends with it. */
  INTERVAL_FINISHES,
  /** Other begins inside the reference and ends after it. */
  INTERVAL_OVERLAPS_END,
  /** Other begins exactly where the reference ends. */
  INTERVAL_MEETS_END,
  /** Other begins after the reference ends. */
  INTERVAL_AFTER;

  /**
   * Classify where {@code other} lies relative to {@code reference}.
   *
   * @param reference the interval used as frame of reference
   * @param other the interval to locate
   * @return the position of {@code other}
   */
  public static RelativePosition of(TimeInterval reference, TimeInterval other) {
    TimeValue refBegin = reference.begin();
    TimeValue refEnd = reference.end();
    TimeValue otherBegin = other.begin();
    TimeValue otherEnd = other.end();

    if (other.hasZeroLength()) {
      if (reference.hasZeroLength()) {
        int cmp = otherBegin.compareTo(refBegin);
        if (cmp < 0) {
          return POINT_BEFORE_POINT;
        }
        return cmp == 0 ? POINT_AT_POINT : POINT_AFTER_POINT;
      }
      return locatePoint(otherBegin, refBegin, refEnd);
    }

    if (reference.hasZeroLength()) {
      if (otherEnd.isBefore(refBegin)) {
        return INTERVAL_BEFORE_POINT;
      }
      if (otherEnd.equals(refBegin)) {
        return INTERVAL_ENDING_AT_POINT;
      }
      if (otherBegin.isBefore(refBegin)) {
        return INTERVAL_CONTAINING_POINT;
      }
      return otherBegin.equals(refBegin) ? INTERVAL_STARTING_AT_POINT : INTERVAL_AFTER_POINT;
    }

    return switch (locatePoint(otherBegin, refBegin, refEnd)) {
      case POINT_BEFORE_INTERVAL -> switch (locatePoint(otherEnd, refBegin, refEnd)) {
        case POINT_BEFORE_INTERVAL -> INTERVAL_BEFORE;
        case POINT_AT_BEGIN -> INTERVAL_MEETS_BEGIN;
        case POINT_INSIDE -> INTERVAL_OVERLAPS_BEGIN;
        case POINT_AT_END -> INTERVAL_ENCLOSES_TO_END;
        default -> INTERVAL_ENCLOSES;
      };
      case POINT_AT_BEGIN -> {
        int cmp = otherEnd.compareTo(refEnd);
        if (cmp < 0) {
          yield INTERVAL_STARTS;
        }
        yield cmp == 0 ? INTERVAL_EQUALS : INTERVAL_STARTS_AND_EXTENDS;
      }
      case POINT_INSIDE -> {
        int cmp = otherEnd.compareTo(refEnd);
        if (cmp < 0) {
          yield INTERVAL_DURING;
        }
        yield cmp == 0 ? INTERVAL_FINISHES : INTERVAL_OVERLAPS_END;
      }
      case POINT_AT_END -> INTERVAL_MEETS_END;
      default -> INTERVAL_AFTER;
    };
  }

  /** Locate a single time point against a non-degenerate interval. */
  private static RelativePosition locatePoint(TimeValue point, TimeValue begin, TimeValue end) {
    int cmpBegin = point.compareTo(begin);
    if (cmpBegin < 0) {
      return POINT_BEFORE_INTERVAL;
    }
    if (cmpBegin == 0) {
      return POINT_AT_BEGIN;
    }
    int cmpEnd = point.compareTo(end);
    if (cmpEnd < 0) {
      return POINT_INSIDE;
    }
    return cmpEnd == 0 ? POINT_AT_END : POINT_AFTER_INTERVAL;
  }

  /**
   * True if the two intervals share at most one boundary point.
   *
   * <p>Exactly 15 of the categories are allowed.
   */
  public boolean isAllowed() {
    return switch (this) {
      case POINT_BEFORE_POINT,
          POINT_AT_POINT,
          POINT_AFTER_POINT,
          POINT_BEFORE_INTERVAL,
          POINT_AT_BEGIN,
          POINT_AT_END,
          POINT_AFTER_INTERVAL,
          INTERVAL_BEFORE_POINT,
          INTERVAL_ENDING_AT_POINT,
          INTERVAL_STARTING_AT_POINT,
          INTERVAL_AFTER_POINT,
          INTERVAL_BEFORE,
          INTERVAL_MEETS_BEGIN,
          INTERVAL_MEETS_END,
          INTERVAL_AFTER -> true;
      default -> false;
    };
  }

  public boolean isForbidden() {
    return !isAllowed();
  }
}
