package com.scholary.syncmap.fragment;

import com.scholary.syncmap.timing.TimeInterval;
import java.util.Objects;

/**
 * A piece of the timeline: a time interval plus whatever it was aligned to.
 *
 * <p>The payload is opaque to the fragment list (typically the text and speaker of a transcript
 * segment) and may be null.
 *
 * <p>Note: the natural order compares intervals only, so it is inconsistent with {@link
 * #equals(Object)} when two fragments share an interval but carry different payloads.
 *
 * @param <T> the payload type
 */
public record SyncMapFragment<T>(TimeInterval interval, T payload, FragmentType type)
    implements Comparable<SyncMapFragment<T>> {

  public SyncMapFragment {
    Objects.requireNonNull(interval, "interval must not be null");
    Objects.requireNonNull(type, "type must not be null");
  }

  /** Create a regular fragment. */
  public SyncMapFragment(TimeInterval interval, T payload) {
    this(interval, payload, FragmentType.REGULAR);
  }

  public SyncMapFragment<T> withInterval(TimeInterval newInterval) {
    return new SyncMapFragment<>(newInterval, payload, type);
  }

  public boolean isRegular() {
    return type == FragmentType.REGULAR;
  }

  public boolean hasZeroLength() {
    return interval.hasZeroLength();
  }

  @Override
  public int compareTo(SyncMapFragment<T> other) {
    return interval.compareTo(other.interval);
  }
}
