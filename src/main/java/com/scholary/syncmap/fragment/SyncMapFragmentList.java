package com.scholary.syncmap.fragment;

import com.scholary.syncmap.timing.RelativePosition;
import com.scholary.syncmap.timing.TimeInterval;
import com.scholary.syncmap.timing.TimeValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered list of sync map fragments partitioning a timeline.
 *
 * <p>The list enforces these constraints:
 *
 * <ul>
 *   <li>every fragment lies within the list begin and end (when set)
 *   <li>two fragments may only touch at a single boundary point, never share length
 *   <li>fragments are kept sorted by interval
 * </ul>
 *
 * <p>The last two only hold while {@link #isGuaranteedSorted()} is true. An unchecked {@code
 * add(fragment, false)} clears that flag until the next successful {@link #sort()}.
 *
 * <p>Two operations are best effort and never throw for unmet preconditions: {@link #moveEnd} and
 * {@link #fixZeroLengthIntervals}. Their return values tell whether anything changed.
 *
 * <p>Not thread-safe. Callers sharing a list across threads must synchronize externally.
 *
 * @param <T> the payload type of the fragments
 */
public class SyncMapFragmentList<T> implements Iterable<SyncMapFragment<T>> {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncMapFragmentList.class);

  /** Length given to each zero-length fragment when no other value is requested. */
  public static final TimeValue DEFAULT_ZERO_LENGTH_OFFSET = TimeValue.of("0.001");

  private final TimeValue begin;
  private final TimeValue end;
  private final List<SyncMapFragment<T>> fragments = new ArrayList<>();
  private boolean sorted = true;

  /** Create a list starting at zero with no end. */
  public SyncMapFragmentList() {
    this(TimeValue.ZERO, null);
  }

  /**
   * Create an empty list.
   *
   * @param begin the begin time, or null for no lower bound
   * @param end the end time, or null for no upper bound
   * @throws IllegalArgumentException if begin is negative or after end
   */
  public SyncMapFragmentList(TimeValue begin, TimeValue end) {
    if (begin != null) {
      if (begin.isNegative()) {
        throw new IllegalArgumentException("List begin cannot be negative: " + begin);
      }
      if (end != null && begin.isAfter(end)) {
        throw new IllegalArgumentException(
            "List begin must be <= list end: " + begin + " > " + end);
      }
    }
    this.begin = begin;
    this.end = end;
  }

  public Optional<TimeValue> begin() {
    return Optional.ofNullable(begin);
  }

  public Optional<TimeValue> end() {
    return Optional.ofNullable(end);
  }

  public int size() {
    return fragments.size();
  }

  public boolean isEmpty() {
    return fragments.isEmpty();
  }

  public SyncMapFragment<T> get(int index) {
    return fragments.get(index);
  }

  /**
   * Replace the fragment at {@code index}.
   *
   * <p>The replacement must respect the list bounds. If it is out of order with, or overlaps, one
   * of its neighbours the list is no longer guaranteed sorted.
   *
   * @throws IndexOutOfBoundsException if index is out of range
   * @throws FragmentBoundsException if the fragment lies outside the list bounds
   */
  public void set(int index, SyncMapFragment<T> fragment) {
    Objects.checkIndex(index, fragments.size());
    Objects.requireNonNull(fragment, "fragment must not be null");
    checkBoundaries(fragment);
    fragments.set(index, fragment);
    if (sorted && !(fitsAfter(index - 1) && fitsAfter(index))) {
      LOGGER.debug("Fragment set at index {} breaks ordering, list flagged unsorted", index);
      sorted = false;
    }
  }

  /** Add a fragment keeping the list sorted. */
  public void add(SyncMapFragment<T> fragment) {
    add(fragment, true);
  }

  /**
   * Add a fragment to the list.
   *
   * <p>With {@code sort} set, the fragment is checked against every fragment already present and
   * inserted at its sorted position, to the right of any fragment with an equal interval. Without
   * it, the fragment is appended without overlap check and the list stops being guaranteed sorted;
   * a later {@link #sort()} validates the appended fragments.
   *
   * @param fragment the fragment to add
   * @param sort whether to insert at the sorted position
   * @throws FragmentBoundsException if the fragment lies outside the list bounds
   * @throws FragmentListStateException if sort is requested but the list is not guaranteed sorted
   * @throws FragmentOverlapException if the fragment overlaps an existing one
   */
  public void add(SyncMapFragment<T> fragment, boolean sort) {
    Objects.requireNonNull(fragment, "fragment must not be null");
    checkBoundaries(fragment);
    if (sort) {
      if (!sorted) {
        throw new FragmentListStateException(
            "Unable to add with sort=true if the list is not guaranteed sorted");
      }
      checkOverlap(fragment);
      fragments.add(insertionPoint(fragment), fragment);
    } else {
      fragments.add(fragment);
      sorted = false;
    }
  }

  /**
   * Sort the fragments, if they are not guaranteed sorted already.
   *
   * <p>After sorting, every pair of neighbours is validated. On failure the fragments stay in
   * sorted order but the list is still not guaranteed sorted.
   *
   * @throws FragmentOverlapException if two neighbouring fragments overlap
   */
  public void sort() {
    if (sorted) {
      return;
    }
    Collections.sort(fragments);
    for (int i = 0; i < fragments.size() - 1; i++) {
      RelativePosition position = positionOfNext(i);
      if (position.isForbidden()) {
        throw new FragmentOverlapException(
            String.format(
                "The list contains two fragments overlapping in a forbidden way: %s and %s (%s)",
                fragments.get(i).interval(), fragments.get(i + 1).interval(), position));
      }
    }
    sorted = true;
    LOGGER.debug("Sorted fragment list with {} fragments", fragments.size());
  }

  /**
   * Return true if the list is sorted, false if it might not be (for example after an unchecked
   * add).
   */
  public boolean isGuaranteedSorted() {
    return sorted;
  }

  /**
   * Move the boundary shared by the fragments at {@code index} and {@code index + 1} to {@code
   * value}.
   *
   * <p>Does nothing unless: the value is within the list bounds, both indices exist, the two
   * fragments are adjacent, and the value lies within {@code [fragment(index).begin,
   * fragment(index + 1).end]}.
   *
   * @return true if the boundary was moved
   */
  public boolean moveEnd(int index, TimeValue value) {
    Objects.requireNonNull(value, "value must not be null");
    if ((begin != null && value.isBefore(begin))
        || (end != null && value.isAfter(end))
        || index < 0
        || index + 1 >= fragments.size()) {
      return false;
    }
    SyncMapFragment<T> current = fragments.get(index);
    SyncMapFragment<T> next = fragments.get(index + 1);
    if (value.isAfter(next.interval().end())
        || value.isBefore(current.interval().begin())
        || !current.interval().isAdjacentBefore(next.interval())) {
      return false;
    }
    fragments.set(
        index, current.withInterval(new TimeInterval(current.interval().begin(), value)));
    fragments.set(index + 1, next.withInterval(new TimeInterval(value, next.interval().end())));
    return true;
  }

  /** Unmodifiable snapshot of the fragments, in stored order. */
  public List<SyncMapFragment<T>> fragments() {
    return List.copyOf(fragments);
  }

  @Override
  public Iterator<SyncMapFragment<T>> iterator() {
    return fragments().iterator();
  }

  /** The fragments of the given type, in stored order. */
  public List<SyncMapFragment<T>> fragmentsOfType(FragmentType type) {
    return fragments.stream().filter(f -> f.type() == type).toList();
  }

  public List<SyncMapFragment<T>> regularFragments() {
    return fragmentsOfType(FragmentType.REGULAR);
  }

  public List<SyncMapFragment<T>> nonspeechFragments() {
    return fragmentsOfType(FragmentType.NONSPEECH);
  }

  /**
   * Shift every fragment by {@code delta}.
   *
   * <p>Each interval is clamped independently to the list bounds (and to zero), so fragments
   * pushed against a bound can collapse to zero length.
   *
   * @param delta the shift, possibly negative
   */
  public void offset(TimeValue delta) {
    Objects.requireNonNull(delta, "offset must not be null");
    fragments.replaceAll(f -> f.withInterval(f.interval().offset(delta, begin, end)));
  }

  /** Repair all zero-length fragments using {@link #DEFAULT_ZERO_LENGTH_OFFSET}. */
  public ZeroLengthRepairResult fixZeroLengthIntervals() {
    return fixZeroLengthIntervals(DEFAULT_ZERO_LENGTH_OFFSET);
  }

  public ZeroLengthRepairResult fixZeroLengthIntervals(TimeValue offset) {
    return fixZeroLengthIntervals(offset, 0, fragments.size());
  }

  /**
   * Give {@code offset} of length to every zero-length fragment in {@code [minIndex, maxIndex)}.
   *
   * <p>The length is taken from the first following fragment long enough to donate it; fragments
   * in between are shifted. If no fragment in the range can donate, the room after the last
   * fragment of the range is used, up to the next fragment or, at the tail, the list end. When
   * neither works the zero-length fragment is left as is and reported in {@link
   * ZeroLengthRepairResult#unrepaired()}; nothing is thrown.
   *
   * <p>The fragments in the range are expected to be consecutive.
   *
   * @param offset length to give each zero-length fragment, must be positive
   * @param minIndex first index to examine, inclusive
   * @param maxIndex last index to examine, exclusive
   * @return which zero-length fragments were repaired and which were not
   */
  public ZeroLengthRepairResult fixZeroLengthIntervals(
      TimeValue offset, int minIndex, int maxIndex) {
    Objects.requireNonNull(offset, "offset must not be null");
    if (!offset.isPositive()) {
      throw new IllegalArgumentException("Repair offset must be positive: " + offset);
    }
    Objects.checkFromToIndex(minIndex, maxIndex, fragments.size());

    List<Integer> repaired = new ArrayList<>();
    List<Integer> unrepaired = new ArrayList<>();
    int i = minIndex;
    while (i < maxIndex) {
      if (!fragments.get(i).hasZeroLength()) {
        i++;
        continue;
      }
      ZeroLengthRepair.Plan plan = ZeroLengthRepair.plan(fragments, end, i, offset, maxIndex);
      if (plan.isFeasible()) {
        ZeroLengthRepair.apply(fragments, plan);
        repaired.addAll(plan.enlargedIndices());
      } else {
        unrepaired.addAll(plan.enlargedIndices());
      }
      i = plan.nextIndex();
    }
    return new ZeroLengthRepairResult(repaired, unrepaired);
  }

  /** True if any fragment in {@code [minIndex, maxIndex)} has zero length. */
  public boolean hasZeroLengthFragments(int minIndex, int maxIndex) {
    Objects.checkFromToIndex(minIndex, maxIndex, fragments.size());
    return fragments.subList(minIndex, maxIndex).stream().anyMatch(SyncMapFragment::hasZeroLength);
  }

  public boolean hasZeroLengthFragments() {
    return hasZeroLengthFragments(0, fragments.size());
  }

  /** True if every fragment in {@code [minIndex, maxIndex)} ends where the next one begins. */
  public boolean hasAdjacentFragmentsOnly(int minIndex, int maxIndex) {
    Objects.checkFromToIndex(minIndex, maxIndex, fragments.size());
    for (int i = minIndex; i < maxIndex - 1; i++) {
      if (!fragments.get(i).interval().isAdjacentBefore(fragments.get(i + 1).interval())) {
        return false;
      }
    }
    return true;
  }

  public boolean hasAdjacentFragmentsOnly() {
    return hasAdjacentFragmentsOnly(0, fragments.size());
  }

  /**
   * Remove the fragments at the given indices. Duplicated indices are removed once.
   *
   * @throws IndexOutOfBoundsException if any index is out of range; nothing is removed then
   */
  public void remove(Collection<Integer> indices) {
    TreeSet<Integer> unique = new TreeSet<>(Collections.reverseOrder());
    for (Integer index : indices) {
      unique.add(Objects.checkIndex(index, fragments.size()));
    }
    for (int index : unique) {
      fragments.remove(index);
    }
  }

  /** Copy of this list with the same bounds, fragments and sorted flag. */
  public SyncMapFragmentList<T> copy() {
    SyncMapFragmentList<T> copy = new SyncMapFragmentList<>(begin, end);
    copy.fragments.addAll(fragments);
    copy.sorted = sorted;
    return copy;
  }

  @Override
  public String toString() {
    return String.format(
        "SyncMapFragmentList[begin=%s, end=%s, size=%d, sorted=%s]",
        begin, end, fragments.size(), sorted);
  }

  private void checkBoundaries(SyncMapFragment<T> fragment) {
    TimeInterval interval = fragment.interval();
    if (begin != null && interval.begin().isBefore(begin)) {
      throw new FragmentBoundsException(
          "Fragment begin " + interval.begin() + " is before list begin " + begin);
    }
    if (end != null && interval.end().isAfter(end)) {
      throw new FragmentBoundsException(
          "Fragment end " + interval.end() + " is after list end " + end);
    }
  }

  // Full scan: the allowed-position test is not monotonic over begin/end, so bisection over
  // either boundary alone misses a short fragment nested in a long one.
  private void checkOverlap(SyncMapFragment<T> fragment) {
    for (SyncMapFragment<T> existing : fragments) {
      RelativePosition position = existing.interval().relativePositionOf(fragment.interval());
      if (position.isForbidden()) {
        LOGGER.debug(
            "Rejected fragment {}: {} relative to {}",
            fragment.interval(),
            position,
            existing.interval());
        throw new FragmentOverlapException(
            String.format(
                "Interval %s overlaps already present interval %s (%s)",
                fragment.interval(), existing.interval(), position));
      }
    }
  }

  /** Index right of any fragment comparing equal to {@code fragment}. */
  private int insertionPoint(SyncMapFragment<T> fragment) {
    int low = 0;
    int high = fragments.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (fragment.compareTo(fragments.get(mid)) < 0) {
        high = mid;
      } else {
        low = mid + 1;
      }
    }
    return low;
  }

  private RelativePosition positionOfNext(int index) {
    return fragments.get(index).interval().relativePositionOf(fragments.get(index + 1).interval());
  }

  /** True if the pair at {@code (index, index + 1)} is ordered and allowed, or does not exist. */
  private boolean fitsAfter(int index) {
    if (index < 0 || index + 1 >= fragments.size()) {
      return true;
    }
    return fragments.get(index).compareTo(fragments.get(index + 1)) <= 0
        && positionOfNext(index).isAllowed();
  }
}
