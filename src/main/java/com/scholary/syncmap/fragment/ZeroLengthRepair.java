package com.scholary.syncmap.fragment;

import com.scholary.syncmap.timing.TimeInterval;
import com.scholary.syncmap.timing.TimeValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gives length to a zero-length fragment by borrowing it from the fragments that follow.
 *
 * <p>The repair runs in two passes:
 *
 * <ol>
 *   <li>{@link #plan}: walk forward from the zero-length fragment, collecting every fragment too
 *       short to absorb the length still needed (the <em>slack</em>). Each further zero-length
 *       fragment met on the way also needs {@code offset} and adds it to the slack. The walk stops
 *       at the first fragment long enough to donate the slack, or at the end of the range, where
 *       the slack can only come from the room before the next fragment, or before the list end.
 *   <li>{@link #apply}: shrink the donor (if any), then rewrite the collected fragments backward,
 *       each one ending where its successor now begins, so the chain stays contiguous.
 * </ol>
 *
 * <p>Assumes the fragments in the range are consecutive (each ends where the next begins).
 */
final class ZeroLengthRepair {

  enum MoveType {
    /** Translate the fragment, then grow it by the move amount. */
    ENLARGE,
    /** Translate the fragment, keeping its length. */
    MOVE
  }

  record PendingMove(int index, MoveType type, TimeValue amount) {}

  /**
   * Result of the forward pass.
   *
   * @param moves pending moves, in forward order
   * @param nextIndex index just past the examined chain; scanning resumes here
   * @param slack total length that must be found for the chain
   * @param donorIndex index of the fragment donating the slack, or -1 if the list end absorbs it
   * @param anchor end of the last moved fragment after repair, or null if infeasible
   */
  record Plan(
      List<PendingMove> moves, int nextIndex, TimeValue slack, int donorIndex, TimeValue anchor) {

    boolean isFeasible() {
      return anchor != null;
    }

    List<Integer> enlargedIndices() {
      return moves.stream()
          .filter(move -> move.type() == MoveType.ENLARGE)
          .map(PendingMove::index)
          .toList();
    }
  }

  private ZeroLengthRepair() {}

  /**
   * Measure the repair of the zero-length fragment at {@code index}. Does not mutate anything.
   *
   * @param fragments the fragments of the list
   * @param listEnd the list end, or null if unbounded
   * @param index index of a zero-length fragment
   * @param offset length to give to each zero-length fragment
   * @param maxIndex exclusive upper index of the range being repaired
   */
  static <T> Plan plan(
      List<SyncMapFragment<T>> fragments,
      TimeValue listEnd,
      int index,
      TimeValue offset,
      int maxIndex) {
    List<PendingMove> moves = new ArrayList<>();
    moves.add(new PendingMove(index, MoveType.ENLARGE, offset));
    TimeValue slack = offset;

    int j = index + 1;
    while (j < maxIndex && fragments.get(j).interval().length().isBefore(slack)) {
      if (fragments.get(j).hasZeroLength()) {
        moves.add(new PendingMove(j, MoveType.ENLARGE, offset));
        slack = slack.plus(offset);
      } else {
        moves.add(new PendingMove(j, MoveType.MOVE, null));
      }
      j++;
    }

    TimeValue anchor = null;
    int donorIndex = -1;
    if (j == maxIndex) {
      // room past the range ends at the next fragment, or at the list end for the last one
      TimeValue limit =
          maxIndex < fragments.size() ? fragments.get(maxIndex).interval().begin() : listEnd;
      TimeValue extendedEnd = fragments.get(j - 1).interval().end().plus(slack);
      if (limit == null || !extendedEnd.isAfter(limit)) {
        anchor = extendedEnd;
      }
    } else {
      donorIndex = j;
      anchor = fragments.get(j).interval().begin().plus(slack);
    }
    return new Plan(List.copyOf(moves), j, slack, donorIndex, anchor);
  }

  /**
   * Apply a feasible plan. All new intervals are computed before the list is written.
   *
   * @throws IllegalArgumentException if the fragments were not consecutive and a rewritten
   *     interval would be invalid; the list is then left unchanged
   */
  static <T> void apply(List<SyncMapFragment<T>> fragments, Plan plan) {
    if (!plan.isFeasible()) {
      throw new IllegalStateException("Cannot apply an infeasible repair plan");
    }
    Map<Integer, TimeInterval> rewritten = new LinkedHashMap<>();
    if (plan.donorIndex() >= 0) {
      rewritten.put(
          plan.donorIndex(), fragments.get(plan.donorIndex()).interval().shrink(plan.slack()));
    }

    TimeValue currentTime = plan.anchor();
    List<PendingMove> moves = plan.moves();
    for (int k = moves.size() - 1; k >= 0; k--) {
      PendingMove move = moves.get(k);
      TimeInterval interval = fragments.get(move.index()).interval().moveEndTo(currentTime);
      if (move.type() == MoveType.ENLARGE) {
        interval = interval.enlarge(move.amount());
      }
      rewritten.put(move.index(), interval);
      currentTime = interval.begin();
    }

    rewritten.forEach(
        (index, interval) -> fragments.set(index, fragments.get(index).withInterval(interval)));
  }
}
