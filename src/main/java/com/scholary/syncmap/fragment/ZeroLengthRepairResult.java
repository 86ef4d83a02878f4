package com.scholary.syncmap.fragment;

import java.util.List;

/**
 * Outcome of a zero-length repair pass over a fragment list.
 *
 * @param repaired indices of fragments that had zero length and were given length
 * @param unrepaired indices of zero-length fragments for which no feasible repair existed
 */
public record ZeroLengthRepairResult(List<Integer> repaired, List<Integer> unrepaired) {

  public ZeroLengthRepairResult {
    repaired = List.copyOf(repaired);
    unrepaired = List.copyOf(unrepaired);
  }

  /** True if no zero-length fragment was left behind. */
  public boolean isComplete() {
    return unrepaired.isEmpty();
  }

  public int repairedCount() {
    return repaired.size();
  }
}
