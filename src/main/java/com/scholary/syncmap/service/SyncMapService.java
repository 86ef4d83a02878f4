package com.scholary.syncmap.service;

import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.fragment.FragmentOverlapException;
import com.scholary.syncmap.fragment.SyncMapFragment;
import com.scholary.syncmap.fragment.SyncMapFragmentList;
import com.scholary.syncmap.fragment.ZeroLengthRepairResult;
import com.scholary.syncmap.logging.StructuredLogger;
import com.scholary.syncmap.timing.TimeValue;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds and maintains fragment lists with the configured repair settings.
 *
 * <p>The fragment list itself never logs the outcome of its best-effort operations; this service
 * does, so that a zero-length fragment that could not be repaired shows up in the logs.
 */
@Component
public class SyncMapService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyncMapService.class);

  private final SyncMapProperties properties;
  private final StructuredLogger structuredLogger;

  @Autowired
  public SyncMapService(SyncMapProperties properties) {
    this(properties, new StructuredLogger(LOGGER));
  }

  SyncMapService(SyncMapProperties properties, StructuredLogger structuredLogger) {
    this.properties = properties;
    this.structuredLogger = structuredLogger;
  }

  /**
   * Create an empty list.
   *
   * @param begin the begin time, or null for no lower bound
   * @param end the end time, or null for no upper bound
   */
  public <T> SyncMapFragmentList<T> createList(TimeValue begin, TimeValue end) {
    return new SyncMapFragmentList<>(begin, end);
  }

  /**
   * Build a sorted list from fragments in any order.
   *
   * <p>The fragments are appended unchecked and validated by a single sort, which avoids the
   * quadratic overlap scan of sorted insertion.
   *
   * @param begin the begin time, or null for no lower bound
   * @param end the end time, or null for no upper bound
   * @param fragments the fragments, in any order
   * @return a list guaranteed sorted
   * @throws FragmentOverlapException if two fragments overlap
   */
  public <T> SyncMapFragmentList<T> assemble(
      TimeValue begin, TimeValue end, List<SyncMapFragment<T>> fragments) {
    SyncMapFragmentList<T> list = createList(begin, end);
    for (SyncMapFragment<T> fragment : fragments) {
      list.add(fragment, false);
    }
    try {
      list.sort();
    } catch (FragmentOverlapException e) {
      structuredLogger.logListRejected(fragments.size(), e.getMessage());
      throw e;
    }
    structuredLogger.logListAssembled(list.size(), String.valueOf(begin), String.valueOf(end));
    return list;
  }

  /**
   * Shift a list by {@code delta}, repairing fragments collapsed at the bounds if configured.
   *
   * @return the repair outcome, or empty when repair after offset is disabled
   */
  public <T> Optional<ZeroLengthRepairResult> shift(SyncMapFragmentList<T> list, TimeValue delta) {
    Objects.requireNonNull(list, "list must not be null");
    list.offset(delta);
    structuredLogger.logOffsetApplied(list.size(), delta.toString());
    if (!properties.repair().afterOffset()) {
      return Optional.empty();
    }
    return Optional.of(repairZeroLengthFragments(list));
  }

  /** Repair every zero-length fragment of the list with the configured offset. */
  public <T> ZeroLengthRepairResult repairZeroLengthFragments(SyncMapFragmentList<T> list) {
    Objects.requireNonNull(list, "list must not be null");
    TimeValue offset = zeroLengthOffset();
    ZeroLengthRepairResult result = list.fixZeroLengthIntervals(offset);
    structuredLogger.logZeroLengthRepair(offset.toString(), result.repaired(), result.unrepaired());
    return result;
  }

  public TimeValue zeroLengthOffset() {
    return TimeValue.of(properties.repair().zeroLengthOffset());
  }
}
