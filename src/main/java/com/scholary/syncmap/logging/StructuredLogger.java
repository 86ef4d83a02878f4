package com.scholary.syncmap.logging;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in the MDC for the duration of the log call, so that they can be
 * queried in a log aggregator.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a fragment list assembled from unchecked appends. */
  public void logListAssembled(int fragmentCount, String begin, String end) {
    try {
      MDC.put("event_type", "list_assembled");
      MDC.put("fragmentCount", String.valueOf(fragmentCount));
      MDC.put("begin", begin);
      MDC.put("end", end);

      logger.info(
          "Fragment list assembled: fragments={}, range=[{}-{}]", fragmentCount, begin, end);
    } finally {
      clearEventFields();
    }
  }

  /** Log a fragment list rejected because two of its fragments overlap. */
  public void logListRejected(int fragmentCount, String message) {
    try {
      MDC.put("event_type", "list_rejected");
      MDC.put("fragmentCount", String.valueOf(fragmentCount));

      logger.warn("Fragment list rejected: fragments={}, reason={}", fragmentCount, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a global shift of a fragment list. */
  public void logOffsetApplied(int fragmentCount, String delta) {
    try {
      MDC.put("event_type", "offset_applied");
      MDC.put("fragmentCount", String.valueOf(fragmentCount));
      MDC.put("delta", delta);

      logger.debug("Offset applied: fragments={}, delta={}s", fragmentCount, delta);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of a zero-length repair pass. */
  public void logZeroLengthRepair(String offset, List<Integer> repaired, List<Integer> unrepaired) {
    try {
      MDC.put("event_type", "zero_length_repair");
      MDC.put("offset", offset);
      MDC.put("repairedCount", String.valueOf(repaired.size()));
      MDC.put("unrepairedCount", String.valueOf(unrepaired.size()));

      if (unrepaired.isEmpty()) {
        logger.debug("Zero-length repair: offset={}s, repaired={}", offset, repaired.size());
      } else {
        logger.warn(
            "Zero-length repair incomplete: offset={}s, repaired={}, unrepaired indices={}",
            offset,
            repaired.size(),
            unrepaired);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fragmentCount");
    MDC.remove("begin");
    MDC.remove("end");
    MDC.remove("delta");
    MDC.remove("offset");
    MDC.remove("repairedCount");
    MDC.remove("unrepairedCount");
  }
}
