package com.scholary.syncmap.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for sync map processing.
 *
 * <p>Controls how degenerate (zero-length) fragments are repaired.
 */
@ConfigurationProperties(prefix = "syncmap")
@Validated
public record SyncMapProperties(@Valid @NotNull RepairProperties repair) {

  /**
   * @param zeroLengthOffset length in seconds given to each zero-length fragment
   * @param afterOffset whether to repair zero-length fragments after shifting a list
   */
  public record RepairProperties(
      @NotNull @Positive BigDecimal zeroLengthOffset, boolean afterOffset) {}
}
