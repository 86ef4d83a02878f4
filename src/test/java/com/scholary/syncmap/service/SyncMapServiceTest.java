package com.scholary.syncmap.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.config.SyncMapProperties.RepairProperties;
import com.scholary.syncmap.fragment.FragmentOverlapException;
import com.scholary.syncmap.fragment.SyncMapFragment;
import com.scholary.syncmap.fragment.SyncMapFragmentList;
import com.scholary.syncmap.fragment.ZeroLengthRepairResult;
import com.scholary.syncmap.logging.StructuredLogger;
import com.scholary.syncmap.timing.TimeInterval;
import com.scholary.syncmap.timing.TimeValue;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for SyncMapService with a mocked structured logger. */
@ExtendWith(MockitoExtension.class)
class SyncMapServiceTest {

  @Mock private StructuredLogger structuredLogger;

  private SyncMapService service(String offset, boolean afterOffset) {
    SyncMapProperties properties =
        new SyncMapProperties(new RepairProperties(new BigDecimal(offset), afterOffset));
    return new SyncMapService(properties, structuredLogger);
  }

  private static SyncMapFragment<String> fragment(String begin, String end, String text) {
    return new SyncMapFragment<>(TimeInterval.of(begin, end), text);
  }

  @Test
  void assemble_shouldSortFragments() {
    SyncMapService service = service("0.001", true);

    SyncMapFragmentList<String> list =
        service.assemble(
            TimeValue.ZERO,
            TimeValue.of("10"),
            List.of(fragment("2", "5", "world"), fragment("0", "2", "hello")));

    assertThat(list.isGuaranteedSorted()).isTrue();
    assertThat(list.fragments())
        .extracting(SyncMapFragment::payload)
        .containsExactly("hello", "world");
    verify(structuredLogger).logListAssembled(2, "0", "10");
  }

  @Test
  void assemble_shouldLogAndRethrowOverlap() {
    SyncMapService service = service("0.001", true);
    List<SyncMapFragment<String>> fragments =
        List.of(fragment("0", "3", "hello"), fragment("2", "5", "world"));

    assertThatThrownBy(() -> service.assemble(TimeValue.ZERO, TimeValue.of("10"), fragments))
        .isInstanceOf(FragmentOverlapException.class);
    verify(structuredLogger).logListRejected(eq(2), anyString());
    verify(structuredLogger, never()).logListAssembled(anyInt(), any(), any());
  }

  @Test
  void shift_shouldReportFragmentCollapsedAtListEnd() {
    SyncMapService service = service("0.001", true);
    SyncMapFragmentList<String> list = new SyncMapFragmentList<>(TimeValue.ZERO, TimeValue.of("2"));
    list.add(fragment("0", "1", "hello"));
    list.add(fragment("1", "2", "world"));

    Optional<ZeroLengthRepairResult> result = service.shift(list, TimeValue.of("1"));

    assertThat(result).isPresent();
    assertThat(result.get().unrepaired()).containsExactly(1);
    assertThat(list.get(1).interval()).isEqualTo(TimeInterval.of("2", "2"));
    verify(structuredLogger).logOffsetApplied(2, "1");
    verify(structuredLogger).logZeroLengthRepair("0.001", List.of(), List.of(1));
  }

  @Test
  void shift_shouldSkipRepairWhenDisabled() {
    SyncMapService service = service("0.001", false);
    SyncMapFragmentList<String> list = new SyncMapFragmentList<>(TimeValue.ZERO, TimeValue.of("2"));
    list.add(fragment("0", "1", "hello"));

    Optional<ZeroLengthRepairResult> result = service.shift(list, TimeValue.of("5"));

    assertThat(result).isEmpty();
    assertThat(list.get(0).interval()).isEqualTo(TimeInterval.of("2", "2"));
    verify(structuredLogger, never()).logZeroLengthRepair(anyString(), any(), any());
  }

  @Test
  void repairZeroLengthFragments_shouldUseConfiguredOffset() {
    SyncMapService service = service("0.5", true);
    SyncMapFragmentList<String> list = new SyncMapFragmentList<>(TimeValue.ZERO, TimeValue.of("4"));
    list.add(fragment("0", "0", "hello"));
    list.add(fragment("0", "4", "world"));

    ZeroLengthRepairResult result = service.repairZeroLengthFragments(list);

    assertThat(result.repaired()).containsExactly(0);
    assertThat(list.get(0).interval()).isEqualTo(TimeInterval.of("0", "0.5"));
    assertThat(list.get(1).interval()).isEqualTo(TimeInterval.of("0.5", "4"));
    verify(structuredLogger).logZeroLengthRepair("0.5", List.of(0), List.of());
  }
}
