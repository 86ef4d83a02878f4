package com.scholary.syncmap.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.syncmap.config.SyncMapProperties;
import com.scholary.syncmap.fragment.SyncMapFragment;
import com.scholary.syncmap.fragment.SyncMapFragmentList;
import com.scholary.syncmap.fragment.ZeroLengthRepairResult;
import com.scholary.syncmap.service.SyncMapService;
import com.scholary.syncmap.timing.TimeInterval;
import com.scholary.syncmap.timing.TimeValue;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/** Loads the application context and runs a list through the configured service. */
@SpringBootTest
class SyncMapIntegrationTest {

  @Autowired private SyncMapService syncMapService;

  @Autowired private SyncMapProperties properties;

  @Test
  void properties_shouldBindFromApplicationYml() {
    assertThat(properties.repair().zeroLengthOffset()).isEqualByComparingTo(new BigDecimal("0.001"));
    assertThat(properties.repair().afterOffset()).isTrue();
    assertThat(syncMapService.zeroLengthOffset()).isEqualTo(TimeValue.of("0.001"));
  }

  @Test
  void assembleAndRepair_shouldProduceContiguousTimeline() {
    List<SyncMapFragment<String>> fragments =
        List.of(
            new SyncMapFragment<>(TimeInterval.of("0", "2"), "to be"),
            new SyncMapFragment<>(TimeInterval.of("2", "2"), "or"),
            new SyncMapFragment<>(TimeInterval.of("2", "2"), "not"),
            new SyncMapFragment<>(TimeInterval.of("2", "5"), "to be"));

    SyncMapFragmentList<String> list =
        syncMapService.assemble(TimeValue.ZERO, TimeValue.of("5"), fragments);
    ZeroLengthRepairResult result = syncMapService.repairZeroLengthFragments(list);

    assertThat(result.repaired()).containsExactly(1, 2);
    assertThat(list.hasZeroLengthFragments()).isFalse();
    assertThat(list.hasAdjacentFragmentsOnly()).isTrue();
    assertThat(list.fragments())
        .extracting(SyncMapFragment::payload)
        .containsExactly("to be", "or", "not", "to be");
    assertThat(list.get(3).interval()).isEqualTo(TimeInterval.of("2.002", "5"));
  }
}
