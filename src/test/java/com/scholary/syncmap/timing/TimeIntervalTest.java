package com.scholary.syncmap.timing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeIntervalTest {

  private static TimeValue t(String seconds) {
    return TimeValue.of(seconds);
  }

  @Test
  void constructor_shouldRejectNegativeBegin() {
    assertThatThrownBy(() -> TimeInterval.of("-1", "10"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void constructor_shouldRejectEndBeforeBegin() {
    assertThatThrownBy(() -> TimeInterval.of("10", "5"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("End time must be >= begin time");
  }

  @Test
  void length_shouldCalculateExactly() {
    TimeInterval interval = TimeInterval.of("10.1", "25.6");
    assertThat(interval.length()).isEqualTo(t("15.5"));
    assertThat(interval.hasZeroLength()).isFalse();
    assertThat(TimeInterval.of("3", "3.000").hasZeroLength()).isTrue();
  }

  @Test
  void contains_shouldIncludeBoundaries() {
    TimeInterval interval = TimeInterval.of("10", "20");
    assertThat(interval.contains(t("10"))).isTrue();
    assertThat(interval.contains(t("15"))).isTrue();
    assertThat(interval.contains(t("20"))).isTrue();
    assertThat(interval.contains(t("20.001"))).isFalse();
  }

  @Test
  void isAdjacentBefore_shouldRequireSharedBoundary() {
    TimeInterval left = TimeInterval.of("0", "2");
    assertThat(left.isAdjacentBefore(TimeInterval.of("2", "4"))).isTrue();
    assertThat(left.isAdjacentBefore(TimeInterval.of("2.5", "4"))).isFalse();
    assertThat(TimeInterval.of("2", "4").isAdjacentAfter(left)).isTrue();
  }

  @Test
  void offset_shouldShiftBothBoundaries() {
    assertThat(TimeInterval.of("1", "2").offset(t("0.5"))).isEqualTo(TimeInterval.of("1.5", "2.5"));
  }

  @Test
  void offset_shouldClampAtZero() {
    assertThat(TimeInterval.of("1", "2").offset(t("-1.5"))).isEqualTo(TimeInterval.of("0", "0.5"));
    assertThat(TimeInterval.of("1", "2").offset(t("-3"))).isEqualTo(TimeInterval.of("0", "0"));
  }

  @Test
  void offset_shouldClampToBounds() {
    TimeInterval shifted = TimeInterval.of("1", "2").offset(t("1"), t("0"), t("2"));
    assertThat(shifted).isEqualTo(TimeInterval.of("2", "2"));

    TimeInterval raised = TimeInterval.of("1", "2").offset(t("-1"), t("0.5"), t("10"));
    assertThat(raised).isEqualTo(TimeInterval.of("0.5", "1"));
  }

  @Test
  void offset_shouldNeverProduceNegativeLength() {
    TimeInterval collapsed = TimeInterval.of("1", "2").offset(t("-2"), t("1"), null);
    assertThat(collapsed).isEqualTo(TimeInterval.of("1", "1"));
  }

  @Test
  void shrink_shouldMoveBeginForward() {
    assertThat(TimeInterval.of("0", "2").shrink(t("0.5"))).isEqualTo(TimeInterval.of("0.5", "2"));
    assertThat(TimeInterval.of("0", "2").shrink(t("2"))).isEqualTo(TimeInterval.of("2", "2"));
  }

  @Test
  void shrink_shouldRejectAmountLongerThanInterval() {
    assertThatThrownBy(() -> TimeInterval.of("0", "1").shrink(t("1.5")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TimeInterval.of("0", "1").shrink(t("-0.5")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void enlarge_shouldMoveBeginBackward() {
    assertThat(TimeInterval.of("1", "1").enlarge(t("0.001")))
        .isEqualTo(TimeInterval.of("0.999", "1"));
    assertThatThrownBy(() -> TimeInterval.of("0", "1").enlarge(t("0.1")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void moveEndTo_shouldPreserveLength() {
    assertThat(TimeInterval.of("1", "1.5").moveEndTo(t("3"))).isEqualTo(TimeInterval.of("2.5", "3"));
    assertThat(TimeInterval.of("0", "0").moveEndTo(t("0.002")))
        .isEqualTo(TimeInterval.of("0.002", "0.002"));
  }

  @Test
  void compareTo_shouldOrderByBeginThenEnd() {
    assertThat(TimeInterval.of("0", "2")).isLessThan(TimeInterval.of("1", "1"));
    assertThat(TimeInterval.of("1", "1")).isLessThan(TimeInterval.of("1", "2"));
    assertThat(TimeInterval.of("1", "2")).isEqualByComparingTo(TimeInterval.of("1.0", "2.00"));
  }
}
