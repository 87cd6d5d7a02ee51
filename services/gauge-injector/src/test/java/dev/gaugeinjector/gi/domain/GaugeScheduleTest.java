package dev.gaugeinjector.gi.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import dev.gaugeinjector.gi.domain.entity.GaugeSchedule;

class GaugeScheduleTest {

  @Test
  void recordInjectionAdvancesUntilFinished() {
    GaugeSchedule g = GaugeSchedule.builder().gaugeAddress("g").build();
    g.reset(BigInteger.TEN, 2, 0);

    g.recordInjection(100);
    g.recordInjection(200);

    assertThat(g.getPeriodNumber()).isEqualTo(2);
    assertThat(g.getLastInjectionTimestamp()).isEqualTo(200);
    assertThat(g.periodsFinished()).isTrue();
    assertThat(g.remainingPeriods()).isZero();
    assertThatThrownBy(() -> g.recordInjection(300)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void timestampNeverMovesBackwards() {
    GaugeSchedule g = GaugeSchedule.builder().gaugeAddress("g").build();
    g.reset(BigInteger.TEN, 3, 0);

    g.recordInjection(500);
    g.recordInjection(400);

    assertThat(g.getLastInjectionTimestamp()).isEqualTo(500);
  }

  @Test
  void deactivateClearsListPosition() {
    GaugeSchedule g = GaugeSchedule.builder().gaugeAddress("g").build();
    g.reset(BigInteger.ONE, 1, 4);

    g.deactivate();

    assertThat(g.isActive()).isFalse();
    assertThat(g.getListPosition()).isNull();
  }
}
