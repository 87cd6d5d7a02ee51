package dev.gaugeinjector.gi.domain.entity;

import java.math.BigInteger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Injection schedule of one gauge. Rows are never deleted; a list replacement
 * that omits a gauge only deactivates it.
 */
@Entity
@Table(name = "gauge_schedule")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GaugeSchedule {

  public static final int MAX_PERIODS_LIMIT = 255;

  @Id
  @Column(name = "gauge_address", length = 42, nullable = false, updatable = false)
  private String gaugeAddress;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "amount_per_period", nullable = false, precision = 78, scale = 0)
  private BigInteger amountPerPeriod;

  @Column(name = "max_periods", nullable = false)
  private int maxPeriods;

  @Column(name = "period_number", nullable = false)
  private int periodNumber;

  /** epoch seconds, 0 = never injected */
  @Column(name = "last_injection_timestamp", nullable = false)
  private long lastInjectionTimestamp;

  /** index in the watch list; null while inactive */
  @Column(name = "list_position")
  private Integer listPosition;

  public boolean periodsFinished() {
    return periodNumber >= maxPeriods;
  }

  public int remainingPeriods() {
    return Math.max(0, maxPeriods - periodNumber);
  }

  public void reset(BigInteger amount, int periods, int position) {
    this.active = true;
    this.amountPerPeriod = amount;
    this.maxPeriods = periods;
    this.periodNumber = 0;
    this.lastInjectionTimestamp = 0L;
    this.listPosition = position;
  }

  public void deactivate() {
    this.active = false;
    this.listPosition = null;
  }

  public void recordInjection(long nowSeconds) {
    if (periodsFinished())
      throw new IllegalStateException("all periods already injected for " + gaugeAddress);
    this.lastInjectionTimestamp = Math.max(lastInjectionTimestamp, nowSeconds);
    this.periodNumber = periodNumber + 1;
  }
}
