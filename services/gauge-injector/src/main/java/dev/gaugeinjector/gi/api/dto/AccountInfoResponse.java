package dev.gaugeinjector.gi.api.dto;

import java.math.BigInteger;

import dev.gaugeinjector.gi.domain.entity.GaugeSchedule;

public record AccountInfoResponse(
    String gauge,
    boolean active,
    BigInteger amountPerPeriod,
    int maxPeriods,
    int periodNumber,
    long lastInjectionTimestamp) {

  public static AccountInfoResponse from(GaugeSchedule g) {
    return new AccountInfoResponse(g.getGaugeAddress(), g.isActive(), g.getAmountPerPeriod(), g.getMaxPeriods(),
        g.getPeriodNumber(), g.getLastInjectionTimestamp());
  }
}
