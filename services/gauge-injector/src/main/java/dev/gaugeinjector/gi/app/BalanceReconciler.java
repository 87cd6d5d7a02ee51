package dev.gaugeinjector.gi.app;

import java.math.BigInteger;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dev.gaugeinjector.gi.domain.entity.GaugeSchedule;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.domain.repo.GaugeScheduleRepository;
import dev.gaugeinjector.gi.ledger.AssetLedger;
import lombok.RequiredArgsConstructor;

/**
 * Compares what the active schedule still owes against the custodial balance.
 * The comparison is exact: any stray deposit makes it fail.
 */
@Service
@RequiredArgsConstructor
public class BalanceReconciler {
  private final GaugeScheduleRepository schedules;
  private final SettingsService settings;
  private final AssetLedger ledger;

  public record Reconciliation(BigInteger totalObligation, BigInteger balance, boolean exactMatch) {
  }

  /** sum over active entries of (maxPeriods - periodNumber) * amountPerPeriod */
  @Transactional(readOnly = true)
  public BigInteger totalObligation() {
    BigInteger total = BigInteger.ZERO;
    for (GaugeSchedule g : schedules.findByActiveTrueOrderByListPositionAsc()) {
      total = total.add(g.getAmountPerPeriod().multiply(BigInteger.valueOf(g.remainingPeriods())));
    }
    return total;
  }

  @Transactional(readOnly = true)
  public boolean exactMatch() {
    return reconcile().exactMatch();
  }

  @Transactional(readOnly = true)
  public Reconciliation reconcile() {
    InjectorSettings s = settings.current();
    BigInteger obligation = totalObligation();
    BigInteger balance = ledger.balanceOf(s.getInjectTokenAddress(), s.getCustodyAddress());
    return new Reconciliation(obligation, balance, obligation.equals(balance));
  }
}
