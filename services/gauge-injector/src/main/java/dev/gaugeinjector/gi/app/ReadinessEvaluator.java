package dev.gaugeinjector.gi.app;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dev.gaugeinjector.gi.domain.entity.GaugeSchedule;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.domain.repo.GaugeScheduleRepository;
import dev.gaugeinjector.gi.gauge.GaugeGateway;
import dev.gaugeinjector.gi.gauge.RewardData;
import dev.gaugeinjector.gi.ledger.AssetLedger;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReadinessEvaluator {
  private final GaugeScheduleRepository schedules;
  private final SettingsService settings;
  private final AssetLedger ledger;
  private final GaugeGateway gauges;
  private final Clock clock;

  @Transactional(readOnly = true)
  public List<String> getReadyGauges() {
    InjectorSettings s = settings.current();
    BigInteger balance = ledger.balanceOf(s.getInjectTokenAddress(), s.getCustodyAddress());
    return readyGauges(s, schedules.findByActiveTrueOrderByListPositionAsc(), balance,
        clock.instant().getEpochSecond());
  }

  /**
   * Walks the watch list in order against a running balance, so the amounts of
   * the returned gauges never add up to more than {@code balance}.
   */
  public List<String> readyGauges(InjectorSettings s, List<GaugeSchedule> watchList, BigInteger balance,
      long now) {
    List<String> ready = new ArrayList<>();
    BigInteger running = balance;
    for (GaugeSchedule g : watchList) {
      if (isEligible(s, g, running, now)) {
        ready.add(g.getGaugeAddress());
        running = running.subtract(g.getAmountPerPeriod());
      }
    }
    return ready;
  }

  /**
   * Local conditions are checked before the gauge is queried.
   */
  public boolean isEligible(InjectorSettings s, GaugeSchedule g, BigInteger balance, long now) {
    String gauge = g.getGaugeAddress();
    if (!g.isActive())
      return false;
    if (now - g.getLastInjectionTimestamp() < s.getMinWaitPeriodSeconds()) {
      log.debug("not ready gauge={} reason=min_wait last={}", gauge, g.getLastInjectionTimestamp());
      return false;
    }
    if (g.periodsFinished()) {
      log.debug("not ready gauge={} reason=periods_finished {}/{}", gauge, g.getPeriodNumber(), g.getMaxPeriods());
      return false;
    }
    if (balance.compareTo(g.getAmountPerPeriod()) < 0) {
      log.debug("not ready gauge={} reason=balance have={} need={}", gauge, balance, g.getAmountPerPeriod());
      return false;
    }

    RewardData reward = gauges.rewardData(gauge, s.getInjectTokenAddress());
    if (reward.periodFinish() > now) {
      log.debug("not ready gauge={} reason=period_running finish={}", gauge, reward.periodFinish());
      return false;
    }
    if (!Addresses.same(reward.distributor(), s.getCustodyAddress())) {
      log.debug("not ready gauge={} reason=not_distributor distributor={}", gauge, reward.distributor());
      return false;
    }
    return true;
  }
}
