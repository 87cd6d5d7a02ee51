package dev.gaugeinjector.gi.app;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.entity.GaugeSchedule;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.domain.enums.ErrorCode;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import dev.gaugeinjector.gi.domain.repo.GaugeScheduleRepository;
import dev.gaugeinjector.gi.gauge.GaugeCallException;
import dev.gaugeinjector.gi.gauge.GaugeGateway;
import dev.gaugeinjector.gi.ledger.AssetLedger;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pays out one period to each candidate that is still eligible. A batch is one
 * transaction: if any deposit fails, nothing in the batch commits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InjectionExecutor {
  private final GaugeScheduleRepository schedules;
  private final SettingsService settings;
  private final AccessGuard guard;
  private final PauseSwitch pause;
  private final ReadinessEvaluator readiness;
  private final AssetLedger ledger;
  private final GaugeGateway gauges;
  private final Clock clock;
  private final InjectorEvents events;
  private final DetachedEvents detached;

  /** Owner override; the candidate list is not restricted to ready gauges. */
  @Transactional
  public InjectionReport injectFunds(String caller, List<String> candidates) {
    InjectorSettings s = settings.lock();
    pause.requireNotPaused(s);
    guard.requireOwner(s, caller);
    return execute(s, candidates);
  }

  /**
   * Re-checks every candidate against current state before paying it. The
   * caller must hold the settings lock.
   */
  @Transactional
  public InjectionReport execute(InjectorSettings s, List<String> candidates) {
    if (candidates == null)
      throw InjectorException.invalidInput("candidate list is required");

    long now = clock.instant().getEpochSecond();
    String asset = s.getInjectTokenAddress();
    String custody = s.getCustodyAddress();
    List<String> injected = new ArrayList<>();
    BigInteger total = BigInteger.ZERO;

    for (String candidate : candidates) {
      if (!Addresses.isValid(candidate)) {
        log.debug("skip malformed candidate {}", candidate);
        continue;
      }
      String gauge = Addresses.normalize(candidate);
      GaugeSchedule g = schedules.findById(gauge).orElse(null);
      if (g == null || !g.isActive()) {
        log.debug("skip unscheduled candidate {}", gauge);
        continue;
      }
      if (!readiness.isEligible(s, g, ledger.balanceOf(asset, custody), now))
        continue;

      BigInteger amount = g.getAmountPerPeriod();
      ledger.approve(asset, custody, gauge, amount);
      try {
        gauges.depositRewardToken(gauge, asset, custody, amount);
      } catch (GaugeCallException e) {
        ObjectNode data = events.data();
        data.put("gauge", gauge);
        data.put("asset", asset);
        data.put("amount", amount.toString());
        data.put("period_number", g.getPeriodNumber());
        data.put("error", String.valueOf(e.getMessage()));
        detached.emit(InjectorEventType.INJECTION_FAILED, data);
        log.warn("deposit failed gauge={} amount={}, aborting batch of {}", gauge, amount, candidates.size(), e);
        throw new InjectorException(ErrorCode.RECIPIENT_DEPOSIT_FAILED, "deposit into " + gauge + " failed", e);
      }

      g.recordInjection(now);
      ObjectNode data = events.data();
      data.put("gauge", gauge);
      data.put("asset", asset);
      data.put("amount", amount.toString());
      data.put("period_number", g.getPeriodNumber());
      data.put("max_periods", g.getMaxPeriods());
      data.put("timestamp", now);
      events.emit(InjectorEventType.INJECTION_SUCCEEDED, data);

      injected.add(gauge);
      total = total.add(amount);
    }

    log.info("injection batch committed candidates={} injected={} total={}", candidates.size(), injected.size(),
        total);
    return new InjectionReport(List.copyOf(injected), total);
  }
}
