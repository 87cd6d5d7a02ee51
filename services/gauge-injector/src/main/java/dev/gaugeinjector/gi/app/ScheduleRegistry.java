package dev.gaugeinjector.gi.app;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.entity.GaugeSchedule;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.domain.enums.ErrorCode;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import dev.gaugeinjector.gi.domain.repo.GaugeScheduleRepository;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the watch list. The list is only ever replaced as a whole; replaced
 * entries are deactivated, never deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleRegistry {
  private final GaugeScheduleRepository schedules;
  private final SettingsService settings;
  private final AccessGuard guard;
  private final BalanceReconciler reconciler;
  private final InjectorEvents events;
  private final DetachedEvents detached;

  @Transactional
  public List<String> setRecipientList(String caller, List<String> addresses, List<BigInteger> amountsPerPeriod,
      List<Integer> maxPeriods) {
    InjectorSettings s = settings.lock();
    guard.requireOwner(s, caller);
    return replace(addresses, amountsPerPeriod, maxPeriods, false);
  }

  /**
   * Replaces the list only once every current gauge has received all of its
   * periods, and only if the custodial balance covers the new schedule exactly.
   */
  @Transactional
  public List<String> setValidatedRecipientList(String caller, List<String> addresses,
      List<BigInteger> amountsPerPeriod, List<Integer> maxPeriods) {
    InjectorSettings s = settings.lock();
    guard.requireOwner(s, caller);

    List<String> unfinished = new ArrayList<>();
    for (GaugeSchedule g : schedules.findByActiveTrueOrderByListPositionAsc()) {
      if (!g.periodsFinished())
        unfinished.add(g.getGaugeAddress());
    }
    if (!unfinished.isEmpty())
      throw reject(ErrorCode.PERIODS_NOT_FINISHED, "gauges still have periods to inject: " + unfinished);

    List<String> list = replace(addresses, amountsPerPeriod, maxPeriods, true);

    BalanceReconciler.Reconciliation r = reconciler.reconcile();
    if (!r.exactMatch()) {
      throw reject(ErrorCode.BALANCE_MISMATCH,
          "obligation " + r.totalObligation() + " does not equal balance " + r.balance());
    }
    return list;
  }

  @Transactional(readOnly = true)
  public List<String> getWatchList() {
    return schedules.findByActiveTrueOrderByListPositionAsc().stream().map(GaugeSchedule::getGaugeAddress).toList();
  }

  @Transactional(readOnly = true)
  public GaugeSchedule getAccountInfo(String gauge) {
    String address = SettingsService.address(gauge);
    return schedules.findById(address)
        .orElseThrow(() -> new InjectorException(ErrorCode.NOT_FOUND, "no schedule for " + address));
  }

  private List<String> replace(List<String> addresses, List<BigInteger> amounts, List<Integer> maxPeriods,
      boolean validated) {
    List<String> normalized = validate(addresses, amounts, maxPeriods);

    for (GaugeSchedule g : schedules.findByActiveTrueOrderByListPositionAsc()) {
      g.deactivate();
    }

    for (int i = 0; i < normalized.size(); i++) {
      String address = normalized.get(i);
      GaugeSchedule g = schedules.findById(address)
          .orElseGet(() -> GaugeSchedule.builder().gaugeAddress(address).build());
      g.reset(amounts.get(i), maxPeriods.get(i), i);
      schedules.save(g);
    }

    ObjectNode data = events.data();
    data.put("validated", validated);
    ArrayNode gauges = data.putArray("gauges");
    for (int i = 0; i < normalized.size(); i++) {
      ObjectNode e = gauges.addObject();
      e.put("gauge", normalized.get(i));
      e.put("amount_per_period", amounts.get(i).toString());
      e.put("max_periods", maxPeriods.get(i));
    }
    events.emit(InjectorEventType.RECIPIENT_LIST_SET, data);
    log.info("recipient list replaced size={} validated={}", normalized.size(), validated);
    return normalized;
  }

  private List<String> validate(List<String> addresses, List<BigInteger> amounts, List<Integer> maxPeriods) {
    if (addresses == null || amounts == null || maxPeriods == null)
      throw reject(ErrorCode.INVALID_INPUT, "addresses, amounts and max periods are required");
    if (addresses.size() != amounts.size() || addresses.size() != maxPeriods.size()) {
      throw reject(ErrorCode.INVALID_INPUT, "length mismatch: addresses=" + addresses.size() + " amounts="
          + amounts.size() + " maxPeriods=" + maxPeriods.size());
    }

    List<String> normalized = new ArrayList<>(addresses.size());
    for (String a : addresses) {
      if (!Addresses.isValid(a))
        throw reject(ErrorCode.INVALID_INPUT, "malformed address: " + a);
      normalized.add(Addresses.normalize(a));
    }

    Set<String> seen = new HashSet<>();
    for (String a : normalized) {
      if (!seen.add(a))
        throw reject(ErrorCode.DUPLICATE_ADDRESS, "duplicate address: " + a);
    }

    for (int i = 0; i < normalized.size(); i++) {
      if (Addresses.isZero(normalized.get(i)))
        throw reject(ErrorCode.INVALID_INPUT, "zero address at index " + i);
      BigInteger amount = amounts.get(i);
      if (amount == null || amount.signum() <= 0)
        throw reject(ErrorCode.INVALID_INPUT, "amount must be positive at index " + i);
      Integer periods = maxPeriods.get(i);
      if (periods == null || periods < 0 || periods > GaugeSchedule.MAX_PERIODS_LIMIT)
        throw reject(ErrorCode.INVALID_INPUT, "max periods out of range at index " + i);
    }
    return normalized;
  }

  private InjectorException reject(ErrorCode code, String message) {
    ObjectNode data = events.data();
    data.put("code", code.name());
    data.put("reason", message);
    detached.emit(InjectorEventType.SCHEDULE_REJECTED, data);
    log.warn("recipient list rejected code={} reason={}", code, message);
    return new InjectorException(code, message);
  }
}
