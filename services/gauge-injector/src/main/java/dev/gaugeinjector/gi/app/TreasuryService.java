package dev.gaugeinjector.gi.app;

import java.math.BigInteger;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.domain.enums.ErrorCode;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import dev.gaugeinjector.gi.gauge.GaugeCallException;
import dev.gaugeinjector.gi.gauge.GaugeGateway;
import dev.gaugeinjector.gi.ledger.AssetLedger;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class TreasuryService {
  private final SettingsService settings;
  private final AccessGuard guard;
  private final AssetLedger ledger;
  private final GaugeGateway gauges;
  private final InjectorEvents events;

  @Transactional(readOnly = true)
  public BigInteger getBalance() {
    InjectorSettings s = settings.current();
    return ledger.balanceOf(s.getInjectTokenAddress(), s.getCustodyAddress());
  }

  /** Sends the whole custodial balance of any asset to the owner. */
  @Transactional
  public BigInteger sweep(String caller, String asset) {
    InjectorSettings s = settings.lock();
    String to = requireOwnerRecipient(s);
    guard.requireOwner(s, caller);
    String token = SettingsService.address(asset);
    BigInteger amount = ledger.balanceOf(token, s.getCustodyAddress());
    ledger.transfer(token, s.getCustodyAddress(), to, amount);

    ObjectNode data = events.data();
    data.put("asset", token);
    data.put("to", to);
    data.put("amount", amount.toString());
    events.emit(InjectorEventType.SWEPT, data);
    log.info("swept {} of {} to {}", amount, token, to);
    return amount;
  }

  /** Sends {@code amount} of the injected asset to the owner. */
  @Transactional
  public BigInteger withdraw(String caller, BigInteger amount) {
    InjectorSettings s = settings.lock();
    String to = requireOwnerRecipient(s);
    guard.requireOwner(s, caller);
    if (amount == null || amount.signum() <= 0)
      throw InjectorException.invalidInput("amount must be positive");
    ledger.transfer(s.getInjectTokenAddress(), s.getCustodyAddress(), to, amount);

    ObjectNode data = events.data();
    data.put("asset", s.getInjectTokenAddress());
    data.put("to", to);
    data.put("amount", amount.toString());
    events.emit(InjectorEventType.WITHDRAWN, data);
    log.info("withdrew {} to {}", amount, to);
    return amount;
  }

  /** Approve-then-deposit into one gauge, bypassing the schedule. */
  @Transactional
  public void manualDeposit(String caller, String gauge, String asset, BigInteger amount) {
    InjectorSettings s = settings.lock();
    guard.requireOwner(s, caller);
    String target = SettingsService.address(gauge);
    String token = SettingsService.address(asset);
    if (Addresses.isZero(target))
      throw InjectorException.invalidInput("gauge cannot be the zero address");
    if (amount == null || amount.signum() <= 0)
      throw InjectorException.invalidInput("amount must be positive");

    ledger.approve(token, s.getCustodyAddress(), target, amount);
    try {
      gauges.depositRewardToken(target, token, s.getCustodyAddress(), amount);
    } catch (GaugeCallException e) {
      log.warn("manual deposit failed gauge={} amount={}", target, amount, e);
      throw new InjectorException(ErrorCode.RECIPIENT_DEPOSIT_FAILED, "deposit into " + target + " failed", e);
    }

    ObjectNode data = events.data();
    data.put("gauge", target);
    data.put("asset", token);
    data.put("amount", amount.toString());
    events.emit(InjectorEventType.MANUAL_DEPOSIT, data);
    log.info("manual deposit {} of {} into {}", amount, token, target);
  }

  /** Books an inbound transfer into custody. Anyone may fund the injector. */
  @Transactional
  public BigInteger recordDeposit(String caller, String asset, BigInteger amount) {
    InjectorSettings s = settings.lock();
    String token = SettingsService.address(asset);
    if (amount == null || amount.signum() <= 0)
      throw InjectorException.invalidInput("amount must be positive");
    ledger.credit(token, s.getCustodyAddress(), amount);

    ObjectNode data = events.data();
    data.put("asset", token);
    data.put("from", caller);
    data.put("amount", amount.toString());
    events.emit(InjectorEventType.DEPOSIT_RECEIVED, data);
    return ledger.balanceOf(token, s.getCustodyAddress());
  }

  // must run before requireOwner, which rejects every caller while the owner is zero
  private static String requireOwnerRecipient(InjectorSettings s) {
    if (Addresses.isZero(s.getOwnerAddress()))
      throw new InjectorException(ErrorCode.ZERO_ADDRESS_RECIPIENT, "owner is not set");
    return s.getOwnerAddress();
  }
}
