package dev.gaugeinjector.gi.app;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.config.InjectorProperties;
import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.SettingsNotInitializedException;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import dev.gaugeinjector.gi.domain.repo.InjectorSettingsRepository;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {
  private final InjectorSettingsRepository repo;
  private final AccessGuard guard;
  private final InjectorEvents events;

  /**
   * Locks the settings row for the rest of the current transaction. Every
   * mutating operation starts here.
   */
  @Transactional
  public InjectorSettings lock() {
    return repo.lockById(InjectorSettings.SINGLETON_ID)
        .orElseThrow(SettingsNotInitializedException::new);
  }

  @Transactional(readOnly = true)
  public InjectorSettings current() {
    return repo.findById(InjectorSettings.SINGLETON_ID)
        .orElseThrow(SettingsNotInitializedException::new);
  }

  /** Creates the settings row from properties unless it already exists. */
  @Transactional
  public InjectorSettings initialize(InjectorProperties props) {
    return repo.findById(InjectorSettings.SINGLETON_ID).orElseGet(() -> {
      InjectorSettings s = InjectorSettings.builder()
          .ownerAddress(Addresses.normalize(props.getOwner()))
          .keeperAddress(Addresses.normalize(props.getKeeperAddress()))
          .minWaitPeriodSeconds(props.getMinWaitPeriodSeconds())
          .injectTokenAddress(Addresses.normalize(props.getInjectTokenAddress()))
          .custodyAddress(Addresses.normalize(props.getCustodyAddress()))
          .paused(false)
          .build();
      log.info("initialized injector settings owner={} token={} custody={}", s.getOwnerAddress(),
          s.getInjectTokenAddress(), s.getCustodyAddress());
      return repo.save(s);
    });
  }

  @Transactional
  public InjectorSettings setKeeperAddress(String caller, String keeper) {
    InjectorSettings s = lock();
    guard.requireOwner(s, caller);
    String next = address(keeper);
    ObjectNode data = events.data();
    data.put("old", s.getKeeperAddress());
    data.put("new", next);
    s.setKeeperAddress(next);
    events.emit(InjectorEventType.KEEPER_ADDRESS_UPDATED, data);
    log.info("keeper address set to {}", next);
    return s;
  }

  @Transactional
  public InjectorSettings setMinWaitPeriodSeconds(String caller, long seconds) {
    InjectorSettings s = lock();
    guard.requireOwner(s, caller);
    if (seconds < 0)
      throw InjectorException.invalidInput("min wait period must be non-negative");
    ObjectNode data = events.data();
    data.put("old", s.getMinWaitPeriodSeconds());
    data.put("new", seconds);
    s.setMinWaitPeriodSeconds(seconds);
    events.emit(InjectorEventType.MIN_WAIT_PERIOD_UPDATED, data);
    log.info("min wait period set to {}s", seconds);
    return s;
  }

  @Transactional
  public InjectorSettings setInjectTokenAddress(String caller, String token) {
    InjectorSettings s = lock();
    guard.requireOwner(s, caller);
    String next = address(token);
    if (Addresses.isZero(next))
      throw InjectorException.invalidInput("inject token cannot be the zero address");
    ObjectNode data = events.data();
    data.put("old", s.getInjectTokenAddress());
    data.put("new", next);
    s.setInjectTokenAddress(next);
    events.emit(InjectorEventType.INJECT_TOKEN_UPDATED, data);
    log.info("inject token set to {}", next);
    return s;
  }

  @Transactional
  public InjectorSettings transferOwnership(String caller, String to) {
    InjectorSettings s = lock();
    guard.requireOwner(s, caller);
    String next = address(to);
    if (Addresses.same(next, s.getOwnerAddress()))
      throw InjectorException.invalidInput("cannot transfer ownership to self");
    s.setPendingOwnerAddress(next);
    ObjectNode data = events.data();
    data.put("from", s.getOwnerAddress());
    data.put("to", next);
    events.emit(InjectorEventType.OWNERSHIP_TRANSFER_REQUESTED, data);
    return s;
  }

  @Transactional
  public InjectorSettings acceptOwnership(String caller) {
    InjectorSettings s = lock();
    if (s.getPendingOwnerAddress() == null || !Addresses.same(s.getPendingOwnerAddress(), caller))
      throw InjectorException.notAuthorized(caller);
    ObjectNode data = events.data();
    data.put("from", s.getOwnerAddress());
    data.put("to", s.getPendingOwnerAddress());
    s.setOwnerAddress(s.getPendingOwnerAddress());
    s.setPendingOwnerAddress(null);
    events.emit(InjectorEventType.OWNERSHIP_TRANSFERRED, data);
    log.info("ownership transferred to {}", s.getOwnerAddress());
    return s;
  }

  static String address(String raw) {
    if (!Addresses.isValid(raw))
      throw InjectorException.invalidInput("malformed address: " + raw);
    return Addresses.normalize(raw);
  }
}
