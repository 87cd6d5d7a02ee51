package dev.gaugeinjector.gi.app;

import org.springframework.stereotype.Component;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class AccessGuard {

  public void requireOwner(InjectorSettings settings, String caller) {
    if (!Addresses.same(settings.getOwnerAddress(), caller) || Addresses.isZero(caller)) {
      log.warn("owner-only call rejected caller={}", caller);
      throw InjectorException.notAuthorized(caller);
    }
  }

  public void requireKeeper(InjectorSettings settings, String caller) {
    if (!Addresses.same(settings.getKeeperAddress(), caller) || Addresses.isZero(caller)) {
      log.warn("automation call rejected caller={} keeper={}", caller, settings.getKeeperAddress());
      throw InjectorException.notAuthorized(caller);
    }
  }

  public boolean isOwner(InjectorSettings settings, String caller) {
    return Addresses.same(settings.getOwnerAddress(), caller) && !Addresses.isZero(caller);
  }
}
