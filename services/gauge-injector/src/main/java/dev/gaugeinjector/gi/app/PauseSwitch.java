package dev.gaugeinjector.gi.app;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class PauseSwitch {
  private final SettingsService settings;
  private final AccessGuard guard;
  private final InjectorEvents events;

  @Transactional
  public boolean pause(String caller) {
    return toggle(caller, true);
  }

  @Transactional
  public boolean unpause(String caller) {
    return toggle(caller, false);
  }

  @Transactional(readOnly = true)
  public boolean isPaused() {
    return settings.current().isPaused();
  }

  public void requireNotPaused(InjectorSettings s) {
    if (s.isPaused())
      throw InjectorException.paused();
  }

  private boolean toggle(String caller, boolean paused) {
    InjectorSettings s = settings.lock();
    guard.requireOwner(s, caller);
    if (s.isPaused() == paused)
      return paused;
    s.setPaused(paused);
    var data = events.data();
    data.put("by", caller);
    events.emit(paused ? InjectorEventType.PAUSED : InjectorEventType.UNPAUSED, data);
    log.info("injector {} by {}", paused ? "paused" : "unpaused", caller);
    return paused;
  }
}
