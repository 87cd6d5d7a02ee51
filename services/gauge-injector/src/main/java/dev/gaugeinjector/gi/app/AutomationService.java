package dev.gaugeinjector.gi.app;

import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dev.gaugeinjector.gi.domain.entity.InjectorSettings;
import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class AutomationService {
  private final SettingsService settings;
  private final PauseSwitch pause;
  private final AccessGuard guard;
  private final ReadinessEvaluator readiness;
  private final InjectionExecutor executor;
  private final AutomationPayloadCodec codec;

  public record CheckResult(boolean needed, String payload) {
  }

  @Transactional(readOnly = true)
  public CheckResult check() {
    pause.requireNotPaused(settings.current());
    List<String> ready = readiness.getReadyGauges();
    return new CheckResult(!ready.isEmpty(), codec.encode(ready));
  }

  @Transactional
  public InjectionReport perform(String caller, String payload) {
    InjectorSettings s = settings.lock();
    pause.requireNotPaused(s);
    guard.requireKeeper(s, caller);
    return executor.execute(s, codec.decode(payload));
  }
}
