package dev.gaugeinjector.gi.app;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import dev.gaugeinjector.gi.config.InjectorProperties;
import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class SettingsBootstrap implements ApplicationRunner {
  private final SettingsService settings;
  private final InjectorProperties props;

  @Override
  public void run(ApplicationArguments args) {
    settings.initialize(props);
  }
}
