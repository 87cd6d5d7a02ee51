package dev.gaugeinjector.gi.domain;

public class SettingsNotInitializedException extends RuntimeException {

  public SettingsNotInitializedException() {
    super("injector settings not initialized");
  }
}
