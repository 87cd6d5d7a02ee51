package dev.gaugeinjector.gi.api.dto;

import dev.gaugeinjector.gi.domain.entity.InjectorSettings;

public record SettingsResponse(
    String owner,
    String pendingOwner,
    String keeperAddress,
    long minWaitPeriodSeconds,
    String injectTokenAddress,
    String custodyAddress,
    boolean paused) {

  public static SettingsResponse from(InjectorSettings s) {
    return new SettingsResponse(s.getOwnerAddress(), s.getPendingOwnerAddress(), s.getKeeperAddress(),
        s.getMinWaitPeriodSeconds(), s.getInjectTokenAddress(), s.getCustodyAddress(), s.isPaused());
  }
}
