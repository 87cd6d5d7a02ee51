package dev.gaugeinjector.gi.domain.enums;

import java.util.Locale;

/**
 * Event types written to the outbox. The wire name is {@code gi.injector.<lower_snake>}.
 */
public enum InjectorEventType {
  KEEPER_ADDRESS_UPDATED,
  MIN_WAIT_PERIOD_UPDATED,
  INJECT_TOKEN_UPDATED,
  OWNERSHIP_TRANSFER_REQUESTED,
  OWNERSHIP_TRANSFERRED,
  RECIPIENT_LIST_SET,
  SCHEDULE_REJECTED,
  INJECTION_SUCCEEDED,
  INJECTION_FAILED,
  SWEPT,
  WITHDRAWN,
  MANUAL_DEPOSIT,
  DEPOSIT_RECEIVED,
  PAUSED,
  UNPAUSED;

  public String ceType() {
    return "gi.injector." + name().toLowerCase(Locale.ROOT);
  }
}
