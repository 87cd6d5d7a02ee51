package dev.gaugeinjector.gi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Initial settings, applied only when the settings row does not exist yet.
 * Later changes go through the settings API.
 */
@Data
@Component
@ConfigurationProperties(prefix = "gi.injector")
public class InjectorProperties {
  /** Owner of the injector */
  private String owner;

  /** Automation caller allowed to perform upkeep; zero address disables it */
  private String keeperAddress = "0x0000000000000000000000000000000000000000";

  /** Minimum seconds between two injections into the same gauge */
  private long minWaitPeriodSeconds = 6 * 24 * 60 * 60;

  /** Asset distributed to the gauges */
  private String injectTokenAddress;

  /** This injector's holder address on the ledger */
  private String custodyAddress;
}
