package dev.gaugeinjector.gi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "gi.keeper")
public class KeeperProperties {
  /** Run the in-process keeper tick */
  private boolean enabled = false;

  /** Interval between keeper ticks in milliseconds */
  private long tickIntervalMs = 60_000;

  /** Address the local keeper calls perform with */
  private String address;

  /** Redis key holding the keeper lease */
  private String leaseKey = "gi:keeper:leader";

  /** Lease lifetime; must exceed the tick interval */
  private long leaseTtlSeconds = 90;
}
