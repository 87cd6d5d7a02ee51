package dev.gaugeinjector.gi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "gi.gauges")
public class GaugeClientProperties {
  /** Base URL of the gauge RPC bridge */
  private String baseUrl = "http://localhost:8545";

  private int connectTimeoutMs = 2_000;

  private int readTimeoutMs = 10_000;
}
