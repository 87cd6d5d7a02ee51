package dev.gaugeinjector.gi.config;

import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "gi.auth")
public class GiAuthProperties {
  /** Bearer token -> caller address */
  private Map<String, String> callers = new HashMap<>();

  /** When off, the caller is read from the X-Caller-Address header (dev only) */
  private boolean enabled = true;
}
