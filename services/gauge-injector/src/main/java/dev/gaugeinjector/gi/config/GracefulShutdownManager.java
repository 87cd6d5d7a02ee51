package dev.gaugeinjector.gi.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import dev.gaugeinjector.gi.app.RedisLeaderElector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gi.keeper", name = "enabled", havingValue = "true")
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {
  private final RedisLeaderElector lease;

  @Override
  public void onApplicationEvent(ContextClosedEvent event) {
    try {
      if (lease.release())
        log.info("keeper lease released instance={}", lease.instanceId());
    } catch (RuntimeException e) {
      log.warn("keeper lease release failed instance={}, it expires on its own", lease.instanceId(), e);
    }
  }
}
