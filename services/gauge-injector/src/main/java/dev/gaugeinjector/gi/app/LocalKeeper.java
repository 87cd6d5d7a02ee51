package dev.gaugeinjector.gi.app;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dev.gaugeinjector.gi.config.KeeperProperties;
import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.util.Addresses;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "gi.keeper", name = "enabled", havingValue = "true")
public class LocalKeeper {
  private final AutomationService automation;
  private final RedisLeaderElector leader;
  private final String keeperAddress;

  public LocalKeeper(AutomationService automation, RedisLeaderElector leader, KeeperProperties props) {
    this.automation = automation;
    this.leader = leader;
    this.keeperAddress = resolveAddress(props.getAddress());
  }

  static String resolveAddress(String configured) {
    if (!Addresses.isValid(configured) || Addresses.isZero(configured))
      throw new IllegalStateException("gi.keeper.address must be a non-zero address when gi.keeper.enabled=true, got "
          + configured);
    return Addresses.normalize(configured);
  }

  @Scheduled(fixedDelayString = "${gi.keeper.tick-interval-ms:60000}")
  public void tick() {
    if (!leader.holdsLease())
      return;
    try {
      AutomationService.CheckResult check = automation.check();
      if (!check.needed())
        return;
      InjectionReport report = automation.perform(keeperAddress, check.payload());
      log.info("keeper tick injected={} total={}", report.injected(), report.totalAmount());
    } catch (InjectorException e) {
      log.warn("keeper tick rejected code={} msg={}", e.getCode(), e.getMessage());
    } catch (Exception e) {
      log.warn("keeper tick failed", e);
    }
  }
}
