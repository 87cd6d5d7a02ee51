package dev.gaugeinjector.gi.app;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import dev.gaugeinjector.gi.config.KeeperProperties;
import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.util.Addresses;

@ExtendWith(MockitoExtension.class)
class LocalKeeperTest {
  private static final String KEEPER = "0x00000000000000000000000000000000000000bb";

  @Mock
  AutomationService automation;
  @Mock
  RedisLeaderElector leader;

  LocalKeeper keeper;

  @BeforeEach
  void setUp() {
    KeeperProperties props = new KeeperProperties();
    props.setEnabled(true);
    props.setAddress(KEEPER.toUpperCase().replace("0X", "0x"));
    keeper = new LocalKeeper(automation, leader, props);
  }

  @Test
  void followerDoesNothing() {
    when(leader.holdsLease()).thenReturn(false);

    keeper.tick();

    verify(automation, never()).check();
  }

  @Test
  void leaderPerformsWhenNeeded() {
    when(leader.holdsLease()).thenReturn(true);
    when(automation.check()).thenReturn(new AutomationService.CheckResult(true, "payload"));
    when(automation.perform(KEEPER, "payload"))
        .thenReturn(new InjectionReport(List.of("0x000000000000000000000000000000000000a001"), BigInteger.TEN));

    keeper.tick();

    verify(automation).perform(KEEPER, "payload");
  }

  @Test
  void leaderSkipsPerformWhenNothingIsReady() {
    when(leader.holdsLease()).thenReturn(true);
    when(automation.check()).thenReturn(new AutomationService.CheckResult(false, "W10"));

    keeper.tick();

    verify(automation, never()).perform(any(), any());
  }

  @Test
  void rejectedTickDoesNotPropagate() {
    when(leader.holdsLease()).thenReturn(true);
    when(automation.check()).thenThrow(InjectorException.paused());

    keeper.tick();

    verify(automation, never()).perform(any(), any());
  }

  @Test
  void unsetOrZeroAddressFailsAtStartup() {
    KeeperProperties props = new KeeperProperties();
    props.setEnabled(true);

    assertThatThrownBy(() -> new LocalKeeper(automation, leader, props))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("gi.keeper.address");

    props.setAddress(Addresses.ZERO);
    assertThatThrownBy(() -> new LocalKeeper(automation, leader, props))
        .isInstanceOf(IllegalStateException.class);
    verify(automation, never()).check();
  }
}
