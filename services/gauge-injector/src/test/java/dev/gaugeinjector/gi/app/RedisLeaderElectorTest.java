package dev.gaugeinjector.gi.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import dev.gaugeinjector.gi.config.KeeperProperties;

@ExtendWith(MockitoExtension.class)
class RedisLeaderElectorTest {

  @Mock
  StringRedisTemplate redis;

  RedisLeaderElector elector;

  @BeforeEach
  void setUp() {
    KeeperProperties props = new KeeperProperties();
    props.setLeaseKey("test:lease");
    props.setLeaseTtlSeconds(30);
    elector = new RedisLeaderElector(redis, props);
  }

  @Test
  @SuppressWarnings("unchecked")
  void holdsLeaseWhenScriptGrantsIt() {
    when(redis.execute(any(RedisScript.class), eq(List.of("test:lease")), eq(elector.instanceId()), eq("30")))
        .thenReturn(1L);

    assertThat(elector.holdsLease()).isTrue();
  }

  @Test
  @SuppressWarnings("unchecked")
  void anotherHolderKeepsUsOut() {
    when(redis.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(0L);

    assertThat(elector.holdsLease()).isFalse();
  }

  @Test
  @SuppressWarnings("unchecked")
  void releaseReportsWhetherTheKeyWasOurs() {
    when(redis.execute(any(RedisScript.class), eq(List.of("test:lease")), eq(elector.instanceId())))
        .thenReturn(1L, 0L);

    assertThat(elector.release()).isTrue();
    assertThat(elector.release()).isFalse();
    verify(redis, times(2))
        .execute(any(RedisScript.class), eq(List.of("test:lease")), eq(elector.instanceId()));
  }
}
