package dev.gaugeinjector.gi.app;

import java.util.Collections;
import java.util.UUID;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import dev.gaugeinjector.gi.config.KeeperProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeper lease held in a single Redis key. Whoever owns the key runs the
 * local keeper; the lease lapses on its own if the holder stops refreshing.
 */
@Slf4j
public class RedisLeaderElector {
  private static final RedisScript<Long> ACQUIRE_OR_REFRESH = new DefaultRedisScript<>("""
      if redis.call('SET', KEYS[1], ARGV[1], 'NX', 'EX', ARGV[2]) then
        return 1
      end
      if redis.call('GET', KEYS[1]) == ARGV[1] then
        redis.call('EXPIRE', KEYS[1], ARGV[2])
        return 1
      end
      return 0
      """, Long.class);

  private static final RedisScript<Long> RELEASE = new DefaultRedisScript<>("""
      if redis.call('GET', KEYS[1]) == ARGV[1] then
        return redis.call('DEL', KEYS[1])
      end
      return 0
      """, Long.class);

  private final StringRedisTemplate redis;
  private final String leaseKey;
  private final String ttlSeconds;
  private final String instanceId = UUID.randomUUID().toString();
  private volatile boolean held;

  public RedisLeaderElector(StringRedisTemplate redis, KeeperProperties props) {
    this.redis = redis;
    this.leaseKey = props.getLeaseKey();
    this.ttlSeconds = Long.toString(props.getLeaseTtlSeconds());
  }

  /** Claims the lease if free, refreshes it if already ours. */
  public boolean holdsLease() {
    Long res = redis.execute(ACQUIRE_OR_REFRESH, Collections.singletonList(leaseKey), instanceId, ttlSeconds);
    boolean now = res != null && res == 1L;
    if (now != held)
      log.info("keeper lease {} instance={}", now ? "acquired" : "lost", instanceId);
    held = now;
    return now;
  }

  /** Drops the lease only while this instance still owns it. */
  public boolean release() {
    Long res = redis.execute(RELEASE, Collections.singletonList(leaseKey), instanceId);
    held = false;
    return res != null && res > 0;
  }

  public String instanceId() {
    return instanceId;
  }
}
