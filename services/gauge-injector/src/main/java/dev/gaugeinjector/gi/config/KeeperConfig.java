package dev.gaugeinjector.gi.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import dev.gaugeinjector.gi.app.RedisLeaderElector;

@Configuration
@ConditionalOnProperty(prefix = "gi.keeper", name = "enabled", havingValue = "true")
public class KeeperConfig {

  @Bean
  public RedisLeaderElector keeperLeaderElector(StringRedisTemplate redis, KeeperProperties props) {
    return new RedisLeaderElector(redis, props);
  }
}
