package dev.gaugeinjector.gi.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class GaugeClientConfig {

  @Bean
  public RestTemplate gaugeRestTemplate(RestTemplateBuilder builder, GaugeClientProperties props) {
    return builder
        .rootUri(props.getBaseUrl())
        .setConnectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()))
        .setReadTimeout(Duration.ofMillis(props.getReadTimeoutMs()))
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
