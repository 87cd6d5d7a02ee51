package dev.gaugeinjector.gi.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

  @Bean
  public NewTopic injectorEvents() {
    return TopicBuilder.name(KafkaTopics.INJECTOR_EVENTS)
        .partitions(1) // one injector, total order of events
        .replicas(1) // dev; use 3 in prod
        .config("retention.ms", String.valueOf(30L * 24 * 60 * 60 * 1000)) // 30d
        .config("cleanup.policy", "delete")
        .build();
  }
}
