package dev.gaugeinjector.gi.config;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public final class KafkaTopics {
  public static final String INJECTOR_EVENTS = "gi.injector.events";
}
