package dev.gaugeinjector.gi.app;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.config.KafkaTopics;
import dev.gaugeinjector.gi.domain.entity.Outbox;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import dev.gaugeinjector.gi.domain.repo.OutboxRepository;
import dev.gaugeinjector.gi.schema.EventSchema;
import dev.gaugeinjector.gi.schema.SchemaValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Appends events to the outbox inside the caller's transaction; an event is
 * published only if the operation that raised it commits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InjectorEvents {
  private final OutboxRepository repo;
  private final Clock clock;
  private final ObjectMapper om = new ObjectMapper();

  public ObjectNode data() {
    return om.createObjectNode();
  }

  @Transactional
  public void emit(InjectorEventType type, ObjectNode data) {
    ObjectNode evt = om.createObjectNode();
    evt.put("schema_version", 1);
    evt.put("event_id", UUID.randomUUID().toString());
    evt.put("occurred_at", Instant.now(clock).toString());
    evt.put("type", type.name());
    evt.set("data", data == null ? om.createObjectNode() : data);

    SchemaValidator.validate(EventSchema.INJECTOR_EVENT_V1, evt);

    ObjectNode headers = om.createObjectNode();
    headers.put("content-type", "application/json");
    headers.put("schema", EventSchema.INJECTOR_EVENT_V1.header());
    headers.put("ce_type", type.ceType());
    headers.put("ce_id", evt.get("event_id").asText());
    headers.put("ce_source", "gi");

    repo.save(Outbox.builder()
        .topic(KafkaTopics.INJECTOR_EVENTS)
        .key(type.name())
        .value(evt.toString())
        .headers(headers.toString())
        .build());
    log.debug("event {} queued {}", type, data);
  }
}
