package dev.gaugeinjector.gi.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.gaugeinjector.gi.config.KafkaTopics;
import dev.gaugeinjector.gi.domain.entity.Outbox;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import dev.gaugeinjector.gi.domain.repo.OutboxRepository;

@ExtendWith(MockitoExtension.class)
class InjectorEventsTest {
  private static final Instant AT = Instant.parse("2024-05-01T12:00:00Z");

  @Mock
  OutboxRepository repo;

  @Test
  void writesValidatedEnvelopeToOutbox() throws Exception {
    InjectorEvents events = new InjectorEvents(repo, Clock.fixed(AT, ZoneOffset.UTC));
    ObjectNode data = events.data();
    data.put("gauge", "0x000000000000000000000000000000000000a001");
    data.put("amount", "100");

    events.emit(InjectorEventType.INJECTION_SUCCEEDED, data);

    ArgumentCaptor<Outbox> saved = ArgumentCaptor.forClass(Outbox.class);
    verify(repo).save(saved.capture());
    Outbox o = saved.getValue();
    assertThat(o.getTopic()).isEqualTo(KafkaTopics.INJECTOR_EVENTS);
    assertThat(o.getKey()).isEqualTo("INJECTION_SUCCEEDED");

    ObjectMapper om = new ObjectMapper();
    JsonNode evt = om.readTree(o.getValue());
    assertThat(evt.path("schema_version").asInt()).isEqualTo(1);
    assertThat(evt.path("occurred_at").asText()).isEqualTo(AT.toString());
    assertThat(evt.path("type").asText()).isEqualTo("INJECTION_SUCCEEDED");
    assertThat(evt.path("data").path("amount").asText()).isEqualTo("100");

    JsonNode headers = om.readTree(o.getHeaders());
    assertThat(headers.path("ce_type").asText()).isEqualTo("gi.injector.injection_succeeded");
    assertThat(headers.path("ce_id").asText()).isEqualTo(evt.path("event_id").asText());
  }

  @Test
  void missingDataBecomesEmptyObject() throws Exception {
    InjectorEvents events = new InjectorEvents(repo, Clock.fixed(AT, ZoneOffset.UTC));

    events.emit(InjectorEventType.UNPAUSED, null);

    ArgumentCaptor<Outbox> saved = ArgumentCaptor.forClass(Outbox.class);
    verify(repo).save(saved.capture());
    assertThat(new ObjectMapper().readTree(saved.getValue().getValue()).path("data").isObject()).isTrue();
  }
}
