package dev.gaugeinjector.gi.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.gaugeinjector.gi.domain.entity.Outbox;
import dev.gaugeinjector.gi.domain.repo.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Ships outbox rows to Kafka in insertion order, at least once. Consumers
 * dedupe on the {@code ce_id} header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gi.outbox", name = "relay-enabled", havingValue = "true", matchIfMissing = true)
public class OutboxRelay {
  static final List<Duration> RETRY_DELAYS = List.of(
      Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(15),
      Duration.ofHours(1), Duration.ofHours(4), Duration.ofHours(8));
  static final int MAX_ATTEMPTS = 10;
  static final int BATCH_SIZE = 100;
  static final Duration RETENTION = Duration.ofDays(7);
  static final String DEAD_MARKER = "DEAD: ";

  private static final TypeReference<Map<String, String>> HEADER_MAP = new TypeReference<>() {
  };

  private final OutboxRepository repo;
  private final KafkaTemplate<String, String> kafka;
  private final Clock clock;
  private final ObjectMapper om = new ObjectMapper();

  @Scheduled(fixedDelayString = "${gi.outbox.drain-interval-ms:500}")
  @Transactional
  public void drain() {
    OffsetDateTime now = OffsetDateTime.now(clock);
    List<Outbox> pending = repo.fetchUnsentOrdered(PageRequest.of(0, BATCH_SIZE));
    int shipped = 0;

    for (Outbox o : pending) {
      if (o.getAttempts() >= MAX_ATTEMPTS) {
        bury(o);
        continue;
      }
      if (!isDue(o, now))
        continue;

      o.setAttempts(o.getAttempts() + 1);
      try {
        kafka.send(toRecord(o)).get();
        o.setSentAt(now);
        o.setLastError(null);
        shipped++;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        recordFailure(o, e);
        repo.save(o);
        return;
      } catch (ExecutionException | IOException | RuntimeException e) {
        recordFailure(o, e);
      }
      repo.save(o);
    }

    if (shipped > 0)
      log.debug("outbox shipped {}/{} rows", shipped, pending.size());
  }

  @Scheduled(fixedDelay = 60_000)
  @Transactional
  public void cleanup() {
    int removed = repo.deleteSentBefore(OffsetDateTime.now(clock).minus(RETENTION));
    if (removed > 0)
      log.info("outbox cleanup removed {} sent rows", removed);
    long dead = repo.countDeadMessages();
    if (dead > 0)
      log.warn("outbox holds {} dead rows", dead);
  }

  /** First attempt is immediate; retries wait out the delay for their attempt number. */
  boolean isDue(Outbox o, OffsetDateTime now) {
    if (o.getAttempts() == 0)
      return true;
    Duration delay = RETRY_DELAYS.get(Math.min(o.getAttempts() - 1, RETRY_DELAYS.size() - 1));
    return !now.isBefore(o.getCreatedAt().plus(delay));
  }

  private ProducerRecord<String, String> toRecord(Outbox o) throws IOException {
    RecordHeaders headers = new RecordHeaders();
    Map<String, String> values = om.readValue(o.getHeaders(), HEADER_MAP);
    values.forEach((k, v) -> headers.add(k, v.getBytes(StandardCharsets.UTF_8)));
    return new ProducerRecord<>(o.getTopic(), null, o.getKey(), o.getValue(), headers);
  }

  private void recordFailure(Outbox o, Exception e) {
    Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
    String msg = String.valueOf(cause.getMessage());
    o.setLastError(msg.length() > 500 ? msg.substring(0, 500) : msg);
    if (o.getAttempts() >= MAX_ATTEMPTS)
      log.error("outbox row id={} topic={} gave up after {} attempts", o.getId(), o.getTopic(), o.getAttempts(), e);
    else
      log.warn("outbox row id={} topic={} attempt {}/{} failed: {}", o.getId(), o.getTopic(), o.getAttempts(),
          MAX_ATTEMPTS, msg);
  }

  private void bury(Outbox o) {
    o.setLastError(DEAD_MARKER + (o.getLastError() == null ? "retries exhausted" : o.getLastError()));
    repo.save(o);
    log.error("outbox row id={} marked dead after {} attempts", o.getId(), o.getAttempts());
  }
}
