package dev.gaugeinjector.gi.domain.entity;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "outbox")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Outbox {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id")
  private Long id;

  @Column(name = "topic", nullable = false)
  private String topic;

  @Column(name = "k")
  private String key;

  /** event envelope, JSON text */
  @Column(name = "v", length = 8192, nullable = false)
  private String value;

  /** header name -> value, JSON text */
  @Column(name = "headers", length = 2048, nullable = false)
  @Builder.Default
  private String headers = "{}";

  @Column(name = "created_at")
  private OffsetDateTime createdAt;

  @Column(name = "sent_at")
  private OffsetDateTime sentAt;

  @Column(name = "attempts", nullable = false)
  @Builder.Default
  private int attempts = 0;

  @Column(name = "last_error", length = 1024)
  private String lastError;

  @PrePersist
  void prePersist() {
    if (headers == null)
      headers = "{}";
    if (createdAt == null)
      createdAt = OffsetDateTime.now();
  }
}
