package dev.gaugeinjector.gi.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Singleton configuration row. Every mutating operation locks it first, which
 * serializes writers.
 */
@Entity
@Table(name = "injector_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InjectorSettings {

  public static final int SINGLETON_ID = 1;

  @Id
  @Column(name = "id", nullable = false)
  @Builder.Default
  private Integer id = SINGLETON_ID;

  @Column(name = "owner_address", length = 42, nullable = false)
  private String ownerAddress;

  @Column(name = "pending_owner_address", length = 42)
  private String pendingOwnerAddress;

  @Column(name = "keeper_address", length = 42, nullable = false)
  private String keeperAddress;

  @Column(name = "min_wait_period_seconds", nullable = false)
  private long minWaitPeriodSeconds;

  @Column(name = "inject_token_address", length = 42, nullable = false)
  private String injectTokenAddress;

  /** this injector's own holder address on the ledger */
  @Column(name = "custody_address", length = 42, nullable = false)
  private String custodyAddress;

  @Column(name = "paused", nullable = false)
  private boolean paused;
}
