package dev.gaugeinjector.gi.domain.entity;

import java.io.Serializable;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerBalanceId implements Serializable {

  @Column(name = "asset", length = 42, nullable = false)
  private String asset;

  @Column(name = "holder", length = 42, nullable = false)
  private String holder;
}
