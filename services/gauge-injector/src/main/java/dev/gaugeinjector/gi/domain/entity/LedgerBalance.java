package dev.gaugeinjector.gi.domain.entity;

import java.math.BigInteger;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "ledger_balance")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class LedgerBalance {

  @EmbeddedId
  private LedgerBalanceId id;

  @Column(name = "amount", nullable = false, precision = 78, scale = 0)
  private BigInteger amount = BigInteger.ZERO;
}
