package dev.gaugeinjector.gi.api.dto;

import java.math.BigInteger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shared by sweep (amount ignored), withdraw (asset ignored), manual deposits
 * and inbound deposits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssetAmountRequest {
  private String gauge;
  private String asset;
  private BigInteger amount;
}
