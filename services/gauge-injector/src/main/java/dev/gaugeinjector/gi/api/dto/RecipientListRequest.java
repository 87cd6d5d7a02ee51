package dev.gaugeinjector.gi.api.dto;

import java.math.BigInteger;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecipientListRequest {
  private List<String> gauges;
  private List<BigInteger> amountsPerPeriod;
  private List<Integer> maxPeriods;
}
