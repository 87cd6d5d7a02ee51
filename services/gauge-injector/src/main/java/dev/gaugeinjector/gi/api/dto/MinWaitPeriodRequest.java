package dev.gaugeinjector.gi.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MinWaitPeriodRequest {
  private long seconds;
}
