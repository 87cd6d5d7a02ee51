package dev.gaugeinjector.gi.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PerformRequest {
  /** as returned by the check endpoint */
  private String payload;
}
