package dev.gaugeinjector.gi.gauge;

public class GaugeCallException extends RuntimeException {
  private final String gauge;

  public GaugeCallException(String gauge, String message, Throwable cause) {
    super(message, cause);
    this.gauge = gauge;
  }

  public GaugeCallException(String gauge, String message) {
    super(message);
    this.gauge = gauge;
  }

  public String getGauge() {
    return gauge;
  }
}
