package dev.gaugeinjector.gi.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import dev.gaugeinjector.gi.api.dto.ErrorResponse;
import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.SettingsNotInitializedException;
import dev.gaugeinjector.gi.gauge.GaugeCallException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(InjectorException.class)
  public ResponseEntity<ErrorResponse> injector(InjectorException e) {
    return ResponseEntity.status(e.getCode().status()).body(new ErrorResponse(e.getCode().name(), e.getMessage()));
  }

  @ExceptionHandler(GaugeCallException.class)
  public ResponseEntity<ErrorResponse> gauge(GaugeCallException e) {
    log.warn("gauge call failed gauge={}: {}", e.getGauge(), e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ErrorResponse("GAUGE_UNAVAILABLE", e.getMessage()));
  }

  @ExceptionHandler(SettingsNotInitializedException.class)
  public ResponseEntity<ErrorResponse> notReady(SettingsNotInitializedException e) {
    log.error("request arrived before settings bootstrap: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse("UNAVAILABLE", e.getMessage()));
  }
}
