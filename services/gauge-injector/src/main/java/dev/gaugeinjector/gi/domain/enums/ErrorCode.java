package dev.gaugeinjector.gi.domain.enums;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
  INVALID_INPUT(HttpStatus.BAD_REQUEST),
  DUPLICATE_ADDRESS(HttpStatus.CONFLICT),
  PERIODS_NOT_FINISHED(HttpStatus.CONFLICT),
  BALANCE_MISMATCH(HttpStatus.CONFLICT),
  CALLER_NOT_AUTHORIZED(HttpStatus.FORBIDDEN),
  RECIPIENT_DEPOSIT_FAILED(HttpStatus.BAD_GATEWAY),
  ZERO_ADDRESS_RECIPIENT(HttpStatus.CONFLICT),
  PAUSED(HttpStatus.LOCKED),
  INSUFFICIENT_BALANCE(HttpStatus.CONFLICT),
  NOT_FOUND(HttpStatus.NOT_FOUND);

  private final HttpStatus status;

  ErrorCode(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
