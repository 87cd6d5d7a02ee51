package dev.gaugeinjector.gi.domain;

import dev.gaugeinjector.gi.domain.enums.ErrorCode;
import lombok.Getter;

@Getter
public class InjectorException extends RuntimeException {
  private final ErrorCode code;

  public InjectorException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public InjectorException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public static InjectorException invalidInput(String message) {
    return new InjectorException(ErrorCode.INVALID_INPUT, message);
  }

  public static InjectorException notAuthorized(String caller) {
    return new InjectorException(ErrorCode.CALLER_NOT_AUTHORIZED, "caller not authorized: " + caller);
  }

  public static InjectorException paused() {
    return new InjectorException(ErrorCode.PAUSED, "injector is paused");
  }
}
