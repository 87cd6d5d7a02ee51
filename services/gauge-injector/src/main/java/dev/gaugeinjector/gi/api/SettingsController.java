package dev.gaugeinjector.gi.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.gaugeinjector.gi.api.dto.AddressRequest;
import dev.gaugeinjector.gi.api.dto.MinWaitPeriodRequest;
import dev.gaugeinjector.gi.api.dto.SettingsResponse;
import dev.gaugeinjector.gi.app.PauseSwitch;
import dev.gaugeinjector.gi.app.SettingsService;
import dev.gaugeinjector.gi.config.AuthFilter;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/v1/settings")
@RequiredArgsConstructor
public class SettingsController {
  private final SettingsService settings;
  private final PauseSwitch pause;

  @GetMapping
  public ResponseEntity<SettingsResponse> get() {
    return ResponseEntity.ok(SettingsResponse.from(settings.current()));
  }

  @PutMapping("/keeper")
  public ResponseEntity<SettingsResponse> setKeeper(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody AddressRequest req) {
    return ResponseEntity.ok(SettingsResponse.from(settings.setKeeperAddress(caller, req.getAddress())));
  }

  @PutMapping("/min-wait-period")
  public ResponseEntity<SettingsResponse> setMinWaitPeriod(
      @RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller, @RequestBody MinWaitPeriodRequest req) {
    return ResponseEntity.ok(SettingsResponse.from(settings.setMinWaitPeriodSeconds(caller, req.getSeconds())));
  }

  @PutMapping("/inject-token")
  public ResponseEntity<SettingsResponse> setInjectToken(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody AddressRequest req) {
    return ResponseEntity.ok(SettingsResponse.from(settings.setInjectTokenAddress(caller, req.getAddress())));
  }

  @PostMapping("/pause")
  public ResponseEntity<SettingsResponse> pause(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller) {
    pause.pause(caller);
    return ResponseEntity.ok(SettingsResponse.from(settings.current()));
  }

  @PostMapping("/unpause")
  public ResponseEntity<SettingsResponse> unpause(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller) {
    pause.unpause(caller);
    return ResponseEntity.ok(SettingsResponse.from(settings.current()));
  }

  @PostMapping("/ownership/transfer")
  public ResponseEntity<SettingsResponse> transferOwnership(
      @RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller, @RequestBody AddressRequest req) {
    return ResponseEntity.ok(SettingsResponse.from(settings.transferOwnership(caller, req.getAddress())));
  }

  @PostMapping("/ownership/accept")
  public ResponseEntity<SettingsResponse> acceptOwnership(
      @RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller) {
    return ResponseEntity.ok(SettingsResponse.from(settings.acceptOwnership(caller)));
  }
}
