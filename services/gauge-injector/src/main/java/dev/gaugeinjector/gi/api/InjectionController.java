package dev.gaugeinjector.gi.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.gaugeinjector.gi.api.dto.InjectRequest;
import dev.gaugeinjector.gi.app.InjectionExecutor;
import dev.gaugeinjector.gi.app.InjectionReport;
import dev.gaugeinjector.gi.config.AuthFilter;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/v1/injections")
@RequiredArgsConstructor
public class InjectionController {
  private final InjectionExecutor executor;

  @PostMapping
  public ResponseEntity<InjectionReport> inject(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody InjectRequest req) {
    return ResponseEntity.ok(executor.injectFunds(caller, req.getGauges()));
  }
}
