package dev.gaugeinjector.gi.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.gaugeinjector.gi.api.dto.PerformRequest;
import dev.gaugeinjector.gi.app.AutomationService;
import dev.gaugeinjector.gi.app.InjectionReport;
import dev.gaugeinjector.gi.config.AuthFilter;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/v1/automation")
@RequiredArgsConstructor
public class AutomationController {
  private final AutomationService automation;

  @GetMapping("/check")
  public ResponseEntity<AutomationService.CheckResult> check() {
    return ResponseEntity.ok(automation.check());
  }

  @PostMapping("/perform")
  public ResponseEntity<InjectionReport> perform(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody PerformRequest req) {
    return ResponseEntity.ok(automation.perform(caller, req.getPayload()));
  }
}
