package dev.gaugeinjector.gi.api;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.gaugeinjector.gi.api.dto.AccountInfoResponse;
import dev.gaugeinjector.gi.api.dto.RecipientListRequest;
import dev.gaugeinjector.gi.app.BalanceReconciler;
import dev.gaugeinjector.gi.app.ReadinessEvaluator;
import dev.gaugeinjector.gi.app.ScheduleRegistry;
import dev.gaugeinjector.gi.config.AuthFilter;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/v1/schedule")
@RequiredArgsConstructor
public class ScheduleController {
  private final ScheduleRegistry registry;
  private final ReadinessEvaluator readiness;
  private final BalanceReconciler reconciler;

  @PutMapping("/recipients")
  public ResponseEntity<List<String>> setRecipientList(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody RecipientListRequest req) {
    return ResponseEntity.ok(
        registry.setRecipientList(caller, req.getGauges(), req.getAmountsPerPeriod(), req.getMaxPeriods()));
  }

  @PutMapping("/recipients/validated")
  public ResponseEntity<List<String>> setValidatedRecipientList(
      @RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller, @RequestBody RecipientListRequest req) {
    return ResponseEntity.ok(registry.setValidatedRecipientList(caller, req.getGauges(), req.getAmountsPerPeriod(),
        req.getMaxPeriods()));
  }

  @GetMapping("/watch-list")
  public ResponseEntity<List<String>> watchList() {
    return ResponseEntity.ok(registry.getWatchList());
  }

  @GetMapping("/accounts/{gauge}")
  public ResponseEntity<AccountInfoResponse> accountInfo(@PathVariable("gauge") String gauge) {
    return ResponseEntity.ok(AccountInfoResponse.from(registry.getAccountInfo(gauge)));
  }

  @GetMapping("/ready")
  public ResponseEntity<List<String>> readyGauges() {
    return ResponseEntity.ok(readiness.getReadyGauges());
  }

  @GetMapping("/reconciliation")
  public ResponseEntity<BalanceReconciler.Reconciliation> reconciliation() {
    return ResponseEntity.ok(reconciler.reconcile());
  }
}
