package dev.gaugeinjector.gi.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.gaugeinjector.gi.api.dto.AmountResponse;
import dev.gaugeinjector.gi.api.dto.AssetAmountRequest;
import dev.gaugeinjector.gi.app.SettingsService;
import dev.gaugeinjector.gi.app.TreasuryService;
import dev.gaugeinjector.gi.config.AuthFilter;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/v1/treasury")
@RequiredArgsConstructor
public class TreasuryController {
  private final TreasuryService treasury;
  private final SettingsService settings;

  @GetMapping("/balance")
  public ResponseEntity<AmountResponse> balance() {
    return ResponseEntity.ok(new AmountResponse(settings.current().getInjectTokenAddress(), treasury.getBalance()));
  }

  @PostMapping("/sweep")
  public ResponseEntity<AmountResponse> sweep(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody AssetAmountRequest req) {
    return ResponseEntity.ok(new AmountResponse(req.getAsset(), treasury.sweep(caller, req.getAsset())));
  }

  @PostMapping("/withdraw")
  public ResponseEntity<AmountResponse> withdraw(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody AssetAmountRequest req) {
    return ResponseEntity.ok(new AmountResponse(settings.current().getInjectTokenAddress(),
        treasury.withdraw(caller, req.getAmount())));
  }

  @PostMapping("/manual-deposit")
  public ResponseEntity<Void> manualDeposit(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody AssetAmountRequest req) {
    treasury.manualDeposit(caller, req.getGauge(), req.getAsset(), req.getAmount());
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/deposits")
  public ResponseEntity<AmountResponse> deposit(@RequestAttribute(AuthFilter.CALLER_ATTRIBUTE) String caller,
      @RequestBody AssetAmountRequest req) {
    return ResponseEntity.ok(new AmountResponse(req.getAsset(),
        treasury.recordDeposit(caller, req.getAsset(), req.getAmount())));
  }
}
