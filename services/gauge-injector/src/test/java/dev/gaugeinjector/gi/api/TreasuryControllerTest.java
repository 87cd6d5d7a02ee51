package dev.gaugeinjector.gi.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import dev.gaugeinjector.gi.api.dto.AmountResponse;
import dev.gaugeinjector.gi.api.dto.AssetAmountRequest;
import dev.gaugeinjector.gi.app.SettingsService;
import dev.gaugeinjector.gi.app.TreasuryService;
import dev.gaugeinjector.gi.domain.entity.InjectorSettings;

@ExtendWith(MockitoExtension.class)
class TreasuryControllerTest {
  private static final String OWNER = "0x00000000000000000000000000000000000000aa";
  private static final String TOKEN = "0x0000000000000000000000000000000000000001";
  private static final String A = "0x000000000000000000000000000000000000a001";

  @Mock
  TreasuryService treasury;
  @Mock
  SettingsService settings;

  @InjectMocks
  TreasuryController controller;

  @Test
  void balanceIsReportedInConfiguredAsset() {
    when(settings.current()).thenReturn(InjectorSettings.builder().injectTokenAddress(TOKEN).build());
    when(treasury.getBalance()).thenReturn(BigInteger.valueOf(400));

    AmountResponse body = controller.balance().getBody();

    assertThat(body.asset()).isEqualTo(TOKEN);
    assertThat(body.amount()).isEqualTo(BigInteger.valueOf(400));
  }

  @Test
  void manualDepositReturnsNoContent() {
    var res = controller.manualDeposit(OWNER, new AssetAmountRequest(A, TOKEN, BigInteger.TEN));

    assertThat(res.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    verify(treasury).manualDeposit(OWNER, A, TOKEN, BigInteger.TEN);
  }
}
