package dev.gaugeinjector.gi.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import dev.gaugeinjector.gi.api.dto.PerformRequest;
import dev.gaugeinjector.gi.app.AutomationService;
import dev.gaugeinjector.gi.app.InjectionReport;

@ExtendWith(MockitoExtension.class)
class AutomationControllerTest {
  private static final String KEEPER = "0x00000000000000000000000000000000000000bb";
  private static final String A = "0x000000000000000000000000000000000000a001";

  @Mock
  AutomationService automation;

  @InjectMocks
  AutomationController controller;

  @Test
  void checkThenPerform() {
    when(automation.check()).thenReturn(new AutomationService.CheckResult(true, "abc"));
    when(automation.perform(KEEPER, "abc")).thenReturn(new InjectionReport(List.of(A), BigInteger.TEN));

    AutomationService.CheckResult check = controller.check().getBody();
    InjectionReport report = controller.perform(KEEPER, new PerformRequest(check.payload())).getBody();

    assertThat(report.injected()).containsExactly(A);
    assertThat(report.totalAmount()).isEqualTo(BigInteger.TEN);
  }
}
