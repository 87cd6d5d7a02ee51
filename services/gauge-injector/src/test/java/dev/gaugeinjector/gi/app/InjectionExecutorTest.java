package dev.gaugeinjector.gi.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.enums.ErrorCode;
import dev.gaugeinjector.gi.domain.enums.InjectorEventType;
import dev.gaugeinjector.gi.gauge.RewardData;

class InjectionExecutorTest extends InjectorJpaTestSupport {

  private void scheduleAandB() {
    fund(400);
    registry.setValidatedRecipientList(OWNER, List.of(GAUGE_A, GAUGE_B), amounts(100, 50), List.of(3, 2));
  }

  @Test
  void injectsOnePeriodIntoEachReadyGauge() {
    scheduleAandB();
    assertThat(reconciler.exactMatch()).isTrue();
    assertThat(readiness.getReadyGauges()).containsExactly(GAUGE_A, GAUGE_B);

    InjectionReport report = executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_B));

    assertThat(report.injected()).containsExactly(GAUGE_A, GAUGE_B);
    assertThat(report.totalAmount()).isEqualTo(BigInteger.valueOf(150));
    assertThat(periodNumber(GAUGE_A)).isEqualTo(1);
    assertThat(periodNumber(GAUGE_B)).isEqualTo(1);
    assertThat(custodyBalance()).isEqualTo(BigInteger.valueOf(250));
    assertThat(ledger.balanceOf(TOKEN, GAUGE_A)).isEqualTo(BigInteger.valueOf(100));
    assertThat(ledger.allowance(TOKEN, CUSTODY, GAUGE_A)).isZero();
    assertThat(scheduleRepo.findById(GAUGE_A).orElseThrow().getLastInjectionTimestamp()).isEqualTo(START);
    assertThat(countEvents(InjectorEventType.INJECTION_SUCCEEDED)).isEqualTo(2);
    // remaining obligation still matches what is left
    assertThat(reconciler.exactMatch()).isTrue();
  }

  @Test
  void injectingOneGaugeLeavesOtherEligibleEntriesUntouched() {
    scheduleAandB();
    clock.advanceSeconds(60);
    assertThat(readiness.getReadyGauges()).contains(GAUGE_B);
    long bTimestampBefore = scheduleRepo.findById(GAUGE_B).orElseThrow().getLastInjectionTimestamp();

    InjectionReport report = executor.injectFunds(OWNER, List.of(GAUGE_A));

    assertThat(report.injected()).containsExactly(GAUGE_A);
    assertThat(periodNumber(GAUGE_A)).isEqualTo(1);
    assertThat(scheduleRepo.findById(GAUGE_A).orElseThrow().getLastInjectionTimestamp()).isEqualTo(START + 60);
    assertThat(periodNumber(GAUGE_B)).isZero();
    assertThat(scheduleRepo.findById(GAUGE_B).orElseThrow().getLastInjectionTimestamp()).isEqualTo(bTimestampBefore);
    assertThat(ledger.balanceOf(TOKEN, GAUGE_B)).isZero();
    assertThat(readiness.getReadyGauges()).containsExactly(GAUGE_B);
  }

  @Test
  void failedDepositRollsBackTheWholeBatch() {
    scheduleAandB();
    gauges.failDeposits(GAUGE_B);

    assertThatThrownBy(() -> executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_B)))
        .isInstanceOf(InjectorException.class)
        .extracting("code").isEqualTo(ErrorCode.RECIPIENT_DEPOSIT_FAILED);

    assertThat(periodNumber(GAUGE_A)).isZero();
    assertThat(periodNumber(GAUGE_B)).isZero();
    assertThat(custodyBalance()).isEqualTo(BigInteger.valueOf(400));
    assertThat(ledger.balanceOf(TOKEN, GAUGE_A)).isZero();
    assertThat(ledger.allowance(TOKEN, CUSTODY, GAUGE_A)).isZero();
    assertThat(ledger.allowance(TOKEN, CUSTODY, GAUGE_B)).isZero();
    assertThat(countEvents(InjectorEventType.INJECTION_SUCCEEDED)).isZero();
    assertThat(countEvents(InjectorEventType.INJECTION_FAILED)).isEqualTo(1);
  }

  @Test
  void failingGaugeBlocksLaterBatchesUntilRemoved() {
    scheduleAandB();
    gauges.failDeposits(GAUGE_A);

    assertThatThrownBy(() -> executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_B)))
        .extracting("code").isEqualTo(ErrorCode.RECIPIENT_DEPOSIT_FAILED);
    assertThat(readiness.getReadyGauges()).containsExactly(GAUGE_A, GAUGE_B);

    InjectionReport report = executor.injectFunds(OWNER, List.of(GAUGE_B));
    assertThat(report.injected()).containsExactly(GAUGE_B);
  }

  @Test
  void pausedRejectsBeforeCallerCheck() {
    scheduleAandB();
    pauseSwitch.pause(OWNER);

    assertThatThrownBy(() -> executor.injectFunds(OWNER, List.of(GAUGE_A)))
        .extracting("code").isEqualTo(ErrorCode.PAUSED);
    assertThatThrownBy(() -> executor.injectFunds(STRANGER, List.of(GAUGE_A)))
        .extracting("code").isEqualTo(ErrorCode.PAUSED);
    assertThat(periodNumber(GAUGE_A)).isZero();
  }

  @Test
  void nonOwnerCannotInject() {
    scheduleAandB();

    assertThatThrownBy(() -> executor.injectFunds(KEEPER, List.of(GAUGE_A)))
        .extracting("code").isEqualTo(ErrorCode.CALLER_NOT_AUTHORIZED);
    assertThat(custodyBalance()).isEqualTo(BigInteger.valueOf(400));
  }

  @Test
  void skipsUnknownMalformedAndIneligibleCandidates() {
    scheduleAandB();
    gauges.setRewardData(GAUGE_B, new RewardData(CUSTODY, START + 10));

    InjectionReport report = executor.injectFunds(OWNER, List.of("not-an-address", GAUGE_C, GAUGE_B, GAUGE_A));

    assertThat(report.injected()).containsExactly(GAUGE_A);
    assertThat(periodNumber(GAUGE_B)).isZero();
  }

  @Test
  void repeatedCandidateIsInjectedOnceUnderMinWait() {
    scheduleAandB();

    InjectionReport report = executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_A));

    assertThat(report.injected()).containsExactly(GAUGE_A);
    assertThat(periodNumber(GAUGE_A)).isEqualTo(1);
  }

  @Test
  void repeatedCandidateIsInjectedAgainWithoutMinWait() {
    scheduleAandB();
    settings.setMinWaitPeriodSeconds(OWNER, 0);

    InjectionReport report = executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_A));

    assertThat(report.injected()).containsExactly(GAUGE_A, GAUGE_A);
    assertThat(periodNumber(GAUGE_A)).isEqualTo(2);
  }

  @Test
  void minWaitPeriodGatesTheNextInjection() {
    scheduleAandB();
    executor.injectFunds(OWNER, List.of(GAUGE_A));

    clock.advanceSeconds(MIN_WAIT - 1);
    assertThat(executor.injectFunds(OWNER, List.of(GAUGE_A)).injected()).isEmpty();

    clock.advanceSeconds(1);
    assertThat(executor.injectFunds(OWNER, List.of(GAUGE_A)).injected()).containsExactly(GAUGE_A);
    assertThat(scheduleRepo.findById(GAUGE_A).orElseThrow().getLastInjectionTimestamp())
        .isEqualTo(START + MIN_WAIT);
  }

  @Test
  void stopsAfterMaxPeriods() {
    scheduleAandB();
    for (int i = 0; i < 3; i++) {
      executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_B));
      clock.advanceSeconds(MIN_WAIT);
    }

    assertThat(periodNumber(GAUGE_A)).isEqualTo(3);
    assertThat(periodNumber(GAUGE_B)).isEqualTo(2);
    assertThat(custodyBalance()).isZero();
    assertThat(executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_B)).injected()).isEmpty();
  }

  @Test
  void liveBalanceLimitsTheBatch() {
    registry.setRecipientList(OWNER, List.of(GAUGE_A, GAUGE_B), amounts(100, 50), List.of(3, 2));
    fund(120);

    InjectionReport report = executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_B));

    assertThat(report.injected()).containsExactly(GAUGE_A);
    assertThat(custodyBalance()).isEqualTo(BigInteger.valueOf(20));
  }

  @Test
  void skipsGaugeThatNoLongerNamesCustodyAsDistributor() {
    scheduleAandB();
    gauges.setRewardData(GAUGE_A, new RewardData(STRANGER, 0L));

    assertThat(executor.injectFunds(OWNER, List.of(GAUGE_A, GAUGE_B)).injected()).containsExactly(GAUGE_B);
  }

  @Test
  void nullCandidateListIsInvalid() {
    assertThatThrownBy(() -> executor.injectFunds(OWNER, null))
        .extracting("code").isEqualTo(ErrorCode.INVALID_INPUT);
  }
}
