package dev.gaugeinjector.gi.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dev.gaugeinjector.gi.domain.enums.ErrorCode;
import dev.gaugeinjector.gi.domain.repo.LedgerAllowanceRepository;
import dev.gaugeinjector.gi.domain.repo.LedgerBalanceRepository;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import(JpaAssetLedger.class)
class JpaAssetLedgerTest {
  private static final String ASSET = "0x0000000000000000000000000000000000000001";
  private static final String ALICE = "0x00000000000000000000000000000000000a11ce";
  private static final String BOB = "0x0000000000000000000000000000000000000b0b";

  @Autowired
  JpaAssetLedger ledger;
  @Autowired
  LedgerBalanceRepository balances;
  @Autowired
  LedgerAllowanceRepository allowances;

  @BeforeEach
  void clean() {
    allowances.deleteAll();
    balances.deleteAll();
  }

  @Test
  void unknownHolderHasZeroBalance() {
    assertThat(ledger.balanceOf(ASSET, ALICE)).isZero();
    assertThat(ledger.allowance(ASSET, ALICE, BOB)).isZero();
  }

  @Test
  void transferMovesFunds() {
    ledger.credit(ASSET, ALICE, BigInteger.valueOf(100));

    ledger.transfer(ASSET, ALICE, BOB, BigInteger.valueOf(30));

    assertThat(ledger.balanceOf(ASSET, ALICE)).isEqualTo(BigInteger.valueOf(70));
    assertThat(ledger.balanceOf(ASSET, BOB)).isEqualTo(BigInteger.valueOf(30));
  }

  @Test
  void transferBeyondBalanceFails() {
    ledger.credit(ASSET, ALICE, BigInteger.TEN);

    assertThatThrownBy(() -> ledger.transfer(ASSET, ALICE, BOB, BigInteger.valueOf(11)))
        .extracting("code").isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
    assertThat(ledger.balanceOf(ASSET, ALICE)).isEqualTo(BigInteger.TEN);
  }

  @Test
  void approveOverwritesAllowance() {
    ledger.approve(ASSET, ALICE, BOB, BigInteger.valueOf(50));
    ledger.approve(ASSET, ALICE, BOB, BigInteger.valueOf(20));

    assertThat(ledger.allowance(ASSET, ALICE, BOB)).isEqualTo(BigInteger.valueOf(20));
  }

  @Test
  void transferFromConsumesAllowance() {
    ledger.credit(ASSET, ALICE, BigInteger.valueOf(100));
    ledger.approve(ASSET, ALICE, BOB, BigInteger.valueOf(60));

    ledger.transferFrom(ASSET, BOB, ALICE, BOB, BigInteger.valueOf(40));

    assertThat(ledger.allowance(ASSET, ALICE, BOB)).isEqualTo(BigInteger.valueOf(20));
    assertThat(ledger.balanceOf(ASSET, BOB)).isEqualTo(BigInteger.valueOf(40));
    assertThatThrownBy(() -> ledger.transferFrom(ASSET, BOB, ALICE, BOB, BigInteger.valueOf(21)))
        .extracting("code").isEqualTo(ErrorCode.INSUFFICIENT_BALANCE);
  }

  @Test
  void negativeAmountsAreInvalid() {
    assertThatThrownBy(() -> ledger.credit(ASSET, ALICE, BigInteger.valueOf(-1)))
        .extracting("code").isEqualTo(ErrorCode.INVALID_INPUT);
    assertThatThrownBy(() -> ledger.approve(ASSET, ALICE, BOB, BigInteger.valueOf(-1)))
        .extracting("code").isEqualTo(ErrorCode.INVALID_INPUT);
  }
}
