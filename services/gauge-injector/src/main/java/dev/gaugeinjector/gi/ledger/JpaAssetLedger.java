package dev.gaugeinjector.gi.ledger;

import java.math.BigInteger;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import dev.gaugeinjector.gi.domain.InjectorException;
import dev.gaugeinjector.gi.domain.entity.LedgerAllowance;
import dev.gaugeinjector.gi.domain.entity.LedgerAllowanceId;
import dev.gaugeinjector.gi.domain.entity.LedgerBalance;
import dev.gaugeinjector.gi.domain.entity.LedgerBalanceId;
import dev.gaugeinjector.gi.domain.enums.ErrorCode;
import dev.gaugeinjector.gi.domain.repo.LedgerAllowanceRepository;
import dev.gaugeinjector.gi.domain.repo.LedgerBalanceRepository;
import lombok.RequiredArgsConstructor;

/**
 * Ledger kept in the service database, so ledger movements commit or roll back
 * together with the schedule changes of the same operation.
 */
@Component
@RequiredArgsConstructor
public class JpaAssetLedger implements AssetLedger {
  private final LedgerBalanceRepository balances;
  private final LedgerAllowanceRepository allowances;

  @Override
  @Transactional(readOnly = true)
  public BigInteger balanceOf(String asset, String holder) {
    return balances.findById(new LedgerBalanceId(asset, holder))
        .map(LedgerBalance::getAmount)
        .orElse(BigInteger.ZERO);
  }

  @Override
  @Transactional(readOnly = true)
  public BigInteger allowance(String asset, String owner, String spender) {
    return allowances.findById(new LedgerAllowanceId(asset, owner, spender))
        .map(LedgerAllowance::getAmount)
        .orElse(BigInteger.ZERO);
  }

  @Override
  @Transactional
  public void approve(String asset, String owner, String spender, BigInteger amount) {
    requireNonNegative(amount);
    LedgerAllowanceId id = new LedgerAllowanceId(asset, owner, spender);
    LedgerAllowance a = allowances.findById(id).orElseGet(() -> new LedgerAllowance(id, BigInteger.ZERO));
    a.setAmount(amount);
    allowances.save(a);
  }

  @Override
  @Transactional
  public void transfer(String asset, String from, String to, BigInteger amount) {
    requireNonNegative(amount);
    LedgerBalance src = balances.findById(new LedgerBalanceId(asset, from)).orElse(null);
    BigInteger available = src == null ? BigInteger.ZERO : src.getAmount();
    if (available.compareTo(amount) < 0) {
      throw new InjectorException(ErrorCode.INSUFFICIENT_BALANCE,
          "insufficient balance: holder=" + from + " asset=" + asset + " available=" + available + " requested="
              + amount);
    }
    if (amount.signum() == 0 || from.equals(to))
      return;
    src.setAmount(available.subtract(amount));
    balances.save(src);
    credit(asset, to, amount);
  }

  @Override
  @Transactional
  public void transferFrom(String asset, String spender, String from, String to, BigInteger amount) {
    requireNonNegative(amount);
    LedgerAllowanceId id = new LedgerAllowanceId(asset, from, spender);
    LedgerAllowance a = allowances.findById(id).orElse(null);
    BigInteger allowed = a == null ? BigInteger.ZERO : a.getAmount();
    if (allowed.compareTo(amount) < 0) {
      throw new InjectorException(ErrorCode.INSUFFICIENT_BALANCE,
          "insufficient allowance: owner=" + from + " spender=" + spender + " allowed=" + allowed + " requested="
              + amount);
    }
    transfer(asset, from, to, amount);
    if (a != null) {
      a.setAmount(allowed.subtract(amount));
      allowances.save(a);
    }
  }

  @Override
  @Transactional
  public void credit(String asset, String holder, BigInteger amount) {
    requireNonNegative(amount);
    LedgerBalanceId id = new LedgerBalanceId(asset, holder);
    LedgerBalance b = balances.findById(id).orElseGet(() -> new LedgerBalance(id, BigInteger.ZERO));
    b.setAmount(b.getAmount().add(amount));
    balances.save(b);
  }

  private static void requireNonNegative(BigInteger amount) {
    if (amount == null || amount.signum() < 0)
      throw InjectorException.invalidInput("amount must be non-negative: " + amount);
  }
}
