package dev.gaugeinjector.gi.ledger;

import java.math.BigInteger;

public interface AssetLedger {

  BigInteger balanceOf(String asset, String holder);

  BigInteger allowance(String asset, String owner, String spender);

  /** Sets (not adds to) the spender's allowance over the owner's balance. */
  void approve(String asset, String owner, String spender, BigInteger amount);

  void transfer(String asset, String from, String to, BigInteger amount);

  /** Moves funds on behalf of {@code from}, consuming the spender's allowance. */
  void transferFrom(String asset, String spender, String from, String to, BigInteger amount);

  /** Books funds arriving from outside the ledger. */
  void credit(String asset, String holder, BigInteger amount);
}
