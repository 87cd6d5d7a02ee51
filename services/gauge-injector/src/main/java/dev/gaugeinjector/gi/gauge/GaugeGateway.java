package dev.gaugeinjector.gi.gauge;

import java.math.BigInteger;

public interface GaugeGateway {

  RewardData rewardData(String gauge, String asset);

  /**
   * Asks the gauge to pull {@code amount} of {@code asset} from {@code custody}.
   * The caller must have approved the gauge for at least that amount.
   *
   * @throws GaugeCallException if the gauge rejects or cannot be reached
   */
  void depositRewardToken(String gauge, String asset, String custody, BigInteger amount);
}
