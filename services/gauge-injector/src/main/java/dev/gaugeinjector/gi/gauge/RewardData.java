package dev.gaugeinjector.gi.gauge;

/**
 * A gauge's reward state for one asset.
 *
 * @param distributor  address allowed to deposit the asset into the gauge
 * @param periodFinish epoch seconds at which the current reward period ends
 */
public record RewardData(String distributor, long periodFinish) {
}
