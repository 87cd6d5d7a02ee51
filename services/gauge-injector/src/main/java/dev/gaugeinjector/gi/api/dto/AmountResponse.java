package dev.gaugeinjector.gi.api.dto;

import java.math.BigInteger;

public record AmountResponse(String asset, BigInteger amount) {
}
