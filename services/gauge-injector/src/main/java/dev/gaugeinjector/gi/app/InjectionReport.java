package dev.gaugeinjector.gi.app;

import java.math.BigInteger;
import java.util.List;

public record InjectionReport(List<String> injected, BigInteger totalAmount) {
}
