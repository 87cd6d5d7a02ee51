package dev.gaugeinjector.gi.util;

import java.util.Locale;
import java.util.regex.Pattern;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public final class Addresses {
  public static final String ZERO = "0x0000000000000000000000000000000000000000";

  private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

  public static boolean isValid(String s) {
    return s != null && HEX_ADDRESS.matcher(s).matches();
  }

  /**
   * Lower-cases a well-formed address; throws IllegalArgumentException otherwise.
   */
  public static String normalize(String s) {
    if (!isValid(s))
      throw new IllegalArgumentException("malformed address: " + s);
    return s.toLowerCase(Locale.ROOT);
  }

  public static boolean isZero(String s) {
    return s == null || ZERO.equalsIgnoreCase(s);
  }

  public static boolean same(String a, String b) {
    return a != null && b != null && a.equalsIgnoreCase(b);
  }
}
