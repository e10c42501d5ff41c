package com.gentoro.onellm.utility;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class StringUtility {
  private static final Pattern DURATION =
      Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h)?$", Pattern.CASE_INSENSITIVE);

  private StringUtility() {}

  /**
   * Parses durations such as {@code 500ms}, {@code 4s}, {@code 2m}, {@code 1h}, a bare number of
   * seconds, or an ISO-8601 value ({@code PT10S}).
   *
   * @throws IllegalArgumentException when the value is not a duration
   */
  public static Duration parseDuration(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Empty duration");
    }
    String trimmed = value.trim();
    if (trimmed.toUpperCase(Locale.ROOT).startsWith("PT")) {
      return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
    }
    Matcher matcher = DURATION.matcher(trimmed);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid duration: " + value);
    }
    double amount = Double.parseDouble(matcher.group(1));
    String unit = matcher.group(2) == null ? "s" : matcher.group(2).toLowerCase(Locale.ROOT);
    long millis =
        switch (unit) {
          case "ms" -> Math.round(amount);
          case "m" -> Math.round(amount * 60_000);
          case "h" -> Math.round(amount * 3_600_000);
          default -> Math.round(amount * 1_000);
        };
    return Duration.ofMillis(millis);
  }

  /** Masks a secret, keeping at most the last four characters visible. */
  public static String mask(String secret) {
    if (secret == null || secret.isEmpty()) return "";
    if (secret.length() <= 8) return "***";
    return "***" + secret.substring(secret.length() - 4);
  }
}
