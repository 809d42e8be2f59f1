package com.codeheadsystems.geni.srp;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Formats the {@code TIMESTAMP} challenge response, e.g. {@code Tue Mar 04 09:05:01 UTC 2025}.
 * The same text is signed into the proof and sent to the server, so it is produced once per
 * attempt.
 */
public class ClaimTimestamp {

  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss 'UTC' yyyy", Locale.US).withZone(ZoneOffset.UTC);

  private ClaimTimestamp() {
  }

  /**
   * Formats the given instant.
   *
   * @param instant the instant
   * @return the timestamp text
   */
  public static String format(Instant instant) {
    return FORMAT.format(instant);
  }

  /**
   * Formats the clock's current instant.
   *
   * @param clock the clock
   * @return the timestamp text
   */
  public static String now(Clock clock) {
    return format(clock.instant());
  }
}
