package com.onthegomap.rastertiler.util;

import java.text.NumberFormat;
import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Number and duration formatting for log lines and reports.
 */
public class Format {

  private static final Format DEFAULT = new Format(Locale.getDefault(Locale.Category.FORMAT));

  // NumberFormat is not thread safe
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> percent;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> decimal;
  @SuppressWarnings("java:S5164")
  private final ThreadLocal<NumberFormat> integer;

  private Format(Locale locale) {
    percent = withFractionDigits(() -> NumberFormat.getPercentInstance(locale), 0);
    decimal = withFractionDigits(() -> NumberFormat.getNumberInstance(locale), 1);
    integer = withFractionDigits(() -> NumberFormat.getNumberInstance(locale), 0);
  }

  private static ThreadLocal<NumberFormat> withFractionDigits(Supplier<NumberFormat> factory, int digits) {
    return ThreadLocal.withInitial(() -> {
      NumberFormat result = factory.get();
      result.setMaximumFractionDigits(digits);
      return result;
    });
  }

  public static Format forLocale(Locale locale) {
    return new Format(locale);
  }

  /** Returns the shared formatter for the JVM's default format locale. */
  public static Format defaultInstance() {
    return DEFAULT;
  }

  /** Formats a ratio like {@code 0.25} as {@code 25%}. */
  public String percent(double ratio) {
    return percent.get().format(ratio);
  }

  /** Formats with at most one digit after the decimal point. */
  public String decimal(double value) {
    return decimal.get().format(value);
  }

  /** Formats with grouping separators and no fraction, like {@code 1,234}. */
  public String integer(Number value) {
    return integer.get().format(value);
  }

  /** Formats sub-second durations like {@code 0.5s} and longer ones like {@code 1h2m3s}. */
  public String duration(Duration duration) {
    if (duration.compareTo(Duration.ofSeconds(1)) < 0) {
      return decimal(duration.toNanos() / 1e9) + "s";
    }
    long seconds = Math.round(duration.toNanos() / 1e9);
    return Duration.ofSeconds(seconds).toString().substring(2).toLowerCase(Locale.ROOT);
  }
}
