package io.fsdebounce;

import java.util.Objects;
import java.util.Properties;

/**
 * Externalized debouncer settings.
 *
 * <p>Can be populated from a {@link Properties} source with {@link #fromProperties(Properties)}
 * and applied through {@link Debouncer.Builder#config(DebouncerConfig)}. Recognized keys:
 * <ul>
 *   <li>{@code fsdebounce.timeout-ms} — quiet timeout in milliseconds (default 2000)</li>
 *   <li>{@code fsdebounce.tick-rate-ms} — tick interval in milliseconds; absent means
 *       a quarter of the timeout</li>
 * </ul>
 */
public final class DebouncerConfig {
  public static final String DEFAULT_PREFIX = "fsdebounce.";

  private long timeoutMs = 2000L;
  private Long tickRateMs;

  public static DebouncerConfig fromProperties(Properties properties) {
    return fromProperties(properties, DEFAULT_PREFIX);
  }

  /**
   * Reads settings from {@code properties}, using keys that start with {@code prefix}.
   * Missing keys keep their defaults.
   *
   * @param properties the source
   * @param prefix     key prefix, e.g. {@code "fsdebounce."}
   * @return the populated config
   * @throws DebounceConfigException if a value is not a whole number
   */
  public static DebouncerConfig fromProperties(Properties properties, String prefix) {
    Objects.requireNonNull(properties, "properties");
    Objects.requireNonNull(prefix, "prefix");
    DebouncerConfig config = new DebouncerConfig();
    String timeout = properties.getProperty(prefix + "timeout-ms");
    if (timeout != null) {
      config.setTimeoutMs(parseMillis(prefix + "timeout-ms", timeout));
    }
    String tickRate = properties.getProperty(prefix + "tick-rate-ms");
    if (tickRate != null && !tickRate.isBlank()) {
      config.setTickRateMs(parseMillis(prefix + "tick-rate-ms", tickRate));
    }
    return config;
  }

  private static long parseMillis(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new DebounceConfigException("Invalid value for " + key + ": '" + value + "'", e);
    }
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public DebouncerConfig setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
    return this;
  }

  /**
   * Returns the configured tick interval, or {@code null} to derive it from the timeout.
   *
   * @return the tick interval in milliseconds, or null
   */
  public Long getTickRateMs() {
    return tickRateMs;
  }

  public DebouncerConfig setTickRateMs(Long tickRateMs) {
    this.tickRateMs = tickRateMs;
    return this;
  }
}
