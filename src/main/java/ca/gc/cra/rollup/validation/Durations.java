package ca.gc.cra.rollup.validation;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses window durations written the way operators write them in YAML and on the command line.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>a bare integer, read as seconds ({@code 90});</li>
 *   <li>unit sequences {@code ns us ms s m h}, optionally fractional ({@code 1m30s}, {@code 1.5h},
 *       {@code 500ms});</li>
 *   <li>ISO-8601 ({@code PT1M}).</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern UNIT_TOKEN = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
  private static final Pattern BARE_SECONDS = Pattern.compile("\\d+");

  private Durations() {
    // Utility
  }

  /**
   * Parses a duration.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw duration text
   * @return parsed duration; zero is allowed and left for the caller to default
   * @throws IllegalArgumentException if the text is blank, negative, or not a recognised form
   */
  public static Duration parse(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    if (BARE_SECONDS.matcher(text).matches()) {
      try {
        return Duration.ofSeconds(Long.parseLong(text));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(name + " is too large (was " + raw + ")", ex);
      }
    }
    if (text.startsWith("p")) {
      try {
        Duration iso = Duration.parse(text.toUpperCase(Locale.ROOT));
        if (iso.isNegative()) {
          throw new IllegalArgumentException(name + " must not be negative (was " + raw + ")");
        }
        return iso;
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException(name + " is not a valid ISO-8601 duration (was " + raw + ")", ex);
      }
    }
    return parseUnits(name, raw, text);
  }

  /**
   * Formats a duration in the unit-sequence form accepted by {@link #parse(String, String)}.
   *
   * @param duration duration to render; must not be negative
   * @return text such as {@code 60s} or {@code 1500ms}
   */
  public static String format(Duration duration) {
    if (duration.getNano() == 0) {
      return duration.getSeconds() + "s";
    }
    if (duration.getNano() % 1_000_000 == 0) {
      return duration.toMillis() + "ms";
    }
    return duration.toNanos() + "ns";
  }

  private static Duration parseUnits(String name, String raw, String text) {
    Matcher matcher = UNIT_TOKEN.matcher(text);
    int position = 0;
    BigDecimal nanos = BigDecimal.ZERO;
    while (position < text.length()) {
      if (!matcher.find(position) || matcher.start() != position) {
        throw new IllegalArgumentException(
            name + " must look like 90s, 1m30s, 500ms or PT1M (was " + raw + ")");
      }
      BigDecimal amount = new BigDecimal(matcher.group(1));
      nanos = nanos.add(amount.multiply(BigDecimal.valueOf(unitNanos(matcher.group(2)))));
      position = matcher.end();
    }
    try {
      return Duration.ofNanos(nanos.longValueExact());
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException(name + " is too large or too precise (was " + raw + ")", ex);
    }
  }

  private static long unitNanos(String unit) {
    return switch (unit) {
      case "ns" -> 1L;
      case "us", "µs" -> 1_000L;
      case "ms" -> 1_000_000L;
      case "s" -> 1_000_000_000L;
      case "m" -> 60_000_000_000L;
      case "h" -> 3_600_000_000_000L;
      default -> throw new IllegalArgumentException("unknown duration unit " + unit);
    };
  }
}
