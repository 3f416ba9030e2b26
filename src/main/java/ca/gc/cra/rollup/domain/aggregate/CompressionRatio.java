package ca.gc.cra.rollup.domain.aggregate;

import java.util.Locale;

/**
 * Size reduction achieved by a compression: {@code 1 - compressed / raw}.
 *
 * @since 0.1.0
 */
public final class CompressionRatio {
  private CompressionRatio() {
    // Utility
  }

  /**
   * Computes the ratio. Not clamped: an output larger than its input gives a negative ratio.
   *
   * @param rawLength input size in bytes
   * @param compressedLength output size in bytes
   * @return ratio, or exactly {@code 0} when {@code rawLength} is zero
   */
  public static double of(long rawLength, long compressedLength) {
    if (rawLength == 0) {
      return 0;
    }
    return 1.0 - (double) compressedLength / rawLength;
  }

  /**
   * Renders a ratio as a percentage with two decimals, e.g. {@code 42.50%}.
   *
   * @param ratio value from {@link #of(long, long)}
   * @return percentage text
   */
  public static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.2f%%", ratio * 100);
  }
}
