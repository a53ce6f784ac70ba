package ca.gc.cra.ember.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by EMBER configuration and device records.
 * <p><strong>Why:</strong> Rejects out-of-range thresholds, poll intervals, and pool sizes before a component
 * is constructed, so nothing downstream has to coerce a bad value.
 * <p><strong>Thread-safety:</strong> Stateless utility.
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} on violation.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., seconds, fps)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value (e.g., degrees Celsius, ppm, percent)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException(label(name) + " must be a finite number (was " + value + ")");
    }
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer and range-checks it, falling back to {@code defaultValue} when the raw text is blank.
   *
   * @param name key name used in diagnostics
   * @param raw raw text; may be {@code null}
   * @param defaultValue value returned when {@code raw} is blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException when the text is not an integer or is out of range
   */
  public static int parseInt(String name, String raw, int defaultValue, int min, int max) {
    if (raw == null || raw.isBlank()) {
      requireRange(name, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      requireRange(name, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          label(name) + " must be an integer between " + min + " and " + max, ex);
    }
  }

  /**
   * Parses a finite double and range-checks it, falling back to {@code defaultValue} when blank.
   *
   * @param name key name used in diagnostics
   * @param raw raw text; may be {@code null}
   * @param defaultValue value returned when {@code raw} is blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException when the text is not a number or is out of range
   */
  public static double parseDouble(String name, String raw, double defaultValue, double min, double max) {
    if (raw == null || raw.isBlank()) {
      return requireRange(name, defaultValue, min, max);
    }
    try {
      return requireRange(name, Double.parseDouble(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          label(name) + " must be a number between " + min + " and " + max, ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
