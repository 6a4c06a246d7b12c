package ca.gc.cra.beacon.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by Beacon configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid rotation sizes, backup counts, and thresholds before handlers
 * allocate files.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
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
   * @param value candidate value expressed in the caller's units (e.g., bytes, files)
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
   * Validates that a floating point value is finite and not negative.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value (e.g., milliseconds, seconds)
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, or negative
   */
  public static double requireNonNegative(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value < 0d) {
      throw new IllegalArgumentException(label(name) + " must be a finite number >= 0 (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and strictly positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, zero, or negative
   */
  public static double requirePositive(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0d) {
      throw new IllegalArgumentException(label(name) + " must be a finite number > 0 (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
