package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(5, Numbers.requireRange("file.backupCount", 5, 0, 20));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("file.backupCount", -1, 0, 20));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("file.backupCount", 21, 0, 20));
  }

  @Test
  void requireNonNegativeAcceptsZero() {
    assertEquals(0.0, Numbers.requireNonNegative("duration", 0.0));
  }

  @Test
  void requireNonNegativeRejectsNegativeAndNonFinite() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("duration", -0.5));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("duration", Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireNonNegative("duration", Double.POSITIVE_INFINITY));
  }

  @Test
  void requirePositiveRejectsZero() {
    assertEquals(60.0, Numbers.requirePositive("performance.intervalSeconds", 60.0));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("performance.intervalSeconds", 0.0));
  }
}
