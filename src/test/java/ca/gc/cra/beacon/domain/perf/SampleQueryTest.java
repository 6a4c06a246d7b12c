package ca.gc.cra.beacon.domain.perf;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class SampleQueryTest {
  private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");

  @Test
  void matchesOnOperationAndInclusiveSince() {
    SampleQuery query = SampleQuery.forOperation("a").since(T0);

    assertTrue(query.matches(PerformanceSample.of("a", 1, T0)));
    assertFalse(query.matches(PerformanceSample.of("a", 1, T0.minusMillis(1))));
    assertFalse(query.matches(PerformanceSample.of("b", 1, T0)));
  }

  @Test
  void emptyOperationMatchesEverything() {
    SampleQuery query = new SampleQuery("", null, null);
    assertNull(query.operation());
    assertTrue(query.matches(PerformanceSample.of("anything", 1, T0)));
  }

  @Test
  void negativeLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SampleQuery.all().limit(-1));
    assertNull(SampleQuery.all().limit(3).unlimited().limit());
  }
}
