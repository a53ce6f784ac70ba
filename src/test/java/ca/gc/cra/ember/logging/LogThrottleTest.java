package ca.gc.cra.ember.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.ember.support.ManualClock;
import org.junit.jupiter.api.Test;

class LogThrottleTest {

  @Test
  void suppressesWithinIntervalAndReportsCount() {
    ManualClock clock = new ManualClock(0L);
    LogThrottle throttle = new LogThrottle(clock, 60_000L);

    assertEquals(0L, throttle.tryAcquire("pfds-1"));
    clock.advance(30_000L);
    assertEquals(-1L, throttle.tryAcquire("pfds-1"));
    assertEquals(-1L, throttle.tryAcquire("pfds-1"));
    assertEquals(0L, throttle.tryAcquire("pfds-2"), "keys are independent");

    clock.advance(30_000L);
    assertEquals(2L, throttle.tryAcquire("pfds-1"));
  }

  @Test
  void resetLogsNextEventImmediately() {
    ManualClock clock = new ManualClock(0L);
    LogThrottle throttle = new LogThrottle(clock, 60_000L);
    throttle.tryAcquire("pfds-1");
    throttle.tryAcquire("pfds-1");

    throttle.reset("pfds-1");

    assertEquals(0L, throttle.tryAcquire("pfds-1"));
  }

  @Test
  void zeroIntervalLogsEverything() {
    LogThrottle throttle = new LogThrottle(new ManualClock(5L), 0L);

    assertEquals(0L, throttle.tryAcquire("peer"));
    assertEquals(0L, throttle.tryAcquire("peer"));
    assertThrows(IllegalArgumentException.class, () -> new LogThrottle(new ManualClock(0L), -1L));
  }
}
