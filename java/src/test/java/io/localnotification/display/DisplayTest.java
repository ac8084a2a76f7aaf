package io.localnotification.display;

import static org.junit.jupiter.api.Assertions.*;

import io.localnotification.schedule.CalendarField;
import io.localnotification.schedule.CalendarUnit;
import io.localnotification.schedule.Coordinate;
import io.localnotification.trigger.OneShotAfter;
import io.localnotification.trigger.OneShotAt;
import io.localnotification.trigger.RegionTrigger;
import io.localnotification.trigger.RepeatingCalendarPattern;
import io.localnotification.trigger.RepeatingCustomPattern;
import io.localnotification.trigger.RepeatingInterval;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Unit tests for trigger rendering. */
public class DisplayTest {

  @Test
  void testOneShots() {
    assertEquals("after 1800s", Display.render(new OneShotAfter(1800)));
    assertEquals("after 0.01s", Display.render(new OneShotAfter(0.01)));
    assertEquals(
        "at 2026-02-06T12:00:00Z",
        Display.render(new OneShotAt(Instant.parse("2026-02-06T12:00:00Z"))));
  }

  @Test
  void testInterval() {
    assertEquals("every 60s", Display.render(new RepeatingInterval(60)));
    assertEquals("every 90.5s", Display.render(new RepeatingInterval(90.5)));
  }

  @Test
  void testNonFiniteSeconds() {
    assertEquals(
        "every Infinitys", Display.render(new RepeatingInterval(Double.POSITIVE_INFINITY)));
    assertEquals("after NaNs", Display.render(new OneShotAfter(Double.NaN)));
    assertEquals(
        "region 0.0,0.0 r=Infinitym entry once",
        Display.render(
            new RegionTrigger(Coordinate.ORIGIN, Double.POSITIVE_INFINITY, true, false, false)));
  }

  @Test
  void testCalendarPatternInFieldOrder() {
    ZonedDateTime anchor = ZonedDateTime.of(2026, 2, 6, 9, 30, 15, 0, ZoneId.of("UTC"));
    assertEquals(
        "matching hour=9 minute=30 second=15 from 2026-02-06T09:30:15Z",
        Display.render(new RepeatingCalendarPattern(CalendarUnit.fieldsFor("day"), anchor)));
  }

  @Test
  void testCustomPattern() {
    assertEquals(
        "matching weekday=2 hour=9 second=0",
        Display.render(
            new RepeatingCustomPattern(
                Map.of(
                    CalendarField.SECOND, 0L, CalendarField.HOUR, 9L, CalendarField.WEEKDAY, 2L))));
  }

  @Test
  void testRegion() {
    assertEquals(
        "region 52.1,4.3 r=100m entry repeating",
        Display.render(new RegionTrigger(new Coordinate(52.1, 4.3), 100, true, false, true)));
    assertEquals(
        "region 0.0,0.0 r=5m exit once",
        Display.render(new RegionTrigger(Coordinate.ORIGIN, 5, false, true, false)));
  }
}
