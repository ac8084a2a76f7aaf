package io.localnotification.schedule;

import static io.localnotification.schedule.CalendarField.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import org.junit.jupiter.api.Test;

/** The fields each repeat unit pins to its anchor. */
public class CalendarUnitTest {

  @Test
  void testMinute() {
    assertEquals(Set.of(SECOND), CalendarUnit.fieldsFor("minute"));
  }

  @Test
  void testHour() {
    assertEquals(Set.of(MINUTE, SECOND), CalendarUnit.fieldsFor("hour"));
  }

  @Test
  void testDay() {
    assertEquals(Set.of(HOUR, MINUTE, SECOND), CalendarUnit.fieldsFor("day"));
  }

  @Test
  void testWeek() {
    assertEquals(Set.of(WEEKDAY, HOUR, MINUTE, SECOND), CalendarUnit.fieldsFor("week"));
  }

  @Test
  void testMonth() {
    assertEquals(Set.of(DAY, HOUR, MINUTE, SECOND), CalendarUnit.fieldsFor("month"));
  }

  @Test
  void testYear() {
    assertEquals(Set.of(MONTH, DAY, HOUR, MINUTE, SECOND), CalendarUnit.fieldsFor("year"));
  }

  @Test
  void testUnrecognizedPinsEverything() {
    Set<CalendarField> exact = Set.of(YEAR, MONTH, DAY, HOUR, MINUTE, SECOND);
    assertEquals(exact, CalendarUnit.fieldsFor("fortnight"));
    assertEquals(exact, CalendarUnit.fieldsFor("quarter"));
    assertEquals(exact, CalendarUnit.fieldsFor("30"));
  }

  @Test
  void testNamesAreCaseSensitive() {
    Set<CalendarField> exact = Set.of(YEAR, MONTH, DAY, HOUR, MINUTE, SECOND);
    assertEquals(exact, CalendarUnit.fieldsFor("Day"));
    assertEquals(exact, CalendarUnit.fieldsFor(" day "));
    assertTrue(CalendarUnit.parse("WEEK").isEmpty());
  }

  @Test
  void testFieldsAreUnmodifiable() {
    assertThrows(
        UnsupportedOperationException.class, () -> CalendarUnit.fieldsFor("day").add(YEAR));
  }
}
