package io.localnotification.reader;

import static org.junit.jupiter.api.Assertions.*;

import io.localnotification.ErrorKind;
import io.localnotification.TriggerException;
import io.localnotification.schedule.CalendarField;
import io.localnotification.schedule.Coordinate;
import io.localnotification.schedule.EveryFields;
import io.localnotification.schedule.EveryTicks;
import io.localnotification.schedule.EveryUnit;
import io.localnotification.schedule.ScheduleSpec;
import io.localnotification.schedule.TriggerType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Unit tests for reading notification options. */
public class ScheduleSpecReaderTest {

  @Test
  void testReadRelativeDelay() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read("{\"id\": 1, \"trigger\": {\"in\": 30, \"unit\": \"minute\"}}");

    assertEquals(TriggerType.CALENDAR, spec.type());
    assertNull(spec.rawType());
    assertEquals(30.0, spec.inTicks());
    assertEquals("minute", spec.unit());
    assertNull(spec.at());
    assertNull(spec.every());
  }

  @Test
  void testNumericStringsAreParsed() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"in\": \" 45 \"}}");
    assertEquals(45.0, spec.inTicks());
  }

  @Test
  void testNonNumericValuesBecomeZero() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read("{\"trigger\": {\"in\": \"soon\", \"radius\": [1]}}");
    assertEquals(0.0, spec.inTicks());
    assertEquals(0.0, spec.radius());
  }

  @Test
  void testNonFiniteNumbersBecomeZero() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read(
            "{\"trigger\": {\"in\": \"-Infinity\", \"radius\": 1e400, \"every\": \"NaN\","
                + " \"center\": [\"Infinity\", 4]}}");
    assertEquals(0.0, spec.inTicks());
    assertEquals(0.0, spec.radius());
    assertEquals(new Coordinate(0, 4), spec.center());
    // A string every is a unit name, even when it spells a number
    assertEquals(new EveryUnit("NaN"), spec.every());
  }

  @Test
  void testNonFiniteEveryDoesNotRepeat() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"every\": 1e400}}");
    assertEquals(new EveryTicks(0), spec.every());
    assertFalse(spec.isRepeating());
  }

  @Test
  void testAtFromEpochMillis() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"at\": 1770393600000}}");
    assertEquals(Instant.parse("2026-02-06T16:00:00Z"), spec.at());
  }

  @Test
  void testAtFromIsoString() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read("{\"trigger\": {\"at\": \"2026-02-06T16:00:00Z\"}}");
    assertEquals(Instant.parse("2026-02-06T16:00:00Z"), spec.at());
  }

  @Test
  void testNullAtIsAbsent() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"at\": null}}");
    assertNull(spec.at());
  }

  @Test
  void testEveryUnitName() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"every\": \"week\"}}");
    assertEquals(new EveryUnit("week"), spec.every());
    assertTrue(spec.isRepeating());
  }

  @Test
  void testEmptyEveryStringIsAbsent() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"every\": \"\"}}");
    assertNull(spec.every());
    assertFalse(spec.isRepeating());
  }

  @Test
  void testEveryTicks() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read("{\"trigger\": {\"every\": 15, \"unit\": \"minutes\"}}");
    assertEquals(new EveryTicks(15), spec.every());
  }

  @Test
  void testEveryFieldsIgnoresUnknownKeys() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read(
            "{\"trigger\": {\"every\": {\"weekday\": 1, \"hour\": \"9\", \"era\": 2}}}");
    assertEquals(
        new EveryFields(Map.of(CalendarField.WEEKDAY, 1L, CalendarField.HOUR, 9L)), spec.every());
  }

  @Test
  void testEveryFieldKeys() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read(
            "{\"trigger\": {\"every\": {\"weekdayOrdinal\": 2, \"weekOfMonth\": 3, \"week\": 10,"
                + " \"quarter\": 4, \"year\": 2027, \"month\": 11, \"day\": 5, \"minute\": 7}}}");
    EveryFields every = assertInstanceOf(EveryFields.class, spec.every());
    assertEquals(8, every.fields().size());
    assertEquals(2L, every.fields().get(CalendarField.WEEKDAY_ORDINAL));
    assertEquals(3L, every.fields().get(CalendarField.WEEK_OF_MONTH));
    assertEquals(10L, every.fields().get(CalendarField.WEEK));
  }

  @Test
  void testLocation() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read(
            "{\"trigger\": {\"type\": \"location\", \"center\": [52.1, 4.3], \"radius\": 100,"
                + " \"single\": true, \"notifyOnEntry\": true}}");

    assertEquals(TriggerType.LOCATION, spec.type());
    assertEquals(new Coordinate(52.1, 4.3), spec.center());
    assertEquals(100.0, spec.radius());
    assertTrue(spec.single());
    assertTrue(spec.notifyOnEntry());
    assertFalse(spec.notifyOnExit());
  }

  @Test
  void testLooseBooleans() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read(
            "{\"trigger\": {\"single\": \"true\", \"notifyOnEntry\": 1, \"notifyOnExit\": \"no\"}}");
    assertTrue(spec.single());
    assertTrue(spec.notifyOnEntry());
    assertFalse(spec.notifyOnExit());
  }

  @Test
  void testTypeFromTopLevel() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read("{\"type\": \"location\", \"trigger\": {\"center\": [1, 2]}}");
    assertEquals(TriggerType.LOCATION, spec.type());
    assertEquals(new Coordinate(1, 2), spec.center());
  }

  @Test
  void testMissingCenterIsOrigin() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"trigger\": {\"type\": \"location\"}}");
    assertEquals(Coordinate.ORIGIN, spec.center());
  }

  @Test
  void testBareTriggerObject() throws TriggerException {
    ScheduleSpec spec = ScheduleSpecReader.read("{\"every\": \"day\", \"type\": \"calendar\"}");
    assertEquals(new EveryUnit("day"), spec.every());
    assertEquals("calendar", spec.rawType());
  }

  @Test
  void testReadFromMap() throws TriggerException {
    ScheduleSpec spec =
        ScheduleSpecReader.read(
            Map.of("trigger", Map.of("every", Map.of("hour", 9), "center", List.of(3, 4))));
    assertEquals(new EveryFields(Map.of(CalendarField.HOUR, 9L)), spec.every());
    assertEquals(new Coordinate(3, 4), spec.center());
  }

  @Test
  void testInvalidJson() {
    TriggerException e =
        assertThrows(TriggerException.class, () -> ScheduleSpecReader.read("{\"trigger\": "));
    assertEquals(ErrorKind.SYNTAX, e.kind());
    assertTrue(e.input().isPresent());
  }

  @Test
  void testNonObjectRoot() {
    TriggerException e =
        assertThrows(TriggerException.class, () -> ScheduleSpecReader.read("[1, 2]"));
    assertEquals(ErrorKind.SHAPE, e.kind());
  }

  @Test
  void testEmptyInput() {
    TriggerException e = assertThrows(TriggerException.class, () -> ScheduleSpecReader.read(""));
    assertEquals(ErrorKind.SHAPE, e.kind());
  }
}
