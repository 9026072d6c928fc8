package io.arrconf.config;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleSpecTest {
    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void slotsAreOrderedByDayThenTime() {
        ScheduleSpec spec = ScheduleSpec.of(
                Set.of(DayOfWeek.FRIDAY, DayOfWeek.MONDAY),
                Set.of(LocalTime.of(18, 0), LocalTime.of(3, 0)),
                false
        );

        List<String> labels = spec.slots().stream().map(ScheduleSpec.Slot::label).toList();

        assertEquals(List.of("Monday 03:00", "Monday 18:00", "Friday 03:00", "Friday 18:00"), labels);
    }

    @Test
    void nextRunIsLaterTheSameDay() {
        ScheduleSpec spec = ScheduleSpec.of(Set.of(DayOfWeek.MONDAY), Set.of(LocalTime.of(3, 0)), false);
        // 2024-01-01 is a Monday
        ZonedDateTime now = ZonedDateTime.of(2024, 1, 1, 2, 0, 0, 0, UTC);

        assertEquals(ZonedDateTime.of(2024, 1, 1, 3, 0, 0, 0, UTC), spec.nextRunAfter(now).orElseThrow());
    }

    @Test
    void slotAtExactlyNowIsNextWeek() {
        ScheduleSpec spec = ScheduleSpec.of(Set.of(DayOfWeek.MONDAY), Set.of(LocalTime.of(3, 0)), false);
        ZonedDateTime now = ZonedDateTime.of(2024, 1, 1, 3, 0, 0, 0, UTC);

        assertEquals(ZonedDateTime.of(2024, 1, 8, 3, 0, 0, 0, UTC), spec.nextRunAfter(now).orElseThrow());
    }

    @Test
    void picksTheEarliestAcrossDays() {
        ScheduleSpec spec = ScheduleSpec.of(
                Set.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY),
                Set.of(LocalTime.of(3, 0)),
                true
        );
        ZonedDateTime now = ZonedDateTime.of(2024, 1, 1, 12, 0, 0, 0, UTC);

        assertEquals(ZonedDateTime.of(2024, 1, 3, 3, 0, 0, 0, UTC), spec.nextRunAfter(now).orElseThrow());
        assertTrue(spec.watchConfig());
    }

    @Test
    void emptyScheduleHasNoNextRun() {
        assertTrue(new ScheduleSpec(null, false).nextRunAfter(ZonedDateTime.now(UTC)).isEmpty());
    }
}
