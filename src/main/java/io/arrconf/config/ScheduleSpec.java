package io.arrconf.config;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

public record ScheduleSpec(List<Slot> slots, boolean watchConfig) {
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public ScheduleSpec {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public static ScheduleSpec of(Collection<DayOfWeek> days, Collection<LocalTime> times, boolean watchConfig) {
        List<Slot> slots = new ArrayList<>();
        for (DayOfWeek day : new TreeSet<>(days)) {
            for (LocalTime time : new TreeSet<>(times)) {
                slots.add(new Slot(day, time.withSecond(0).withNano(0)));
            }
        }
        return new ScheduleSpec(slots, watchConfig);
    }

    // Strictly after now, in now's zone.
    public Optional<ZonedDateTime> nextRunAfter(ZonedDateTime now) {
        return slots.stream()
                .map(slot -> slot.nextAfter(now))
                .min(Comparator.naturalOrder());
    }

    public record Slot(DayOfWeek day, LocalTime time) {
        ZonedDateTime nextAfter(ZonedDateTime now) {
            ZonedDateTime candidate = now
                    .with(TemporalAdjusters.nextOrSame(day))
                    .with(time);
            if (!candidate.isAfter(now)) {
                candidate = candidate.plusWeeks(1).with(time);
            }
            return candidate;
        }

        public String label() {
            return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + time.format(HH_MM);
        }
    }
}
