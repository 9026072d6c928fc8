package io.arrconf.config;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

public final class EngineSettings {
    public static final String SECTION = "arrconf";
    public static final boolean DEFAULT_WATCH_CONFIG = false;
    public static final LocalTime DEFAULT_UPDATE_TIME = LocalTime.of(3, 0);
    public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30L;
    public static final long DEFAULT_WATCH_DEBOUNCE_MS = 2_000L;

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm")
            .withResolverStyle(ResolverStyle.STRICT);

    private final boolean watchConfig;
    private final Set<DayOfWeek> updateDays;
    private final Set<LocalTime> updateTimes;
    private final Duration requestTimeout;
    private final long watchDebounceMs;

    public EngineSettings(
            boolean watchConfig,
            Set<DayOfWeek> updateDays,
            Set<LocalTime> updateTimes,
            Duration requestTimeout,
            long watchDebounceMs
    ) {
        this.watchConfig = watchConfig;
        this.updateDays = updateDays == null || updateDays.isEmpty()
                ? EnumSet.allOf(DayOfWeek.class)
                : EnumSet.copyOf(updateDays);
        this.updateTimes = updateTimes == null || updateTimes.isEmpty()
                ? Set.of(DEFAULT_UPDATE_TIME)
                : new TreeSet<>(updateTimes);
        this.requestTimeout = requestTimeout == null
                ? Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS)
                : requestTimeout;
        this.watchDebounceMs = Math.max(0L, watchDebounceMs);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_WATCH_CONFIG, null, null, null, DEFAULT_WATCH_DEBOUNCE_MS);
    }

    public static EngineSettings fromNode(JsonNode section) {
        if (section == null || section.isMissingNode() || section.isNull()) {
            return defaults();
        }
        if (!section.isObject()) {
            throw new ConfigurationException("'" + SECTION + "' must be a mapping");
        }
        for (var it = section.fieldNames(); it.hasNext(); ) {
            String field = it.next();
            if (!Set.of("watch_config", "update_days", "update_times", "request_timeout", "watch_debounce_ms")
                    .contains(field)) {
                throw new ConfigurationException("Unknown field '" + SECTION + "." + field + "'");
            }
        }
        boolean watch = section.path("watch_config").asBoolean(DEFAULT_WATCH_CONFIG);
        Set<DayOfWeek> days = new LinkedHashSet<>();
        for (JsonNode day : section.path("update_days")) {
            days.add(parseDay(day.asText()));
        }
        Set<LocalTime> times = new LinkedHashSet<>();
        for (JsonNode time : section.path("update_times")) {
            times.add(parseTime(time.asText()));
        }
        long timeoutSeconds = section.path("request_timeout").asLong(DEFAULT_REQUEST_TIMEOUT_SECONDS);
        if (timeoutSeconds <= 0) {
            throw new ConfigurationException("'" + SECTION + ".request_timeout' must be positive");
        }
        long debounce = section.path("watch_debounce_ms").asLong(DEFAULT_WATCH_DEBOUNCE_MS);
        return new EngineSettings(watch, days, times, Duration.ofSeconds(timeoutSeconds), debounce);
    }

    public static DayOfWeek parseDay(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Weekday cannot be empty");
        }
        try {
            return DayOfWeek.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid weekday '" + raw + "'", e);
        }
    }

    public static LocalTime parseTime(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Update time cannot be empty");
        }
        try {
            return LocalTime.parse(raw.trim(), HH_MM);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid 24 hour time '" + raw + "'", e);
        }
    }

    public EngineSettings withOverrides(Boolean watch, Set<DayOfWeek> days, Set<LocalTime> times) {
        return new EngineSettings(
                watch == null ? watchConfig : watch,
                days == null || days.isEmpty() ? updateDays : days,
                times == null || times.isEmpty() ? updateTimes : times,
                requestTimeout,
                watchDebounceMs
        );
    }

    public ScheduleSpec schedule() {
        return ScheduleSpec.of(updateDays, updateTimes, watchConfig);
    }

    public boolean watchConfig() {
        return watchConfig;
    }

    public Set<DayOfWeek> updateDays() {
        return updateDays;
    }

    public Set<LocalTime> updateTimes() {
        return updateTimes;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public long watchDebounceMs() {
        return watchDebounceMs;
    }
}
