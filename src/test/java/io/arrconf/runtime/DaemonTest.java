package io.arrconf.runtime;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.arrconf.config.ConfigLoader;
import io.arrconf.config.ConfigurationException;
import io.arrconf.model.RunStatus;
import io.arrconf.plugin.PluginRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonTest {
    // Monday
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T02:00:00Z"), ZoneOffset.UTC);

    private Path root;
    private Path configFile;
    private FakePlugin sonarr;
    private Daemon daemon;
    private Thread loop;
    private final AtomicReference<Throwable> loopError = new AtomicReference<>();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger daemonLogger = (Logger) LoggerFactory.getLogger(Daemon.class);

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("arrconf-daemon-test-");
        configFile = root.resolve("arrconf.yml");
        sonarr = new FakePlugin("sonarr");
        appender.start();
        daemonLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() throws Exception {
        daemonLogger.detachAppender(appender);
        if (daemon != null) {
            daemon.stop();
            daemon.awaitTermination(Duration.ofSeconds(10));
        }
        if (loop != null) {
            loop.join(10_000L);
        }
        deleteRecursively(root);
    }

    private void write(String... lines) throws IOException {
        Files.writeString(configFile, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
    }

    private void start(Daemon.Overrides overrides) {
        start(overrides, CLOCK, ConfigFileWatcher::start);
    }

    private void start(Daemon.Overrides overrides, Clock clock, Daemon.WatcherStarter watcherStarter) {
        daemon = new Daemon(
                configFile,
                new ConfigLoader(),
                new RunPipeline(new PluginRegistry().register(sonarr)),
                Set.of(),
                overrides,
                clock,
                watcherStarter
        );
        loop = new Thread(() -> {
            try {
                daemon.run();
            } catch (Throwable t) {
                loopError.set(t);
            }
        }, "daemon-test-loop");
        loop.start();
    }

    private List<String> messages() {
        // ListAppender appends while holding its own monitor.
        synchronized (appender) {
            return appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        }
    }

    @Test
    void initialRunHappensImmediatelyAndNextRunIsLogged() throws Exception {
        write(
                "arrconf:",
                "  update_days: [monday]",
                "  update_times: ['03:00']",
                "sonarr:",
                "  general:",
                "    host:",
                "      port: 9000"
        );

        start(Daemon.Overrides.none());
        waitUntil(() -> daemon.completedRuns() >= 1);

        assertEquals(9000, sonarr.remoteGeneral("default").path("port").asInt());
        assertEquals(ZonedDateTime.of(2024, 1, 1, 3, 0, 0, 0, ZoneOffset.UTC), daemon.nextRun().orElseThrow());
        waitUntil(() -> messages().contains("Daemon ready"));
        assertTrue(messages().contains("The next run will be at 2024-01-01 03:00"), messages().toString());
        assertTrue(messages().contains("   - Monday 03:00"), messages().toString());
    }

    @Test
    void commandLineOverridesWinOverTheFile() throws Exception {
        write(
                "arrconf:",
                "  update_days: [monday]",
                "  update_times: ['03:00']",
                "sonarr: {}"
        );

        start(new Daemon.Overrides(false, Set.of(DayOfWeek.TUESDAY), Set.of(LocalTime.of(1, 30))));
        waitUntil(() -> daemon.completedRuns() >= 1);

        assertEquals(ZonedDateTime.of(2024, 1, 2, 1, 30, 0, 0, ZoneOffset.UTC), daemon.nextRun().orElseThrow());
    }

    @Test
    void triggersDuringARunCollapseIntoOneFollowUp() throws Exception {
        write("sonarr: {}");
        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        sonarr.fetchGate = gate;
        sonarr.fetchEntered = entered;

        start(Daemon.Overrides.none());
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        for (int i = 0; i < 5; i++) {
            daemon.trigger(Daemon.Trigger.SCHEDULE);
        }
        gate.countDown();

        waitUntil(() -> daemon.completedRuns() >= 2);
        Thread.sleep(300L);

        assertEquals(2, daemon.completedRuns());
        assertEquals(4, daemon.coalescedTriggers());
    }

    @Test
    void failedScheduledRunKeepsDaemonAndWatcherAlive() throws Exception {
        write(
                "arrconf:",
                "  watch_config: true",
                "  watch_debounce_ms: 50",
                "  update_days: [monday]",
                "  update_times: ['03:00']",
                "sonarr:",
                "  general:",
                "    host:",
                "      port: 9000"
        );

        start(Daemon.Overrides.none());
        waitUntil(() -> daemon.completedRuns() >= 1);
        assertTrue(daemon.isWatching());

        sonarr.failFetch.add("default");
        daemon.trigger(Daemon.Trigger.SCHEDULE);
        waitUntil(() -> daemon.completedRuns() >= 2);

        assertEquals(RunStatus.PARTIAL_FAILURE, daemon.lastReport().orElseThrow().status());
        assertTrue(loop.isAlive());
        assertTrue(daemon.isWatching());
        assertEquals(2L, messages().stream().filter("The next run will be at 2024-01-01 03:00"::equals).count());

        sonarr.failFetch.clear();
        write(
                "arrconf:",
                "  watch_config: true",
                "  watch_debounce_ms: 50",
                "  update_days: [monday]",
                "  update_times: ['03:00']",
                "sonarr:",
                "  general:",
                "    host:",
                "      port: 9100"
        );
        waitUntil(() -> daemon.completedRuns() >= 3);
        waitUntil(() -> sonarr.remoteGeneral("default").path("port").asInt() == 9100);
        assertEquals(RunStatus.SUCCESS, daemon.lastReport().orElseThrow().status());
    }

    @Test
    void invalidReloadKeepsThePreviousSchedule() throws Exception {
        write(
                "arrconf:",
                "  update_days: [friday]",
                "  update_times: ['04:15']",
                "sonarr: {}"
        );
        start(Daemon.Overrides.none());
        waitUntil(() -> daemon.completedRuns() >= 1);
        ZonedDateTime before = daemon.nextRun().orElseThrow();

        write(
                "arrconf:",
                "  update_times: ['25:99']",
                "sonarr: {}"
        );
        daemon.trigger(Daemon.Trigger.RELOAD);
        waitUntil(() -> messages().stream().anyMatch(m -> m.startsWith("Failed to reload configuration")));
        waitUntil(() -> messages().stream().filter("Daemon ready"::equals).count() >= 2);

        assertEquals(before, daemon.nextRun().orElseThrow());
        assertEquals(1, daemon.completedRuns());
        assertTrue(loop.isAlive());
    }

    @Test
    void unexpectedRunErrorDoesNotStopTheDaemon() throws Exception {
        write("sonarr: {}");
        start(Daemon.Overrides.none());
        waitUntil(() -> daemon.completedRuns() >= 1);

        write("lidarr: {}");
        daemon.trigger(Daemon.Trigger.RELOAD);
        waitUntil(() -> daemon.completedRuns() >= 2);
        assertTrue(loop.isAlive());

        write("sonarr: {}");
        daemon.trigger(Daemon.Trigger.RELOAD);
        waitUntil(() -> daemon.completedRuns() >= 3);
        assertEquals(RunStatus.SUCCESS, daemon.lastReport().orElseThrow().status());
    }

    @Test
    void configurationErrorAtStartupIsThrown() throws Exception {
        write("lidarr: {}");

        start(Daemon.Overrides.none());
        assertTrue(daemon.awaitTermination(Duration.ofSeconds(10)));
        loop.join(10_000L);

        assertTrue(loopError.get() instanceof ConfigurationException);
        assertEquals(0, daemon.completedRuns());
        assertTrue(sonarr.events.isEmpty());
    }

    @Test
    void stopEndsTheLoopAndReleasesTheWatcher() throws Exception {
        write(
                "arrconf:",
                "  watch_config: true",
                "sonarr: {}"
        );
        start(Daemon.Overrides.none());
        waitUntil(() -> daemon.completedRuns() >= 1);
        assertTrue(daemon.isWatching());

        daemon.stop();

        assertTrue(daemon.awaitTermination(Duration.ofSeconds(10)));
        assertFalse(daemon.isWatching());
        loop.join(10_000L);
        assertFalse(loop.isAlive());
    }

    @Test
    void slotThatComesDueDuringARunIsRunAfterwards() throws Exception {
        write(
                "arrconf:",
                "  update_days: [monday]",
                "  update_times: ['03:00']",
                "sonarr: {}"
        );
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T02:00:00Z"));
        start(Daemon.Overrides.none(), clock, ConfigFileWatcher::start);
        waitUntil(() -> daemon.completedRuns() >= 1);
        waitUntil(() -> messages().contains("Daemon ready"));

        CountDownLatch gate = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        sonarr.fetchGate = gate;
        sonarr.fetchEntered = entered;
        daemon.trigger(Daemon.Trigger.RELOAD);
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        clock.set(Instant.parse("2024-01-01T03:00:30Z"));
        gate.countDown();

        waitUntil(() -> daemon.completedRuns() >= 3);
        Thread.sleep(300L);

        assertEquals(3, daemon.completedRuns());
        assertEquals(ZonedDateTime.of(2024, 1, 8, 3, 0, 0, 0, ZoneOffset.UTC), daemon.nextRun().orElseThrow());
        assertTrue(messages().contains("Scheduled run at 2024-01-01 03:00 came due during the previous run"),
                messages().toString());
    }

    @Test
    void failedWatcherRestartKeepsWatchingThePreviousFiles() throws Exception {
        write(
                "arrconf:",
                "  watch_config: true",
                "sonarr: {}"
        );
        Files.writeString(root.resolve("extra.yml"), "sonarr: {}\n", StandardCharsets.UTF_8);
        AtomicInteger starts = new AtomicInteger();
        Daemon.WatcherStarter failingAfterFirst = (files, debounceMs, onChange) -> {
            if (starts.incrementAndGet() > 1) {
                throw new UncheckedIOException(new IOException("inotify watch limit reached"));
            }
            return ConfigFileWatcher.start(files, debounceMs, onChange);
        };
        start(Daemon.Overrides.none(), CLOCK, failingAfterFirst);
        waitUntil(() -> daemon.completedRuns() >= 1);
        assertTrue(daemon.isWatching());

        write(
                "includes: [extra.yml]",
                "arrconf:",
                "  watch_config: true",
                "sonarr: {}"
        );
        daemon.trigger(Daemon.Trigger.RELOAD);
        waitUntil(() -> daemon.completedRuns() >= 2);

        assertTrue(starts.get() >= 2);
        assertTrue(daemon.isWatching());
        assertTrue(messages().contains(
                "Failed to watch configuration files, still watching the previous file set: "
                        + "java.io.IOException: inotify watch limit reached"), messages().toString());
        assertTrue(loop.isAlive());
    }

    private static final class MutableClock extends Clock {
        private volatile Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 10s");
            }
            Thread.sleep(20L);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
