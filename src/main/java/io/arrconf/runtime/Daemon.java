package io.arrconf.runtime;

import io.arrconf.config.ConfigLoader;
import io.arrconf.config.ConfigurationException;
import io.arrconf.config.EngineSettings;
import io.arrconf.config.LoadedConfig;
import io.arrconf.config.ScheduleSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

public final class Daemon {
    private static final Logger log = LoggerFactory.getLogger(Daemon.class);
    private static final DateTimeFormatter NEXT_RUN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public enum Trigger {
        INITIAL,
        SCHEDULE,
        CONFIG_CHANGE,
        RELOAD;

        boolean reloadsConfig() {
            return this == CONFIG_CHANGE || this == RELOAD;
        }
    }

    @FunctionalInterface
    interface WatcherStarter {
        ConfigFileWatcher start(Collection<Path> files, long debounceMs, Consumer<Path> onChange);
    }

    public record Overrides(Boolean watchConfig, Set<DayOfWeek> updateDays, Set<LocalTime> updateTimes) {
        public static Overrides none() {
            return new Overrides(null, Set.of(), Set.of());
        }

        EngineSettings applyTo(EngineSettings settings) {
            return settings.withOverrides(watchConfig, updateDays, updateTimes);
        }
    }

    private final Path configPath;
    private final ConfigLoader loader;
    private final RunPipeline pipeline;
    private final Set<String> usePlugins;
    private final Overrides overrides;
    private final Clock clock;
    private final WatcherStarter watcherStarter;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeup = lock.newCondition();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicInteger completedRuns = new AtomicInteger();
    private final AtomicInteger coalescedTriggers = new AtomicInteger();

    private Trigger pending;
    private ZonedDateTime nextDue;
    private volatile boolean stopping;
    private volatile LoadedConfig config;
    private volatile EngineSettings settings;
    private volatile ScheduleSpec schedule;
    private volatile ConfigFileWatcher watcher;
    private volatile RunReport lastReport;

    public Daemon(
            Path configPath,
            ConfigLoader loader,
            RunPipeline pipeline,
            Set<String> usePlugins,
            Overrides overrides,
            Clock clock
    ) {
        this(configPath, loader, pipeline, usePlugins, overrides, clock, ConfigFileWatcher::start);
    }

    Daemon(
            Path configPath,
            ConfigLoader loader,
            RunPipeline pipeline,
            Set<String> usePlugins,
            Overrides overrides,
            Clock clock,
            WatcherStarter watcherStarter
    ) {
        this.configPath = configPath;
        this.loader = loader;
        this.pipeline = pipeline;
        this.usePlugins = usePlugins == null ? Set.of() : Set.copyOf(usePlugins);
        this.overrides = overrides == null ? Overrides.none() : overrides;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
        this.watcherStarter = watcherStarter;
    }

    public void run() {
        try {
            log.info("Daemon initialising");
            LoadedConfig loaded = loader.load(configPath);
            EngineSettings effective = overrides.applyTo(loaded.settings());
            apply(loaded, effective);
            logConfiguration();
            log.info("Finished initialising daemon");

            lastReport = pipeline.run(config, usePlugins, () -> stopping);
            completedRuns.incrementAndGet();
            logNextRun();
            loop();
        } finally {
            closeWatcher();
            log.info("Daemon stopped");
            terminated.countDown();
        }
    }

    private void loop() {
        while (true) {
            Trigger trigger;
            lock.lock();
            try {
                while (pending == null && !stopping) {
                    if (nextDue == null) {
                        wakeup.await();
                        continue;
                    }
                    long waitMs = Duration.between(ZonedDateTime.now(clock), nextDue).toMillis();
                    if (waitMs <= 0) {
                        pending = Trigger.SCHEDULE;
                        break;
                    }
                    wakeup.await(waitMs, TimeUnit.MILLISECONDS);
                }
                if (stopping) {
                    return;
                }
                trigger = pending;
                pending = null;
                ZonedDateTime now = ZonedDateTime.now(clock);
                // The run about to start covers a slot that is already due.
                if (nextDue != null && !nextDue.isAfter(now)) {
                    nextDue = schedule.nextRunAfter(now).orElse(null);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                lock.unlock();
            }
            execute(trigger);
        }
    }

    private void execute(Trigger trigger) {
        log.info("Run triggered by {}", trigger.name().toLowerCase().replace('_', ' '));
        boolean ran = false;
        try {
            if (trigger.reloadsConfig() && !reload()) {
                return;
            }
            ran = true;
            lastReport = pipeline.run(config, usePlugins, () -> stopping);
        } catch (RuntimeException e) {
            log.error("Unexpected error during run: {}", e.getMessage(), e);
        } finally {
            if (ran) {
                completedRuns.incrementAndGet();
            }
            logNextRun();
        }
    }

    private boolean reload() {
        LoadedConfig loaded;
        EngineSettings effective;
        try {
            loaded = loader.load(configPath);
            effective = overrides.applyTo(loaded.settings());
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping the previous schedule: {}", e.getMessage());
            return false;
        }
        apply(loaded, effective);
        logConfiguration();
        return true;
    }

    private void apply(LoadedConfig loaded, EngineSettings effective) {
        this.config = loaded;
        this.settings = effective;
        lock.lock();
        try {
            this.schedule = effective.schedule();
            this.nextDue = schedule.nextRunAfter(ZonedDateTime.now(clock)).orElse(null);
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
        if (!effective.watchConfig()) {
            closeWatcher();
            return;
        }
        ConfigFileWatcher current = watcher;
        Set<Path> files = new LinkedHashSet<>();
        loaded.files().forEach(f -> files.add(f.toAbsolutePath().normalize()));
        if (current != null && current.isRunning() && current.files().equals(files)) {
            return;
        }
        ConfigFileWatcher replacement;
        try {
            replacement = watcherStarter.start(files, effective.watchDebounceMs(), file -> trigger(Trigger.CONFIG_CHANGE));
        } catch (UncheckedIOException e) {
            log.error("Failed to watch configuration files, {}: {}",
                    current == null ? "file watching is disabled" : "still watching the previous file set",
                    e.getMessage());
            return;
        }
        watcher = replacement;
        if (current != null) {
            current.close();
        }
    }

    // A reload wins over a plain scheduled run when both are pending.
    public void trigger(Trigger trigger) {
        lock.lock();
        try {
            if (pending != null) {
                coalescedTriggers.incrementAndGet();
                if (trigger.reloadsConfig() && !pending.reloadsConfig()) {
                    pending = trigger;
                }
            } else {
                pending = trigger;
            }
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void stop() {
        lock.lock();
        try {
            if (!stopping) {
                log.info("Stopping daemon");
            }
            stopping = true;
            wakeup.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Optional<ZonedDateTime> nextRun() {
        lock.lock();
        try {
            return Optional.ofNullable(nextDue);
        } finally {
            lock.unlock();
        }
    }

    private void logConfiguration() {
        log.info("Daemon configuration:");
        log.info(" - Watch configuration files: {}", settings.watchConfig() ? "Yes" : "No");
        if (settings.watchConfig()) {
            log.info(" - Configuration files to watch:");
            for (Path file : config.files()) {
                log.info("   - {}", file);
            }
        }
        log.info(" - Update at:");
        for (ScheduleSpec.Slot slot : schedule.slots()) {
            log.info("   - {}", slot.label());
        }
    }

    private void logNextRun() {
        lock.lock();
        try {
            ZonedDateTime now = ZonedDateTime.now(clock);
            if (nextDue != null && !nextDue.isAfter(now)) {
                log.info("Scheduled run at {} came due during the previous run", nextDue.format(NEXT_RUN));
                if (pending == null) {
                    pending = Trigger.SCHEDULE;
                } else {
                    coalescedTriggers.incrementAndGet();
                }
            }
            nextDue = schedule.nextRunAfter(now).orElse(null);
        } finally {
            lock.unlock();
        }
        nextRun().ifPresent(next -> log.info("The next run will be at {}", next.format(NEXT_RUN)));
        log.info("Daemon ready");
    }

    private void closeWatcher() {
        ConfigFileWatcher current = watcher;
        watcher = null;
        if (current != null) {
            current.close();
        }
    }

    public boolean isWatching() {
        ConfigFileWatcher current = watcher;
        return current != null && current.isRunning();
    }

    public int completedRuns() {
        return completedRuns.get();
    }

    public int coalescedTriggers() {
        return coalescedTriggers.get();
    }

    public Optional<RunReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }
}
