package io.arrconf.cli;

import io.arrconf.config.ConfigLoader;
import io.arrconf.config.ConfigurationException;
import io.arrconf.config.EngineSettings;
import io.arrconf.config.LoadedConfig;
import io.arrconf.model.RunStatus;
import io.arrconf.observability.LogLevels;
import io.arrconf.plugin.Plugin;
import io.arrconf.plugin.PluginRegistry;
import io.arrconf.runtime.Daemon;
import io.arrconf.runtime.RunPipeline;
import io.arrconf.runtime.RunReport;
import io.arrconf.runtime.SignalSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "arrconf",
        mixinStandardHelpOptions = true,
        description = "Declarative configuration for *arr application instances",
        subcommands = {
                ArrconfCommand.RunCommand.class,
                ArrconfCommand.DaemonCommand.class,
                ArrconfCommand.TestConfigCommand.class
        }
)
public final class ArrconfCommand implements Runnable {
    static final String DEFAULT_CONFIG = "arrconf.yml";
    private static final Logger log = LoggerFactory.getLogger(ArrconfCommand.class);

    private final PluginRegistry plugins;
    private final ConfigLoader loader = new ConfigLoader();

    @Option(names = {"--log-level"}, description = "Log level: ERROR|WARNING|INFO|DEBUG|TRACE (env ARRCONF_LOG_LEVEL)")
    String logLevel;

    public ArrconfCommand() {
        this(PluginRegistry.builtin());
    }

    public ArrconfCommand(PluginRegistry plugins) {
        this.plugins = plugins;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: run | daemon | test-config");
    }

    void initLogging() {
        LogLevels.apply(LogLevels.resolve(logLevel, System.getenv(LogLevels.ENV)));
        log.info("Loaded plugins:");
        for (Plugin plugin : plugins.all()) {
            log.info(" - {} ({})", plugin.name(), plugin.version());
        }
    }

    RunPipeline pipeline() {
        return new RunPipeline(plugins);
    }

    @Command(name = "run", description = "Update configuration of all instances once, then exit")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ArrconfCommand parent;

        @Parameters(index = "0", arity = "0..1", defaultValue = DEFAULT_CONFIG, description = "Configuration file")
        Path configPath;

        @Option(names = {"-p", "--plugin"}, description = "Only use the given plugin (repeatable)")
        Set<String> usePlugins = new LinkedHashSet<>();

        @Option(names = {"--report-file"}, description = "Write the run report as JSON to this file")
        Path reportFile;

        @Override
        public Integer call() {
            parent.initLogging();
            AtomicBoolean cancelled = new AtomicBoolean(false);
            CountDownLatch finished = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                cancelled.set(true);
                try {
                    finished.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "arrconf-run-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            Instant started = Instant.now();
            RunReport report;
            try {
                LoadedConfig config = parent.loader.load(configPath);
                report = parent.pipeline().run(config, usePlugins, cancelled::get);
            } catch (ConfigurationException e) {
                log.error("Configuration error: {}", e.getMessage());
                report = RunReport.fatal(UUID.randomUUID().toString(), started, e.getMessage());
            } finally {
                finished.countDown();
                removeHook(hook);
            }
            if (reportFile != null) {
                try {
                    report.writeTo(reportFile);
                    log.info("Run report written to '{}'", reportFile.toAbsolutePath());
                } catch (UncheckedIOException e) {
                    log.error("Failed to write run report to '{}': {}", reportFile.toAbsolutePath(), e.getMessage());
                }
            }
            if (report.status() == RunStatus.SUCCESS) {
                log.info("Finished updating instance configuration");
            } else {
                log.error("Run finished with status {}", report.status());
            }
            return report.status().exitCode();
        }
    }

    @Command(name = "daemon", description = "Run as a daemon: update on a schedule and on configuration changes")
    static final class DaemonCommand implements Callable<Integer> {
        @ParentCommand
        ArrconfCommand parent;

        @Parameters(index = "0", arity = "0..1", defaultValue = DEFAULT_CONFIG, description = "Configuration file")
        Path configPath;

        @Option(names = {"-p", "--plugin"}, description = "Only use the given plugin (repeatable)")
        Set<String> usePlugins = new LinkedHashSet<>();

        @Option(names = {"-w", "--watch"}, negatable = true, description = "Re-run when configuration files change")
        Boolean watch;

        @Option(names = {"-d", "--update-day"}, description = "Weekday to run updates on (repeatable)")
        List<String> updateDays = List.of();

        @Option(names = {"-t", "--update-time"}, description = "Time of day (HH:MM) to run updates at (repeatable)")
        List<String> updateTimes = List.of();

        @Override
        public Integer call() throws Exception {
            parent.initLogging();
            Daemon daemon;
            try {
                Set<DayOfWeek> days = new LinkedHashSet<>();
                updateDays.forEach(d -> days.add(EngineSettings.parseDay(d)));
                Set<LocalTime> times = new LinkedHashSet<>();
                updateTimes.forEach(t -> times.add(EngineSettings.parseTime(t)));
                daemon = new Daemon(
                        configPath,
                        parent.loader,
                        parent.pipeline(),
                        usePlugins,
                        new Daemon.Overrides(watch, days, times),
                        Clock.systemDefaultZone()
                );
            } catch (ConfigurationException e) {
                log.error("Configuration error: {}", e.getMessage());
                return RunStatus.FATAL.exitCode();
            }

            SignalSupport.onReload(() -> daemon.trigger(Daemon.Trigger.RELOAD));
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                daemon.stop();
                try {
                    daemon.awaitTermination(Duration.ofSeconds(30));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "arrconf-daemon-shutdown-hook"));

            try {
                daemon.run();
            } catch (ConfigurationException e) {
                log.error("Configuration error: {}", e.getMessage());
                return RunStatus.FATAL.exitCode();
            }
            return 0;
        }
    }

    @Command(name = "test-config", description = "Validate the configuration without contacting any instance")
    static final class TestConfigCommand implements Callable<Integer> {
        @ParentCommand
        ArrconfCommand parent;

        @Parameters(index = "0", arity = "0..1", defaultValue = DEFAULT_CONFIG, description = "Configuration file")
        Path configPath;

        @Option(names = {"-p", "--plugin"}, description = "Only use the given plugin (repeatable)")
        Set<String> usePlugins = new LinkedHashSet<>();

        @Override
        public Integer call() {
            parent.initLogging();
            log.info("Testing configuration file: {}", configPath);
            LoadedConfig config;
            try {
                config = parent.loader.load(configPath);
                log.info("Loading configuration: PASSED");
            } catch (ConfigurationException e) {
                log.error("Loading configuration: FAILED");
                log.error(e.getMessage());
                return RunStatus.FATAL.exitCode();
            }
            RunReport report = parent.pipeline().validate(config, usePlugins);
            if (report.status() == RunStatus.SUCCESS) {
                log.info("Configuration test successful.");
                return 0;
            }
            log.error("Configuration test failed.");
            return RunStatus.FATAL.exitCode();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress, leaving hook registered");
        }
    }
}
