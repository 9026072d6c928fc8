package io.arrconf.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

public final class ConfigFileWatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConfigFileWatcher.class);

    private final Set<Path> files;
    private final long debounceMs;
    private final Consumer<Path> onChange;
    private final WatchService watchService;
    private final Map<WatchKey, Path> directories = new HashMap<>();
    private final Thread thread;
    private volatile boolean running = true;

    private ConfigFileWatcher(Collection<Path> files, long debounceMs, Consumer<Path> onChange) throws IOException {
        this.files = new LinkedHashSet<>();
        files.forEach(f -> this.files.add(f.toAbsolutePath().normalize()));
        this.debounceMs = Math.max(0L, debounceMs);
        this.onChange = onChange;
        this.watchService = FileSystems.getDefault().newWatchService();
        for (Path file : this.files) {
            Path dir = file.getParent();
            if (!directories.containsValue(dir)) {
                WatchKey key = dir.register(
                        watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE
                );
                directories.put(key, dir);
            }
        }
        this.thread = new Thread(this::loop, "arrconf-config-watcher");
        this.thread.setDaemon(true);
    }

    public static ConfigFileWatcher start(Collection<Path> files, long debounceMs, Consumer<Path> onChange) {
        try {
            ConfigFileWatcher watcher = new ConfigFileWatcher(files, debounceMs, onChange);
            watcher.thread.start();
            log.debug("Watching configuration files: {}", watcher.files);
            return watcher;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to watch configuration files", e);
        }
    }

    public Set<Path> files() {
        return files;
    }

    public boolean isRunning() {
        return running && thread.isAlive();
    }

    private void loop() {
        Path changed = null;
        long deadline = 0L;
        try {
            while (running) {
                WatchKey key;
                if (changed == null) {
                    key = watchService.take();
                } else {
                    long remaining = deadline - System.currentTimeMillis();
                    key = remaining > 0 ? watchService.poll(remaining, TimeUnit.MILLISECONDS) : null;
                }
                if (key != null) {
                    Path dir = directories.get(key);
                    for (WatchEvent<?> event : key.pollEvents()) {
                        if (dir == null || !(event.context() instanceof Path)) {
                            continue;
                        }
                        Path file = dir.resolve((Path) event.context()).toAbsolutePath().normalize();
                        if (files.contains(file)) {
                            log.debug("Filesystem event {} for '{}'", event.kind().name(), file);
                            changed = file;
                            deadline = System.currentTimeMillis() + debounceMs;
                        }
                    }
                    key.reset();
                }
                if (changed != null && System.currentTimeMillis() >= deadline) {
                    log.info("Config file '{}' has been modified", changed);
                    Path notify = changed;
                    changed = null;
                    onChange.accept(notify);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Config file watch service closed");
        }
    }

    @Override
    public void close() {
        running = false;
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("Failed to close config file watch service: {}", e.getMessage());
        }
        thread.interrupt();
        try {
            thread.join(5_000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
