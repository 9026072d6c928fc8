package io.arrconf.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigFileWatcherTest {
    private Path root;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("arrconf-watch-test-");
    }

    @AfterEach
    void tearDown() throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    @Test
    void burstOfWritesIsReportedOnce() throws Exception {
        Path config = Files.writeString(root.resolve("arrconf.yml"), "dummy: {}\n");
        Path unrelated = Files.writeString(root.resolve("notes.txt"), "x\n");
        List<Path> changes = new CopyOnWriteArrayList<>();
        CountDownLatch notified = new CountDownLatch(1);

        try (ConfigFileWatcher watcher = ConfigFileWatcher.start(List.of(config), 300L, path -> {
            changes.add(path);
            notified.countDown();
        })) {
            assertTrue(watcher.isRunning());
            Files.writeString(unrelated, "y\n");
            Files.writeString(config, "dummy:\n  port: 1\n");
            Files.writeString(config, "dummy:\n  port: 2\n");
            Files.writeString(config, "dummy:\n  port: 3\n");

            assertTrue(notified.await(10, TimeUnit.SECONDS));
            Thread.sleep(800L);

            assertEquals(List.of(config.toAbsolutePath().normalize()), changes);
        }
    }

    @Test
    void closeStopsTheWatcherThread() throws Exception {
        Path config = Files.writeString(root.resolve("arrconf.yml"), "dummy: {}\n");
        ConfigFileWatcher watcher = ConfigFileWatcher.start(List.of(config), 0L, path -> { });

        watcher.close();

        assertFalse(watcher.isRunning());
        assertEquals(1, watcher.files().size());
    }
}
