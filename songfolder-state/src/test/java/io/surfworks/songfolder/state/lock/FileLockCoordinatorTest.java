package io.surfworks.songfolder.state.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FileLockCoordinator}.
 */
class FileLockCoordinatorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("first coordinator becomes writer, second becomes reader")
    void acquire_secondIsReader() {
        try (FileLockCoordinator first = FileLockCoordinator.inDirectory(tempDir);
             FileLockCoordinator second = FileLockCoordinator.inDirectory(tempDir)) {

            LockAcquisition a = first.acquire();
            LockAcquisition b = second.acquire();

            assertEquals(InstanceRole.WRITER, a.role());
            assertEquals(InstanceRole.READER, b.role());
            assertFalse(b.degraded());
            assertTrue(first.isHeld());
            assertFalse(second.isHeld());
        }
    }

    @Test
    @DisplayName("a reader closing does not release the writer's lock")
    void readerClose_writerKeepsLock() {
        try (FileLockCoordinator writer = FileLockCoordinator.inDirectory(tempDir)) {
            writer.acquire();
            FileLockCoordinator reader = FileLockCoordinator.inDirectory(tempDir);
            reader.acquire();
            reader.close();

            assertTrue(writer.isHeld());
            try (FileLockCoordinator third = FileLockCoordinator.inDirectory(tempDir)) {
                assertEquals(InstanceRole.READER, third.acquire().role());
            }
        }
    }

    @Test
    @DisplayName("the role is decided once")
    void acquire_memoized() {
        try (FileLockCoordinator coordinator = FileLockCoordinator.inDirectory(tempDir)) {
            assertSame(coordinator.acquire(), coordinator.acquire());
        }
    }

    @Test
    @DisplayName("closing the writer lets a new instance become writer")
    void close_releases() {
        FileLockCoordinator first = FileLockCoordinator.inDirectory(tempDir);
        first.acquire();
        first.close();

        try (FileLockCoordinator next = FileLockCoordinator.inDirectory(tempDir)) {
            assertTrue(next.acquire().isWriter());
        }
    }

    @Test
    @DisplayName("locking failure degrades to reader")
    void acquire_lockingUnavailable_degraded() throws IOException {
        Path notADirectory = Files.writeString(tempDir.resolve("plain-file"), "x");

        try (FileLockCoordinator coordinator = new FileLockCoordinator(notADirectory.resolve("state.lock"))) {
            LockAcquisition acquisition = coordinator.acquire();

            assertEquals(InstanceRole.READER, acquisition.role());
            assertTrue(acquisition.degraded());
            assertFalse(acquisition.role().canSave());
        }
    }

    @Test
    @DisplayName("simultaneous starts produce exactly one writer")
    void acquire_concurrent_oneWriter() throws Exception {
        int instances = 8;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(instances);
        List<FileLockCoordinator> coordinators = new ArrayList<>();
        try {
            List<Future<LockAcquisition>> results = new ArrayList<>();
            for (int i = 0; i < instances; i++) {
                FileLockCoordinator coordinator = FileLockCoordinator.inDirectory(tempDir);
                coordinators.add(coordinator);
                results.add(pool.submit(() -> {
                    go.await();
                    return coordinator.acquire();
                }));
            }
            go.countDown();

            int writers = 0;
            for (Future<LockAcquisition> result : results) {
                if (result.get(10, TimeUnit.SECONDS).isWriter()) {
                    writers++;
                }
            }
            assertEquals(1, writers);
        } finally {
            pool.shutdownNow();
            coordinators.forEach(FileLockCoordinator::close);
        }
    }

    @Test
    @Timeout(60)
    @DisplayName("a lock held by another process makes this one a reader until it exits")
    void acquire_otherProcess() throws Exception {
        Path lockFile = tempDir.resolve(FileLockCoordinator.LOCK_FILE);
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        Process child = new ProcessBuilder(java, "-cp", System.getProperty("java.class.path"),
            LockHolderProcess.class.getName(), lockFile.toString())
            .redirectErrorStream(true)
            .start();
        try {
            BufferedReader out = new BufferedReader(
                new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8));
            assertEquals("WRITER", out.readLine());

            try (FileLockCoordinator coordinator = new FileLockCoordinator(lockFile)) {
                assertEquals(InstanceRole.READER, coordinator.acquire().role());
            }

            try (Writer in = new OutputStreamWriter(child.getOutputStream(), StandardCharsets.UTF_8)) {
                in.write("release\n");
            }
            assertTrue(child.waitFor(30, TimeUnit.SECONDS));

            try (FileLockCoordinator coordinator = new FileLockCoordinator(lockFile)) {
                assertTrue(coordinator.acquire().isWriter());
            }
        } finally {
            child.destroyForcibly();
        }
    }
}
