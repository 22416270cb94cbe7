package io.avscheduler.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class PidFileTest {

    @Test
    void reportsOwnProcessAsLive() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-pid-");
        try {
            PidFile pidFile = new PidFile(root.resolve("run").resolve("avscheduler.pid"));
            assertTrue(pidFile.read().isEmpty());
            assertTrue(pidFile.liveProcess().isEmpty());

            long self = ProcessHandle.current().pid();
            pidFile.write(self);

            assertEquals(self, pidFile.read().getAsLong());
            assertEquals(self, pidFile.liveProcess().orElseThrow().pid());
            assertTrue(pidFile.delete());
            assertFalse(pidFile.delete());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void garbageContentIsTreatedAsAbsent() throws Exception {
        Path root = Files.createTempDirectory("avscheduler-pid-");
        try {
            Path file = root.resolve("avscheduler.pid");
            Files.writeString(file, "not-a-pid");

            assertTrue(new PidFile(file).read().isEmpty());
            assertTrue(new PidFile(file).liveProcess().isEmpty());
        } finally {
            deleteRecursively(root);
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
