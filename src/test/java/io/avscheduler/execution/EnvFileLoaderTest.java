package io.avscheduler.execution;

import io.avscheduler.exception.InvalidEnvFileException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class EnvFileLoaderTest {

    @Test
    void parsesAssignmentsCommentsAndQuotes() throws Exception {
        Path dir = Files.createTempDirectory("avscheduler-env-");
        Path file = dir.resolve("job.env");
        Files.writeString(file, String.join("\n",
                "# credentials",
                "",
                "API_KEY=abc123",
                "export REGION = eu-west-1 ",
                "GREETING=\"hello world\"",
                "SINGLE='quoted'",
                "URL=postgres://u:p@h/db?x=1",
                "EMPTY="
        ), StandardCharsets.UTF_8);

        Map<String, String> env = EnvFileLoader.load(file);

        assertEquals(6, env.size());
        assertEquals("abc123", env.get("API_KEY"));
        assertEquals("eu-west-1", env.get("REGION"));
        assertEquals("hello world", env.get("GREETING"));
        assertEquals("quoted", env.get("SINGLE"));
        assertEquals("postgres://u:p@h/db?x=1", env.get("URL"));
        assertEquals("", env.get("EMPTY"));
    }

    @Test
    void lineWithoutEqualsNamesFileAndLine() throws Exception {
        Path dir = Files.createTempDirectory("avscheduler-env-bad-");
        Path file = dir.resolve("bad.env");
        Files.writeString(file, "A=1\nnot an assignment\n", StandardCharsets.UTF_8);

        InvalidEnvFileException e = assertThrows(InvalidEnvFileException.class, () -> EnvFileLoader.load(file));
        assertTrue(e.getMessage().contains("line 2"));
        assertTrue(e.getMessage().contains("bad.env"));
    }

    @Test
    void emptyKeyIsRejected() throws Exception {
        Path dir = Files.createTempDirectory("avscheduler-env-key-");
        Path file = dir.resolve("key.env");
        Files.writeString(file, "=value\n", StandardCharsets.UTF_8);

        assertThrows(InvalidEnvFileException.class, () -> EnvFileLoader.load(file));
    }
}
