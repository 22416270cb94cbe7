package io.avscheduler.execution;

import io.avscheduler.exception.InvalidEnvFileException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code KEY=VALUE} environment files. Blank lines and {@code #} comments are
 * skipped, an {@code export } prefix is tolerated, and matching surrounding quotes are
 * removed from values.
 */
public final class EnvFileLoader {
    private static final String EXPORT_PREFIX = "export ";

    private EnvFileLoader() {
    }

    public static Map<String, String> load(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidEnvFileException("Failed to read environment file '" + file + "': " + e.getMessage(), e);
        }
        Map<String, String> out = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw : lines) {
            lineNo++;
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith(EXPORT_PREFIX)) {
                line = line.substring(EXPORT_PREFIX.length()).strip();
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                throw new InvalidEnvFileException("Malformed line " + lineNo + " in environment file '" + file + "': missing '='");
            }
            String key = line.substring(0, eq).strip();
            if (key.isEmpty()) {
                throw new InvalidEnvFileException("Malformed line " + lineNo + " in environment file '" + file + "': empty key");
            }
            out.put(key, unquote(line.substring(eq + 1).strip()));
        }
        return out;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
