// file: server/src/test/java/io/treekv/server/config/FileConfigTest.java
package io.treekv.server.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileConfigTest {

    @TempDir
    Path tmp;

    @Test
    void loads_csrf_key_and_ignores_unknown_sections() throws Exception {
        Path cfgPath = tmp.resolve("config.json");
        Files.writeString(cfgPath, """
                {
                  "tls": { "cert": "server.pem" },
                  "csrf": { "key": "0123456789abcdef0123456789abcdef" }
                }
                """);

        FileConfig cfg = FileConfig.fromJsonFile(cfgPath);
        assertEquals(32, cfg.csrfKey().length);
    }

    @Test
    void missing_csrf_section_means_no_key() throws Exception {
        Path cfgPath = tmp.resolve("config.json");
        Files.writeString(cfgPath, "{}");
        assertNull(FileConfig.fromJsonFile(cfgPath).csrfKey());
    }

    @Test
    void wrong_key_length_is_rejected() throws Exception {
        Path cfgPath = tmp.resolve("config.json");
        Files.writeString(cfgPath, "{\"csrf\": {\"key\": \"short\"}}");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> FileConfig.fromJsonFile(cfgPath));
        assertEquals("bad CSRF key: want 32 bytes, got 5", e.getMessage());
    }

    @Test
    void unreadable_file_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> FileConfig.fromJsonFile(tmp.resolve("absent.json")));
    }
}
