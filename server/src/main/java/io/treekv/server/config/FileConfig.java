// file: server/src/main/java/io/treekv/server/config/FileConfig.java
package io.treekv.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Optional JSON settings file, e.g.
 * <pre>
 * { "csrf": { "key": "0123456789abcdef0123456789abcdef" } }
 * </pre>
 * Unknown sections are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FileConfig {
    public static final int CSRF_KEY_BYTES = 32;

    public Csrf csrf = new Csrf();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Csrf {
        public String key;
    }

    /** Load and validate a config file. */
    public static FileConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        FileConfig cfg;
        try {
            cfg = mapper.readValue(path.toFile(), FileConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("couldn't read config file " + path + ": " + e.getMessage(), e);
        }
        if (cfg.csrf == null) {
            cfg.csrf = new Csrf();
        }
        cfg.validate();
        return cfg;
    }

    /** A CSRF key is optional, but when present it must be exactly 32 bytes. */
    public void validate() {
        byte[] key = csrfKey();
        if (key != null && key.length != CSRF_KEY_BYTES) {
            throw new IllegalArgumentException(
                    "bad CSRF key: want " + CSRF_KEY_BYTES + " bytes, got " + key.length);
        }
    }

    /** Configured CSRF key bytes, or null when CSRF protection is off. */
    public byte[] csrfKey() {
        if (csrf == null || csrf.key == null || csrf.key.isEmpty()) {
            return null;
        }
        return csrf.key.getBytes(StandardCharsets.UTF_8);
    }
}
