// file: server/src/main/java/io/treekv/server/Main.java
package io.treekv.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.treekv.server.config.FileConfig;
import io.treekv.server.http.Listings;
import io.treekv.server.http.ResourceDispatcher;
import io.treekv.server.store.MetadataStore;
import io.treekv.storage.DurableBucketStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a treekv server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI and the optional JSON file.
 *  - Open the durable bucket store and bootstrap the root and metadata buckets.
 *  - Wire the dispatcher into the HTTP server and start it.
 *  - Close the store on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        byte[] csrfKey = null;
        if (cfg.configPath() != null && !cfg.configPath().isBlank()) {
            try {
                csrfKey = FileConfig.fromJsonFile(Path.of(cfg.configPath())).csrfKey();
            } catch (IllegalArgumentException e) {
                fatal("invalid config", e);
            }
        }

        // ------ Storage Layer -------
        var json = new ObjectMapper();
        var metadata = new MetadataStore(json);
        DurableBucketStore store = null;
        try {
            store = DurableBucketStore.open(Path.of(cfg.dataDir()), cfg.snapshotEvery());
            metadata.bootstrap(store);
        } catch (RuntimeException e) {
            fatal("couldn't open store in " + cfg.dataDir(), e);
        }

        // ------ HTTP layer ------
        var dispatcher = new ResourceDispatcher(store, metadata, new Listings(json), Clock.systemUTC());
        var web = new WebServer(cfg.host(), cfg.port(), dispatcher, csrfKey);
        web.start();

        log.info(String.format("treekv listening on http://%s:%d (data=%s, csrf=%s)",
                cfg.host(), cfg.port(), cfg.dataDir(), csrfKey != null ? "on" : "off"));

        DurableBucketStore openStore = store;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                openStore.close();
            }
        }));
    }

    /** Apply the bundled logging.properties unless the JVM was given its own. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load bundled logging.properties", e);
        }
    }

    private static void fatal(String what, Exception e) {
        log.log(Level.SEVERE, "fatal: " + what + ": " + e.getMessage(), e);
        System.exit(1);
    }
}
