// file: server/src/main/java/io/treekv/server/ServerConfig.java
package io.treekv.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - dataDir:       directory holding the WAL and snapshots
 *  - host / port:   HTTP listen address
 *  - configPath:    optional JSON settings file (CSRF key)
 *  - snapshotEvery: commits between full snapshots
 */
public record ServerConfig(
        String dataDir,
        String host,
        int port,
        String configPath,
        int snapshotEvery
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --data-dir, -d   <path>
     *   --port,     -p   <port>
     *   --host           <address>
     *   --config,   -c   <path>
     *   --snapshot-every <commits>
     *   --help,     -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        String dataDir = "./data";
        String host = "0.0.0.0";
        int port = 8080;
        String configPath = null;
        int snapshotEvery = 10_000;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    port = parsePositive(args[++i], "port");
                }

                case "--host" -> {
                    ensureValue(args, i);
                    host = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parsePositive(args[++i], "snapshot-every");
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(dataDir, host, port, configPath, snapshotEvery);
    }

    private static int parsePositive(String raw, String name) {
        int v;
        try {
            v = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            v = -1;
        }
        if (v <= 0) {
            System.err.println("Invalid " + name + ": " + raw);
            System.exit(1);
        }
        return v;
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: treekv-server [options]

            Options:
              --data-dir,       -d   Data directory for WAL and snapshots (default: ./data)
              --port,           -p   HTTP port (default: 8080)
              --host                 Listen address (default: 0.0.0.0)
              --config,         -c   Path to JSON config file (optional)
              --snapshot-every       Commits between snapshots (default: 10000)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
