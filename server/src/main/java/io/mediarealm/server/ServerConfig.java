package io.mediarealm.server;

/**
 * Process configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:   HTTP façade port
 *  - dataDir:    root directory of all durable state (mirror, realms, cursors)
 *  - configPath: optional JSON file with harvest/sync/search/auth/storage settings
 *  - syncOnce:   drain the harvest source once and exit instead of serving
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String configPath,
        boolean syncOnce
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --config,    -c   <path>
     *   --sync-once
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String dataDir = "./data";
        String configPath = null;
        boolean syncOnce = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--sync-once" -> syncOnce = true;

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataDir, configPath, syncOnce);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: media-realm-server [options]

            Options:
              --http-port, -p   HTTP port (default: 8080)
              --data-dir,  -d   Directory for WAL, snapshots and cursors (default: ./data)
              --config,    -c   Path to JSON runtime config (optional)
              --sync-once       Harvest until the source is drained, then exit
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
