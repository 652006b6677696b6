package io.lslite.server;

/**
 * Process-level options parsed from CLI args.
 *
 * Supports:
 *  - configPath: JSON router configuration (required)
 *  - routerName: overrides the router name from the file
 *  - grpcPort:   overrides the hello (gRPC) port from the file, null if not given
 *  - httpPort:   overrides the admin HTTP port from the file, null if not given
 */
public record ServerConfig(
        String configPath,
        String routerName,
        Integer grpcPort,
        Integer httpPort
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --config,      -c <path>
     *   --router-name, -n <name>
     *   --grpc-port,   -g <port>
     *   --http-port,   -p <port>
     *   --help,        -h
     */
    public static ServerConfig fromArgs(String[] args) {
        String configPath = null;
        String routerName = null;
        Integer grpcPort = null;
        Integer httpPort = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--router-name", "-n" -> {
                    ensureValue(args, i);
                    routerName = args[++i];
                }

                case "--grpc-port", "-g" -> {
                    ensureValue(args, i);
                    grpcPort = parsePort("grpc-port", args[++i]);
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parsePort("http-port", args[++i]);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }

        if (configPath == null || configPath.isBlank()) {
            System.err.println("Missing required option: --config");
            System.exit(1);
        }
        return new ServerConfig(configPath, routerName, grpcPort, httpPort);
    }

    private static int parsePort(String option, String raw) {
        try {
            int port = Integer.parseInt(raw);
            if (port <= 0 || port > 65535) {
                throw new NumberFormatException("out of range");
            }
            return port;
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + option + ": " + raw);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: lslite-server --config <file> [options]

            Options:
              --config,      -c   Path to JSON router config (required)
              --router-name, -n   Router name, overrides the config file
              --grpc-port,   -g   Hello (gRPC) port, overrides the config file
              --http-port,   -p   Admin HTTP port, overrides the config file
              --help,        -h   Show this help message
            """);
        System.exit(0);
    }
}
