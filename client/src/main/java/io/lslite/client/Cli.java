package io.lslite.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;

/**
 * Simple CLI for inspecting a running router over its admin HTTP surface.
 *
 * Usage:
 *   lslite-cli [--base-url http://host:port] health
 *   lslite-cli [--base-url http://host:port] neighbors
 *   lslite-cli [--base-url http://host:port] neighbor <name>
 *   lslite-cli [--base-url http://host:port] cost <name> [base]
 *   lslite-cli [--base-url http://host:port] stats
 *
 * Examples:
 *   lslite-cli neighbors
 *   lslite-cli cost /site/router-b 25
 *
 * Responses are printed as returned (JSON).
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        this.baseUrl = trimSlash(baseUrl);
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            Cli cli = new Cli(parsed.getKey());
            cli.run(requestPath(rest));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /**
     * Map a command and its arguments to the admin path to GET.
     */
    static String requestPath(String[] command) {
        String cmd = command[0];
        String[] args = Arrays.copyOfRange(command, 1, command.length);
        return switch (cmd) {
            case "health" -> {
                expectArgs(cmd, args, 0, 0, "");
                yield "/admin/health";
            }
            case "neighbors" -> {
                expectArgs(cmd, args, 0, 0, "");
                yield "/neighbors";
            }
            case "stats" -> {
                expectArgs(cmd, args, 0, 0, "");
                yield "/stats";
            }
            case "neighbor" -> {
                expectArgs(cmd, args, 1, 1, "<name>");
                yield "/neighbors" + namePath(args[0]);
            }
            case "cost" -> {
                expectArgs(cmd, args, 1, 2, "<name> [base]");
                String path = "/neighbors" + namePath(args[0]) + "/cost";
                if (args.length == 2) {
                    try {
                        Double.parseDouble(args[1]);
                    } catch (NumberFormatException e) {
                        throw new CliException("base must be a number: " + args[1]);
                    }
                    path += "?base=" + URLEncoder.encode(args[1], StandardCharsets.UTF_8);
                }
                yield path;
            }
            default -> throw new CliException("unknown command: " + cmd);
        };
    }

    private void run(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() == 404) {
            throw new CliException("not found: " + resp.body());
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    /** "/site/router-b", "site/router-b" and "site/router-b/" all become "/site/router-b". */
    private static String namePath(String name) {
        String n = trimSlash(name.trim());
        if (n.isEmpty() || "/".equals(n)) {
            throw new CliException("neighbor name must not be empty");
        }
        return n.startsWith("/") ? n : "/" + n;
    }

    private static String trimSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static void expectArgs(String cmd, String[] args, int min, int max, String usage) {
        if (args.length < min || args.length > max) {
            throw new CliException(usage.isEmpty()
                    ? cmd + " takes no arguments"
                    : cmd + " requires " + usage);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if ("--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  lslite-cli [--base-url http://host:port] health
                  lslite-cli [--base-url http://host:port] neighbors
                  lslite-cli [--base-url http://host:port] neighbor <name>
                  lslite-cli [--base-url http://host:port] cost <name> [base]
                  lslite-cli [--base-url http://host:port] stats
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
