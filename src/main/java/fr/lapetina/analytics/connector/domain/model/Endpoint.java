package fr.lapetina.analytics.connector.domain.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Network address of one remote server instance.
 *
 * Scheme and host are lower-cased and the port is always explicit, so two endpoints
 * written differently ("HTTP://LocalHost" and "http://localhost:80") compare equal.
 * Immutable; used only as a lookup key.
 */
public record Endpoint(String scheme, String host, int port) {

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "::1", "[::1]");

    public Endpoint {
        Objects.requireNonNull(scheme, "Scheme is required");
        Objects.requireNonNull(host, "Host is required");
        scheme = scheme.toLowerCase(Locale.ROOT);
        host = host.toLowerCase(Locale.ROOT);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Host is required");
        }
        if (port <= 0) {
            port = defaultPort(scheme);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port for endpoint: " + scheme + "://" + host + ":" + port);
        }
    }

    /**
     * Parses an endpoint from a URL string. Path, query and fragment are ignored.
     *
     * @throws IllegalArgumentException if the string is not an absolute URL with a host
     */
    public static Endpoint parse(String url) {
        Objects.requireNonNull(url, "URL is required");
        try {
            return of(URI.create(url.trim()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid endpoint URL: " + url, e);
        }
    }

    /**
     * Creates an endpoint from the scheme, host and port of a URI.
     */
    public static Endpoint of(URI uri) {
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Endpoint URL must be absolute with a host: " + uri);
        }
        return new Endpoint(uri.getScheme(), uri.getHost(), uri.getPort());
    }

    /**
     * True if the host designates the local machine.
     */
    public boolean isLoopback() {
        return LOOPBACK_HOSTS.contains(host) || host.startsWith("127.");
    }

    /**
     * Scheme, host and port, with the port left out when it is the scheme's default.
     * Same form as a browser's {@code URL.origin}.
     */
    public String origin() {
        if (port == defaultPort(scheme)) {
            return scheme + "://" + host;
        }
        return scheme + "://" + host + ":" + port;
    }

    public URI toUri() {
        return URI.create(origin() + "/");
    }

    /**
     * Resolves a relative path against this endpoint's root.
     */
    public URI resolve(String path) {
        return toUri().resolve(path);
    }

    private static int defaultPort(String scheme) {
        return switch (scheme) {
            case "http", "ws" -> 80;
            case "https", "wss" -> 443;
            default -> -1;
        };
    }

    @Override
    public String toString() {
        return origin();
    }
}
