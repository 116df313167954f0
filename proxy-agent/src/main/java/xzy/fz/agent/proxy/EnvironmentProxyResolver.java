package xzy.fz.agent.proxy;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import xzy.fz.agent.broker.TunnelRequest;

import java.net.URI;
import java.util.Locale;
import java.util.function.Function;

/**
 * Picks the proxy from {@code <protocol>_proxy} / {@code all_proxy} environment variables, honouring
 * {@code no_proxy}. Lower-case variable names win over upper-case ones.
 *
 * <p>{@code no_proxy} is a comma or whitespace separated list. {@code *} disables proxying
 * entirely; an entry starting with {@code .} or {@code *.} matches the host and its subdomains,
 * anything else must match exactly. An optional {@code :port} limits the entry to that port.
 */
public final class EnvironmentProxyResolver implements ProxyResolver {

    private final Function<String, String> env;

    public EnvironmentProxyResolver() {
        this(System::getenv);
    }

    public EnvironmentProxyResolver(Function<String, String> env) {
        this.env = env;
    }

    @Override
    public Future<String> resolve(String url, TunnelRequest request, Promise<String> promise) {
        return promise.setSuccess(proxyFor(url));
    }

    /** Returns the proxy URL for {@code url}, or {@code null} when it should be reached directly. */
    public String proxyFor(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException iae) {
            return null;
        }
        String protocol = uri.getScheme();
        String host = uri.getHost();
        if (protocol == null || host == null) {
            return null;
        }
        protocol = protocol.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : defaultPort(protocol);
        if (!shouldProxy(host.toLowerCase(Locale.ROOT), port)) {
            return null;
        }

        String proxy = variable(protocol + "_proxy");
        if (proxy == null) {
            proxy = variable("all_proxy");
        }
        if (proxy != null && !proxy.contains("://")) {
            proxy = protocol + "://" + proxy;
        }
        return proxy;
    }

    private boolean shouldProxy(String host, int port) {
        String noProxy = variable("no_proxy");
        if (noProxy == null) {
            return true;
        }
        noProxy = noProxy.toLowerCase(Locale.ROOT);
        if (noProxy.equals("*")) {
            return false;
        }
        for (String entry : noProxy.split("[,\\s]+")) {
            if (entry.isEmpty()) {
                continue;
            }
            String entryHost = entry;
            int entryPort = 0;
            int colon = entry.lastIndexOf(':');
            // a bare IPv6 literal has several colons and no port
            if (colon > 0 && entry.indexOf(':') == colon) {
                try {
                    entryPort = Integer.parseInt(entry.substring(colon + 1));
                    entryHost = entry.substring(0, colon);
                } catch (NumberFormatException nfe) {
                    entryPort = 0;
                }
            }
            if (entryPort != 0 && entryPort != port) {
                continue;
            }
            if (entryHost.startsWith("*")) {
                entryHost = entryHost.substring(1);
            }
            if (!entryHost.startsWith(".")) {
                if (host.equals(entryHost)) {
                    return false;
                }
            } else if (host.endsWith(entryHost) || host.equals(entryHost.substring(1))) {
                return false;
            }
        }
        return true;
    }

    private String variable(String name) {
        String value = env.apply(name.toLowerCase(Locale.ROOT));
        if (value == null || value.isBlank()) {
            value = env.apply(name.toUpperCase(Locale.ROOT));
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int defaultPort(String protocol) {
        if ("https".equals(protocol) || "wss".equals(protocol)) {
            return 443;
        }
        return "ftp".equals(protocol) ? 21 : 80;
    }
}
