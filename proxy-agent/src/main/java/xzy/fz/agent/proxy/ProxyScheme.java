package xzy.fz.agent.proxy;

import xzy.fz.agent.broker.UnsupportedProxyProtocolException;

import java.util.Locale;

public enum ProxyScheme {
    HTTP("http", 80, 0, false),
    HTTPS("https", 443, 0, false),
    // plain socks:// means SOCKS5 with the proxy resolving names
    SOCKS("socks", 1080, 5, false),
    SOCKS4("socks4", 1080, 4, true),
    SOCKS4A("socks4a", 1080, 4, false),
    SOCKS5("socks5", 1080, 5, true),
    SOCKS5H("socks5h", 1080, 5, false);

    private final String scheme;
    private final int defaultPort;
    private final int socksVersion;
    private final boolean clientResolves;

    ProxyScheme(String scheme, int defaultPort, int socksVersion, boolean clientResolves) {
        this.scheme = scheme;
        this.defaultPort = defaultPort;
        this.socksVersion = socksVersion;
        this.clientResolves = clientResolves;
    }

    public static ProxyScheme of(String scheme) {
        String normalized = scheme.toLowerCase(Locale.ROOT);
        if (normalized.endsWith(":")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        for (ProxyScheme candidate : values()) {
            if (candidate.scheme.equals(normalized)) {
                return candidate;
            }
        }
        throw new UnsupportedProxyProtocolException(scheme);
    }

    public String scheme() {
        return scheme;
    }

    public int defaultPort() {
        return defaultPort;
    }

    /** 4 or 5 for SOCKS schemes, 0 for HTTP proxies. */
    public int socksVersion() {
        return socksVersion;
    }

    public boolean isSocks() {
        return socksVersion != 0;
    }

    /** Whether the client looks up the destination before handing it to the proxy. */
    public boolean clientResolves() {
        return clientResolves;
    }
}
