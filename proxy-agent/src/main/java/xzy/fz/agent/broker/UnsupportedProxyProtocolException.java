package xzy.fz.agent.broker;

public class UnsupportedProxyProtocolException extends RuntimeException {

    private final String scheme;

    public UnsupportedProxyProtocolException(String scheme) {
        super("Unsupported proxy protocol: " + scheme);
        this.scheme = scheme;
    }

    public String scheme() {
        return scheme;
    }
}
