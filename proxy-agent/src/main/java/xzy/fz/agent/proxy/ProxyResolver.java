package xzy.fz.agent.proxy;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import xzy.fz.agent.broker.TunnelRequest;

/**
 * Decides which proxy, if any, serves a destination URL.
 *
 * <p>The answer is a proxy URL such as {@code http://proxy:3128}, or {@code null} / blank for a
 * direct connection. Implementations complete {@code promise} and return it.
 */
@FunctionalInterface
public interface ProxyResolver {

    Future<String> resolve(String url, TunnelRequest request, Promise<String> promise);

    /** Resolver that answers {@code proxyUrl} for every destination. */
    static ProxyResolver fixed(String proxyUrl) {
        return (url, request, promise) -> promise.setSuccess(proxyUrl);
    }

    /** Resolver that always connects directly. */
    static ProxyResolver direct() {
        return (url, request, promise) -> promise.setSuccess(null);
    }
}
