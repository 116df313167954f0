package xzy.fz.agent.tunnel;

import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.proxy.ProxyDescriptor;
import xzy.fz.agent.proxy.ProxyScheme;

/**
 * {@code http://} and {@code https://} proxies: CONNECT tunnels for TLS destinations and WebSocket
 * upgrades, forward proxying for everything else.
 */
public class HttpTunnelProvider implements TunnelProvider {

    @Override
    public boolean supports(ProxyScheme scheme) {
        return scheme == ProxyScheme.HTTP || scheme == ProxyScheme.HTTPS;
    }

    @Override
    public ConnectionBroker create(ProxyDescriptor proxy, boolean secureEndpoint, TunnelContext context,
                                   HeaderProvider headers) {
        if (secureEndpoint) {
            return new ConnectTunnel(proxy, context, headers);
        }
        return new ForwardHttpTunnel(proxy, context, headers);
    }
}
