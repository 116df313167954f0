package xzy.fz.agent.tunnel;

import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.proxy.ProxyDescriptor;
import xzy.fz.agent.proxy.ProxyScheme;

/**
 * Creates the tunnel broker for a family of proxy schemes. Implementations are discovered with
 * {@link java.util.ServiceLoader} from {@code META-INF/services/xzy.fz.agent.tunnel.TunnelProvider}.
 */
public interface TunnelProvider {

    boolean supports(ProxyScheme scheme);

    /**
     * @param proxy          Parsed proxy URL
     * @param secureEndpoint Whether the destination is TLS or a WebSocket upgrade
     * @param context        Shared services of the owning dispatcher
     * @param headers        Extra headers for HTTP proxies
     */
    ConnectionBroker create(ProxyDescriptor proxy, boolean secureEndpoint, TunnelContext context,
                            HeaderProvider headers);
}
