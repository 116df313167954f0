package xzy.fz.agent.tunnel;

import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.proxy.ProxyDescriptor;
import xzy.fz.agent.proxy.ProxyScheme;

public class SocksTunnelProvider implements TunnelProvider {

    @Override
    public boolean supports(ProxyScheme scheme) {
        return scheme.isSocks();
    }

    @Override
    public ConnectionBroker create(ProxyDescriptor proxy, boolean secureEndpoint, TunnelContext context,
                                   HeaderProvider headers) {
        return new SocksTunnel(proxy, context);
    }
}
