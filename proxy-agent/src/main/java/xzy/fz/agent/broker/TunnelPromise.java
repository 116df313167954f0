package xzy.fz.agent.broker;

import io.netty.util.concurrent.DefaultPromise;
import io.netty.util.concurrent.EventExecutor;

/**
 * Promise whose cancellation surfaces as {@link ConnectFailedException.Reason#CANCELLED}.
 */
final class TunnelPromise extends DefaultPromise<TunnelResult> {

    TunnelPromise(EventExecutor executor) {
        super(executor);
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        return tryFailure(new ConnectFailedException(ConnectFailedException.Reason.CANCELLED,
                "Connection attempt cancelled"));
    }
}
