package xzy.fz.agent.broker;

import io.netty.channel.Channel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class of everything that turns a {@link TunnelRequest} into a usable channel.
 *
 * <h2>Lifecycle of one {@link #connect(TunnelRequest)} call</h2>
 * <ol>
 *     <li>The request is validated synchronously.</li>
 *     <li>The endpoint's security is decided (explicit flag, then protocol, then the broker default).</li>
 *     <li>An {@link AdmissionToken} is reserved under the pool name {@code host:port[:servername]}.</li>
 *     <li>{@link #establish(TunnelRequest, boolean, Promise)} runs; when its promise settles the token is
 *     released exactly once.</li>
 *     <li>A {@link TunnelResult.Kind#DELEGATED} result is followed by connecting through the delegate.</li>
 * </ol>
 *
 * <p>Cancelling the returned future fails it with {@link ConnectFailedException.Reason#CANCELLED} and
 * fails the pending attempt, so implementations close whatever they had opened.
 */
public abstract class ConnectionBroker {

    private static final Logger log = LoggerFactory.getLogger(ConnectionBroker.class);

    protected final TunnelContext context;
    private final ChannelGroup channels;
    private final AtomicBoolean destroyed = new AtomicBoolean();
    private volatile boolean defaultSecure;

    protected ConnectionBroker(TunnelContext context) {
        this.context = context;
        this.channels = new DefaultChannelGroup(getClass().getSimpleName(), context.executor(), true);
    }

    public final Future<TunnelResult> connect(TunnelRequest request) {
        validate(request);
        EventExecutor executor = context.executor();
        TunnelPromise result = new TunnelPromise(executor);
        if (destroyed.get()) {
            result.tryFailure(new ConnectFailedException(ConnectFailedException.Reason.CLOSED,
                    getClass().getSimpleName() + " has been destroyed"));
            return result;
        }

        boolean secure = isSecureEndpoint(request);
        AdmissionToken token = context.admissionControl().reserve(poolName(request));
        TunnelPromise attempt = new TunnelPromise(executor);
        attempt.addListener(f -> token.release());

        AtomicReference<Future<TunnelResult>> downstream = new AtomicReference<>();
        result.addListener(f -> {
            if (!f.isSuccess()) {
                attempt.cancel(false);
                Future<TunnelResult> next = downstream.get();
                if (next != null) {
                    next.cancel(false);
                }
            }
        });

        attempt.addListener((Future<TunnelResult> f) -> {
            if (!f.isSuccess()) {
                result.tryFailure(f.cause());
                return;
            }
            TunnelResult outcome = f.getNow();
            if (outcome.kind() != TunnelResult.Kind.DELEGATED) {
                complete(result, outcome);
                return;
            }
            Future<TunnelResult> next;
            try {
                next = outcome.delegate().connect(outcome.delegatedRequest());
            } catch (RuntimeException e) {
                result.tryFailure(e);
                return;
            }
            downstream.set(next);
            if (result.isDone()) {
                next.cancel(false);
            }
            next.addListener((Future<TunnelResult> n) -> {
                if (n.isSuccess()) {
                    complete(result, n.getNow());
                } else {
                    result.tryFailure(n.cause());
                }
            });
        });

        try {
            establish(request, secure, attempt);
        } catch (RuntimeException e) {
            log.debug("{} failed to start connecting to {}", getClass().getSimpleName(), request, e);
            attempt.tryFailure(e);
        }
        return result;
    }

    /**
     * Starts the attempt. Implementations complete {@code promise} and close any channel they opened
     * once it fails, including through cancellation.
     */
    protected abstract void establish(TunnelRequest request, boolean secure, Promise<TunnelResult> promise);

    /**
     * Checks {@code request} before any work is done. Subclasses may add checks.
     *
     * @throws InvalidRequestException if the request cannot be served
     */
    protected void validate(TunnelRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Request is missing");
        }
        if (request.host() == null || request.host().isBlank()) {
            throw new InvalidRequestException("Destination host is missing");
        }
        if (request.port() < 1 || request.port() > 65535) {
            throw new InvalidRequestException("Destination port out of range: " + request.port());
        }
    }

    /**
     * Explicit {@code secureEndpoint} wins, then {@code https}/{@code wss} protocols, then the broker's
     * default.
     */
    public boolean isSecureEndpoint(TunnelRequest request) {
        if (request.secureEndpoint() != null) {
            return request.secureEndpoint();
        }
        String protocol = request.protocol();
        if (protocol != null) {
            return "https".equalsIgnoreCase(protocol) || "wss".equalsIgnoreCase(protocol);
        }
        return defaultSecure;
    }

    public void setDefaultSecure(boolean defaultSecure) {
        this.defaultSecure = defaultSecure;
    }

    public static String poolName(TunnelRequest request) {
        String name = request.host() + ":" + request.port();
        return request.serverName() == null ? name : name + ":" + request.serverName();
    }

    /** Registers {@code channel} so that {@link #destroy()} closes it. */
    protected void track(Channel channel) {
        channels.add(channel);
    }

    /** Completes {@code promise} with {@code result}, or closes the result if the promise already failed. */
    protected static void complete(Promise<TunnelResult> promise, TunnelResult result) {
        if (!promise.trySuccess(result)) {
            result.discard();
        }
    }

    /** Closes every channel this broker opened. Safe to call more than once. */
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        log.debug("Destroying {} ({} open channels)", getClass().getSimpleName(), channels.size());
        channels.close();
        onDestroy();
    }

    public boolean isDestroyed() {
        return destroyed.get();
    }

    /** Hook for subclasses owning further resources. */
    protected void onDestroy() {
    }

    public TunnelContext context() {
        return context;
    }
}
