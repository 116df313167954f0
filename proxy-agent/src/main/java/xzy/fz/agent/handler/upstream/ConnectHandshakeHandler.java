package xzy.fz.agent.handler.upstream;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequestEncoder;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseDecoder;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.broker.ConnectFailedException;
import xzy.fz.agent.broker.ConnectFailedException.Reason;

import javax.net.ssl.SSLException;
import java.util.concurrent.TimeUnit;

/**
 * Sends {@code CONNECT host:port} to an HTTP proxy and reads its answer.
 * <p>
 * This handler sits on a raw proxy channel (after the proxy {@code SslHandler}, if any). It:
 * <ol>
 *   <li>Writes the CONNECT request on channel activation, arms the response deadline and asks for
 *   the first read</li>
 *   <li>Keeps every raw byte received while an {@link HttpResponseDecoder} looks for the response head</li>
 *   <li>Completes the reply promise with the decoded status and headers and <em>all</em> buffered
 *   bytes, including any that followed the head</li>
 * </ol>
 * The handler never decides what happens next; the tunnel swaps it out once the promise completes.
 * A head larger than the configured limit or one the decoder rejects fails the promise with
 * {@link Reason#PROXY_PROTOCOL}; a close before the head or a missed deadline fails it with
 * {@link Reason#CONNECT}.
 */
public class ConnectHandshakeHandler extends ChannelInboundHandlerAdapter {
    private static final Logger log = LoggerFactory.getLogger(ConnectHandshakeHandler.class);

    public static final String NAME = "connect-handshake";

    private final String authority;
    private final HttpHeaders headers;
    private final int maxHeadBytes;
    private final long responseTimeoutMillis;
    private final Promise<ConnectReply> replyPromise;
    private ByteBuf buffered;
    private EmbeddedChannel decoder;
    private HeadCapture capture;
    private ScheduledFuture<?> deadline;

    /**
     * @param authority             {@code host:port} of the destination, IPv6 bracketed
     * @param headers               Request headers, written in iteration order
     * @param maxHeadBytes          Largest response head accepted
     * @param responseTimeoutMillis How long to wait for the response head; 0 waits forever
     * @param replyPromise          Completed with the parsed reply or failed with a {@link ConnectFailedException}
     */
    public ConnectHandshakeHandler(String authority, HttpHeaders headers, int maxHeadBytes,
                                   long responseTimeoutMillis, Promise<ConnectReply> replyPromise) {
        this.authority = authority;
        this.headers = headers;
        this.maxHeadBytes = maxHeadBytes;
        this.responseTimeoutMillis = responseTimeoutMillis;
        this.replyPromise = replyPromise;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        log.debug("Sending CONNECT {} to proxy {}", authority, ctx.channel().remoteAddress());
        if (responseTimeoutMillis > 0) {
            deadline = ctx.executor().schedule(() -> {
                if (replyPromise.tryFailure(new ConnectFailedException(Reason.CONNECT,
                        "Proxy did not answer CONNECT " + authority + " within " + responseTimeoutMillis + " ms"))) {
                    log.debug("CONNECT {} timed out after {} ms", authority, responseTimeoutMillis);
                    ctx.close();
                }
            }, responseTimeoutMillis, TimeUnit.MILLISECONDS);
            replyPromise.addListener(f -> deadline.cancel(false));
        }
        ctx.writeAndFlush(encodeRequest(authority, headers)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                fail(new ConnectFailedException(failureReason(future.cause()),
                        "Unable to send CONNECT to proxy", future.cause()));
            }
        });
        ctx.read();
        ctx.fireChannelActive();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf in)) {
            ctx.fireChannelRead(msg);
            return;
        }
        if (replyPromise.isDone()) {
            in.release();
            return;
        }
        if (buffered == null) {
            buffered = ctx.alloc().buffer(Math.max(256, in.readableBytes()));
            capture = new HeadCapture();
            decoder = new EmbeddedChannel(new HttpResponseDecoder(maxHeadBytes, maxHeadBytes, 8192), capture);
        }
        buffered.writeBytes(in, in.readerIndex(), in.readableBytes());
        decoder.writeInbound(in);

        HttpResponse head = capture.head;
        if (head == null) {
            if (buffered.readableBytes() > maxHeadBytes) {
                fail(new ConnectFailedException(Reason.PROXY_PROTOCOL,
                        "Proxy response head exceeds " + maxHeadBytes + " bytes"));
                ctx.close();
            } else {
                ctx.read();
            }
            return;
        }
        if (head.decoderResult().isFailure()) {
            Throwable cause = head.decoderResult().cause();
            fail(new ConnectFailedException(Reason.PROXY_PROTOCOL,
                    "Malformed proxy response: " + cause.getMessage(), cause));
            ctx.close();
            return;
        }
        int code = head.status().code();
        if (code < 100 || code > 999) {
            fail(new ConnectFailedException(Reason.PROXY_PROTOCOL, "Malformed proxy response: bad status code " + code));
            ctx.close();
            return;
        }
        int headLength = buffered.readableBytes() - capture.remaining;
        if (headLength > maxHeadBytes) {
            fail(new ConnectFailedException(Reason.PROXY_PROTOCOL,
                    "Proxy response head exceeds " + maxHeadBytes + " bytes"));
            ctx.close();
            return;
        }

        ProxyResponse response = new ProxyResponse(code, head.status().reasonPhrase(), head.headers());
        log.debug("Proxy answered CONNECT {} with {} {}", authority, response.statusCode(), response.reasonPhrase());
        closeDecoder();
        ByteBuf data = buffered;
        buffered = null;
        if (!replyPromise.trySuccess(new ConnectReply(response, data, headLength))) {
            data.release();
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        fail(new ConnectFailedException(Reason.CONNECT, "Proxy closed the connection before answering CONNECT"));
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("CONNECT handshake error for {}: {}", authority, cause.toString());
        fail(new ConnectFailedException(failureReason(cause), "CONNECT handshake failed: " + cause.getMessage(), cause));
        ctx.close();
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        if (deadline != null) {
            deadline.cancel(false);
        }
        closeDecoder();
        if (buffered != null) {
            buffered.release();
            buffered = null;
        }
    }

    private void closeDecoder() {
        if (decoder != null) {
            decoder.finishAndReleaseAll();
            decoder = null;
        }
    }

    private void fail(ConnectFailedException cause) {
        replyPromise.tryFailure(cause);
    }

    private static Reason failureReason(Throwable cause) {
        if (cause instanceof SSLException
                || (cause instanceof DecoderException && cause.getCause() instanceof SSLException)) {
            return Reason.TLS;
        }
        return Reason.CONNECT;
    }

    /** Encodes {@code CONNECT authority HTTP/1.1} with {@code headers} through {@link HttpRequestEncoder}. */
    public static ByteBuf encodeRequest(String authority, HttpHeaders headers) {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.CONNECT, authority,
                Unpooled.EMPTY_BUFFER, headers, EmptyHttpHeaders.INSTANCE);
        EmbeddedChannel encoder = new EmbeddedChannel(new HttpRequestEncoder());
        CompositeByteBuf out = Unpooled.compositeBuffer();
        try {
            encoder.writeOutbound(request);
            ByteBuf part;
            while ((part = encoder.readOutbound()) != null) {
                out.addComponent(true, part);
            }
        } finally {
            encoder.finishAndReleaseAll();
        }
        return out;
    }

    /**
     * Takes the first decoded response and removes the decoder, which hands back the undecoded rest
     * of its input.
     */
    private static final class HeadCapture extends ChannelInboundHandlerAdapter {
        private HttpResponse head;
        private int remaining;

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (head == null && msg instanceof HttpResponse response) {
                head = response;
                ReferenceCountUtil.release(msg);
                ctx.pipeline().remove(HttpResponseDecoder.class);
            } else if (msg instanceof ByteBuf rest) {
                remaining += rest.readableBytes();
                rest.release();
            } else {
                ReferenceCountUtil.release(msg);
            }
        }
    }
}
