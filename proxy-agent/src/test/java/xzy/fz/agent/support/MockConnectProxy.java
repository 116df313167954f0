package xzy.fz.agent.support;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.CharsetUtil;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP proxy that answers every CONNECT with a canned response. After a {@code 200} the connection
 * becomes an echo server standing in for the destination, optionally behind TLS.
 */
public final class MockConnectProxy implements AutoCloseable {

    private final BlockingQueue<String> connectHeads = new LinkedBlockingQueue<>();
    private final AtomicInteger bytesAfterHead = new AtomicInteger();
    private final AtomicInteger destinationHandshakes = new AtomicInteger();
    private final AtomicInteger proxyHandshakes = new AtomicInteger();
    private final CountDownLatch disconnected = new CountDownLatch(1);
    private final LoopbackServer server;

    private MockConnectProxy(String response, SslContext proxyTls, SslContext destinationTls)
            throws InterruptedException {
        this.server = LoopbackServer.start(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ch.closeFuture().addListener(f -> disconnected.countDown());
                if (proxyTls != null) {
                    SslHandler tls = proxyTls.newHandler(ch.alloc());
                    tls.handshakeFuture().addListener(f -> {
                        if (f.isSuccess()) {
                            proxyHandshakes.incrementAndGet();
                        }
                    });
                    ch.pipeline().addLast(tls);
                }
                ch.pipeline().addLast(new ConnectResponder(response, destinationTls));
            }
        });
    }

    public static MockConnectProxy respondingWith(String response) throws InterruptedException {
        return new MockConnectProxy(response, null, null);
    }

    /** Terminates TLS itself, as an {@code https://} proxy, then behaves like {@link #respondingWith}. */
    public static MockConnectProxy overTls(SslContext proxyTls, String response) throws InterruptedException {
        return new MockConnectProxy(response, proxyTls, null);
    }

    /** Answers {@code 200} and then speaks TLS as the destination. */
    public static MockConnectProxy tlsDestination(SslContext destinationTls) throws InterruptedException {
        return new MockConnectProxy("HTTP/1.1 200 Connection established\r\n\r\n", null, destinationTls);
    }

    public int port() {
        return server.port();
    }

    public BlockingQueue<String> connectHeads() {
        return connectHeads;
    }

    /** Bytes the client sent after the CONNECT head on connections that were refused. */
    public int bytesAfterHead() {
        return bytesAfterHead.get();
    }

    public int destinationHandshakes() {
        return destinationHandshakes.get();
    }

    public int proxyHandshakes() {
        return proxyHandshakes.get();
    }

    public CountDownLatch disconnected() {
        return disconnected;
    }

    @Override
    public void close() {
        server.close();
    }

    private final class ConnectResponder extends ChannelInboundHandlerAdapter {
        private final String response;
        private final SslContext destinationTls;
        private final ByteBuf head = Unpooled.buffer();
        private boolean answered;

        ConnectResponder(String response, SslContext destinationTls) {
            this.response = response;
            this.destinationTls = destinationTls;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            ByteBuf in = (ByteBuf) msg;
            if (answered) {
                bytesAfterHead.addAndGet(in.readableBytes());
                in.release();
                return;
            }
            head.writeBytes(in);
            in.release();
            String text = head.toString(CharsetUtil.ISO_8859_1);
            int end = text.indexOf("\r\n\r\n");
            if (end < 0) {
                return;
            }
            answered = true;
            connectHeads.add(text.substring(0, end + 4));
            ByteBuf rest = head.retainedSlice(end + 4, head.readableBytes() - end - 4);
            head.release();

            ctx.writeAndFlush(Unpooled.copiedBuffer(response, CharsetUtil.ISO_8859_1));
            if (!response.startsWith("HTTP/1.1 200")) {
                bytesAfterHead.addAndGet(rest.readableBytes());
                rest.release();
                return;
            }
            if (destinationTls != null) {
                SslHandler tls = destinationTls.newHandler(ctx.alloc());
                tls.handshakeFuture().addListener(f -> {
                    if (f.isSuccess()) {
                        destinationHandshakes.incrementAndGet();
                    }
                });
                ctx.pipeline().addLast(tls);
            }
            ctx.pipeline().addLast(new EchoHandler());
            ctx.pipeline().remove(this);
            if (rest.isReadable()) {
                ctx.fireChannelRead(rest);
            } else {
                rest.release();
            }
        }

        @Override
        public void handlerRemoved(ChannelHandlerContext ctx) {
            if (!answered && head.refCnt() > 0) {
                head.release();
            }
        }
    }
}
