package xzy.fz.agent.support;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.socksx.SocksMessage;
import io.netty.handler.codec.socksx.SocksPortUnificationServerHandler;
import io.netty.handler.codec.socksx.v4.DefaultSocks4CommandResponse;
import io.netty.handler.codec.socksx.v4.Socks4CommandRequest;
import io.netty.handler.codec.socksx.v4.Socks4CommandStatus;
import io.netty.handler.codec.socksx.v5.DefaultSocks5CommandResponse;
import io.netty.handler.codec.socksx.v5.DefaultSocks5InitialResponse;
import io.netty.handler.codec.socksx.v5.Socks5AddressType;
import io.netty.handler.codec.socksx.v5.Socks5AuthMethod;
import io.netty.handler.codec.socksx.v5.Socks5CommandRequest;
import io.netty.handler.codec.socksx.v5.Socks5CommandRequestDecoder;
import io.netty.handler.codec.socksx.v5.Socks5CommandStatus;
import io.netty.handler.codec.socksx.v5.Socks5InitialRequest;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SOCKS4/4a/5 server that records the requested destination, answers success (or failure when
 * configured to refuse) and then echoes the tunnel bytes.
 */
public final class MockSocksServer implements AutoCloseable {

    private final BlockingQueue<String> destinations = new LinkedBlockingQueue<>();
    private final AtomicInteger connections = new AtomicInteger();
    private final LoopbackServer server;

    private MockSocksServer(boolean refuse) throws InterruptedException {
        this.server = LoopbackServer.start(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                connections.incrementAndGet();
                ch.pipeline().addLast(new SocksPortUnificationServerHandler());
                ch.pipeline().addLast(new CommandHandler(refuse));
            }
        });
    }

    public static MockSocksServer accepting() throws InterruptedException {
        return new MockSocksServer(false);
    }

    public static MockSocksServer refusing() throws InterruptedException {
        return new MockSocksServer(true);
    }

    public int port() {
        return server.port();
    }

    /** {@code host:port} of every CONNECT command, as the client sent it. */
    public BlockingQueue<String> destinations() {
        return destinations;
    }

    public int connections() {
        return connections.get();
    }

    @Override
    public void close() {
        server.close();
    }

    private final class CommandHandler extends SimpleChannelInboundHandler<Object> {
        private final boolean refuse;

        CommandHandler(boolean refuse) {
            this.refuse = refuse;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof Socks4CommandRequest request) {
                destinations.add(request.dstAddr() + ":" + request.dstPort());
                ctx.writeAndFlush(new DefaultSocks4CommandResponse(
                        refuse ? Socks4CommandStatus.REJECTED_OR_FAILED : Socks4CommandStatus.SUCCESS));
            } else if (msg instanceof Socks5InitialRequest) {
                ctx.pipeline().addBefore(ctx.name(), "socks5-command", new Socks5CommandRequestDecoder());
                ctx.writeAndFlush(new DefaultSocks5InitialResponse(Socks5AuthMethod.NO_AUTH));
            } else if (msg instanceof Socks5CommandRequest request) {
                destinations.add(request.dstAddr() + ":" + request.dstPort());
                ctx.writeAndFlush(new DefaultSocks5CommandResponse(
                        refuse ? Socks5CommandStatus.FORBIDDEN : Socks5CommandStatus.SUCCESS,
                        Socks5AddressType.IPv4, "127.0.0.1", 1080));
            } else if (msg instanceof ByteBuf data) {
                ctx.writeAndFlush(data.retain());
            } else if (msg instanceof SocksMessage) {
                ctx.close();
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            ctx.close();
        }
    }
}
