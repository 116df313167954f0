package xzy.fz.agent.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.*;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.util.ReferenceCountUtil;

import java.nio.channels.ClosedChannelException;

/**
 * Delivers bytes that were read before the caller's handlers existed.
 * <p>
 * The buffered bytes are fired on the first outbound {@code read()}, followed by
 * {@code channelReadComplete}. Two modes:
 * <ul>
 *   <li><b>pass-through</b>: after the replay the handler removes itself and the read continues on the
 *   real channel (bytes that followed a {@code 200} CONNECT answer)</li>
 *   <li><b>end of stream</b>: after the replay the channel closes and writes fail (the read-only
 *   replay of a refused CONNECT)</li>
 * </ul>
 */
public class BufferedReplayHandler extends ChannelDuplexHandler {

    public static final String NAME = "buffered-replay";

    private ByteBuf buffered;
    private final boolean endOfStream;

    /**
     * @param buffered    Bytes to replay; ownership passes to this handler
     * @param endOfStream Close the channel after the replay and reject writes
     */
    public BufferedReplayHandler(ByteBuf buffered, boolean endOfStream) {
        this.buffered = buffered;
        this.endOfStream = endOfStream;
    }

    /**
     * Creates a registered, read-only channel that replays {@code buffered} on its first read and then
     * reports end of stream. Writes fail with {@link ClosedChannelException}.
     */
    public static Channel replayChannel(ByteBuf buffered) {
        EmbeddedChannel channel = new EmbeddedChannel(false, false);
        channel.config().setAutoRead(false);
        channel.pipeline().addLast(NAME, new BufferedReplayHandler(buffered, true));
        try {
            channel.register();
        } catch (Exception e) {
            channel.close();
            throw new IllegalStateException("Unable to register replay channel", e);
        }
        return channel;
    }

    @Override
    public void read(ChannelHandlerContext ctx) {
        ByteBuf data = buffered;
        if (data == null) {
            if (endOfStream) {
                ctx.close();
            } else {
                ctx.read();
            }
            return;
        }
        buffered = null;
        if (data.isReadable()) {
            ctx.fireChannelRead(data);
            ctx.fireChannelReadComplete();
        } else {
            data.release();
        }

        if (endOfStream) {
            ctx.close();
            return;
        }
        ctx.read();
        ctx.pipeline().remove(this);
    }

    @Override
    public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
        if (endOfStream) {
            ReferenceCountUtil.release(msg);
            promise.setFailure(new ClosedChannelException());
            return;
        }
        ctx.write(msg, promise);
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        if (buffered != null) {
            buffered.release();
            buffered = null;
        }
    }

    public int bufferedBytes() {
        return buffered == null ? 0 : buffered.readableBytes();
    }
}
