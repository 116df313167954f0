package xzy.fz.agent.handler.upstream;

import io.netty.buffer.ByteBuf;
import io.netty.util.ReferenceCounted;

/**
 * Parsed CONNECT answer plus every byte received from the proxy so far.
 *
 * @param response   Parsed status line and headers
 * @param buffered   All received bytes, starting with the response head; owned by the reply
 * @param headLength Length of the head including the terminating blank line
 */
public record ConnectReply(ProxyResponse response, ByteBuf buffered, int headLength) implements ReferenceCounted {

    /** Bytes that followed the head, as a retained slice. */
    public ByteBuf retainedTrailer() {
        return buffered.retainedSlice(buffered.readerIndex() + headLength, buffered.readableBytes() - headLength);
    }

    public boolean hasTrailer() {
        return buffered.readableBytes() > headLength;
    }

    @Override
    public int refCnt() {
        return buffered.refCnt();
    }

    @Override
    public ConnectReply retain() {
        buffered.retain();
        return this;
    }

    @Override
    public ConnectReply retain(int increment) {
        buffered.retain(increment);
        return this;
    }

    @Override
    public ConnectReply touch() {
        buffered.touch();
        return this;
    }

    @Override
    public ConnectReply touch(Object hint) {
        buffered.touch(hint);
        return this;
    }

    @Override
    public boolean release() {
        return buffered.release();
    }

    @Override
    public boolean release(int decrement) {
        return buffered.release(decrement);
    }
}
