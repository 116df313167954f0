package xzy.fz.agent.handler.upstream;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.ImmediateEventExecutor;
import io.netty.util.concurrent.Promise;
import org.junit.jupiter.api.Test;
import xzy.fz.agent.broker.ConnectFailedException;

import static org.junit.jupiter.api.Assertions.*;

class ConnectHandshakeHandlerTest {

    private final Promise<ConnectReply> reply = ImmediateEventExecutor.INSTANCE.newPromise();

    private EmbeddedChannel handshake(int maxHeadBytes) {
        return handshake(maxHeadBytes, 0);
    }

    private EmbeddedChannel handshake(int maxHeadBytes, long responseTimeoutMillis) {
        HttpHeaders headers = new DefaultHttpHeaders()
                .set("Host", "example.com:443")
                .set("Proxy-Connection", "Keep-Alive");
        return new EmbeddedChannel(new ConnectHandshakeHandler("example.com:443", headers, maxHeadBytes,
                responseTimeoutMillis, reply));
    }

    private static ByteBuf ascii(String text) {
        return Unpooled.copiedBuffer(text, CharsetUtil.ISO_8859_1);
    }

    @Test
    void testWritesConnectRequestOnActivation() {
        EmbeddedChannel channel = handshake(1024);

        ByteBuf request = channel.readOutbound();
        assertEquals("CONNECT example.com:443 HTTP/1.1\r\n"
                + "Host: example.com:443\r\n"
                + "Proxy-Connection: Keep-Alive\r\n\r\n", request.toString(CharsetUtil.ISO_8859_1));
        request.release();
        assertFalse(reply.isDone());
    }

    @Test
    void testHeadSplitAcrossReadsWithTrailingBytes() {
        EmbeddedChannel channel = handshake(1024);

        channel.writeInbound(ascii("HTTP/1.1 200 Connection"));
        assertFalse(reply.isDone());
        channel.writeInbound(ascii(" established\r\nVia: 1.1 squid\r\n\r\nEARLY"));

        ConnectReply connectReply = reply.getNow();
        assertEquals(200, connectReply.response().statusCode());
        assertEquals("Connection established", connectReply.response().reasonPhrase());
        assertEquals("1.1 squid", connectReply.response().headers().get("Via"));
        assertTrue(connectReply.hasTrailer());
        ByteBuf trailer = connectReply.retainedTrailer();
        assertEquals("EARLY", trailer.toString(CharsetUtil.ISO_8859_1));
        trailer.release();
        connectReply.release();
        channel.finishAndReleaseAll();
    }

    @Test
    void testRefusalIsStillAReply() {
        EmbeddedChannel channel = handshake(1024);

        channel.writeInbound(ascii("HTTP/1.1 407 Proxy Authentication Required\r\n"
                + "Proxy-Authenticate: Basic realm=\"corp\"\r\nContent-Length: 0\r\n\r\n"));

        ConnectReply connectReply = reply.getNow();
        assertFalse(connectReply.response().isTunnelEstablished());
        assertEquals("Basic realm=\"corp\"", connectReply.response().headers().get("Proxy-Authenticate"));
        assertFalse(connectReply.hasTrailer());
        connectReply.release();
        channel.finishAndReleaseAll();
    }

    @Test
    void testOversizedHeadIsAProtocolError() {
        EmbeddedChannel channel = handshake(32);

        channel.writeInbound(ascii("HTTP/1.1 200 OK\r\nX-Padding: aaaaaaaaaaaaaaaaaaaaaaaaaaaa\r\n"));

        assertEquals(ConnectFailedException.Reason.PROXY_PROTOCOL, reason());
        assertFalse(channel.isOpen());
    }

    @Test
    void testGarbledStatusLineIsAProtocolError() {
        EmbeddedChannel channel = handshake(1024);

        channel.writeInbound(ascii("SSH-2.0-OpenSSH_9.6\r\n\r\n"));

        assertEquals(ConnectFailedException.Reason.PROXY_PROTOCOL, reason());
        assertFalse(channel.isOpen());
    }

    @Test
    void testCloseBeforeAnswerIsAConnectFailure() {
        EmbeddedChannel channel = handshake(1024);

        channel.close();

        assertEquals(ConnectFailedException.Reason.CONNECT, reason());
    }

    @Test
    void testBareLineFeedsEndTheHead() {
        EmbeddedChannel channel = handshake(1024);

        channel.writeInbound(ascii("HTTP/1.0 200 OK\nVia: 1.0 legacy\n\nX"));

        ConnectReply connectReply = reply.getNow();
        assertEquals(200, connectReply.response().statusCode());
        assertEquals("1.0 legacy", connectReply.response().headers().get("Via"));
        assertEquals(33, connectReply.headLength());
        ByteBuf trailer = connectReply.retainedTrailer();
        assertEquals("X", trailer.toString(CharsetUtil.ISO_8859_1));
        trailer.release();
        connectReply.release();
        channel.finishAndReleaseAll();
    }

    @Test
    void testStatusLineWithoutReasonPhrase() {
        EmbeddedChannel channel = handshake(1024);

        channel.writeInbound(ascii("HTTP/1.0 403\r\n\r\n"));

        ConnectReply connectReply = reply.getNow();
        assertEquals(403, connectReply.response().statusCode());
        assertEquals("", connectReply.response().reasonPhrase());
        assertEquals(16, connectReply.headLength());
        connectReply.release();
        channel.finishAndReleaseAll();
    }

    @Test
    void testNonNumericStatusIsAProtocolError() {
        EmbeddedChannel channel = handshake(1024);

        channel.writeInbound(ascii("HTTP/1.1 abc\r\n\r\n"));

        assertEquals(ConnectFailedException.Reason.PROXY_PROTOCOL, reason());
        assertFalse(channel.isOpen());
    }

    @Test
    void testSilentProxyFailsAtTheDeadline() throws Exception {
        EmbeddedChannel channel = handshake(1024, 50);
        ByteBuf request = channel.readOutbound();
        request.release();

        Thread.sleep(150);
        channel.runScheduledPendingTasks();

        assertEquals(ConnectFailedException.Reason.CONNECT, reason());
        assertTrue(reply.cause().getMessage().contains("within 50 ms"), reply.cause().getMessage());
        assertFalse(channel.isOpen());
    }

    @Test
    void testAnswerBeforeDeadlineKeepsTheChannel() throws Exception {
        EmbeddedChannel channel = handshake(1024, 50);

        channel.writeInbound(ascii("HTTP/1.1 200 OK\r\n\r\n"));
        Thread.sleep(150);
        channel.runScheduledPendingTasks();

        assertTrue(reply.isSuccess());
        assertTrue(channel.isOpen());
        reply.getNow().release();
        channel.finishAndReleaseAll();
    }

    private ConnectFailedException.Reason reason() {
        assertTrue(reply.isDone());
        assertFalse(reply.isSuccess());
        return ((ConnectFailedException) reply.cause()).reason();
    }
}
