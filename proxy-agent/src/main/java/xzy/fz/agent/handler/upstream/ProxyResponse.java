package xzy.fz.agent.handler.upstream;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * Status line and headers of a proxy's answer to {@code CONNECT}.
 *
 * @param statusCode   HTTP status code
 * @param reasonPhrase Reason phrase, possibly empty
 * @param headers      Response headers in arrival order
 */
public record ProxyResponse(int statusCode, String reasonPhrase, HttpHeaders headers) {

    /** Only 200 opens a tunnel. */
    public boolean isTunnelEstablished() {
        return statusCode == 200;
    }

    @Override
    public String toString() {
        return "ProxyResponse{" + statusCode + " " + reasonPhrase + "}";
    }
}
