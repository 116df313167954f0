package xzy.fz.agent.tunnel;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;

import java.util.function.Supplier;

/**
 * Extra headers sent to HTTP proxies, either a fixed set or one computed per request.
 * <p>
 * Only fixed sets are memoized by the CONNECT tunnel; a callback runs for every request.
 */
public interface HeaderProvider {

    HeaderProvider NONE = of(new DefaultHttpHeaders());

    /** Headers for the next request. Callers must not modify the returned object. */
    HttpHeaders headers();

    /** Whether {@link #headers()} always returns the same headers. */
    boolean isStatic();

    static HeaderProvider of(HttpHeaders headers) {
        HttpHeaders copy = new DefaultHttpHeaders().add(headers);
        return new HeaderProvider() {
            @Override
            public HttpHeaders headers() {
                return copy;
            }

            @Override
            public boolean isStatic() {
                return true;
            }
        };
    }

    static HeaderProvider of(Supplier<HttpHeaders> supplier) {
        return new HeaderProvider() {
            @Override
            public HttpHeaders headers() {
                HttpHeaders headers = supplier.get();
                return headers == null ? new DefaultHttpHeaders() : headers;
            }

            @Override
            public boolean isStatic() {
                return false;
            }
        };
    }
}
