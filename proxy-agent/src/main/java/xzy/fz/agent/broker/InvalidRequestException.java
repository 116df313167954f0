package xzy.fz.agent.broker;

/**
 * A connect request or proxy URL is malformed. Thrown synchronously, before any work starts.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
