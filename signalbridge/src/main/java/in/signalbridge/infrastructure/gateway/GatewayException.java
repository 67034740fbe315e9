package in.signalbridge.infrastructure.gateway;

/**
 * Network or exchange failure in an order gateway call.
 *
 * The message carries the provider's own error text where one was returned.
 */
public class GatewayException extends RuntimeException {

    private final String operation;

    public GatewayException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
    }

    public GatewayException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
