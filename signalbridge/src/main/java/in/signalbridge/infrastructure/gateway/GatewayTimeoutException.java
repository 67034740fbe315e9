package in.signalbridge.infrastructure.gateway;

import java.time.Duration;

/**
 * Gateway call did not complete within its timeout. The outcome on the exchange is unknown.
 */
public class GatewayTimeoutException extends GatewayException {

    private final Duration timeout;

    public GatewayTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(operation, "Timed out after " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
