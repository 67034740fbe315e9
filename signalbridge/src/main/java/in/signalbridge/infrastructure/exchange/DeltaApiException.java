package in.signalbridge.infrastructure.exchange;

import in.signalbridge.infrastructure.gateway.GatewayException;

/**
 * Non-2xx (or success=false) answer from the Delta Exchange REST API.
 */
public class DeltaApiException extends GatewayException {

    private final int statusCode;
    private final String errorCode;

    public DeltaApiException(String operation, int statusCode, String errorCode, String message) {
        super(operation, String.format("Delta API error %d (%s): %s", statusCode, errorCode, message));
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
