package in.signalbridge.infrastructure.gateway;

/**
 * Order refused, either locally before any I/O (size out of range) or by the exchange.
 */
public class OrderRejectedException extends GatewayException {

    private final String symbol;

    public OrderRejectedException(String operation, String symbol, String message) {
        super(operation, "Order rejected for " + symbol + ": " + message);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
