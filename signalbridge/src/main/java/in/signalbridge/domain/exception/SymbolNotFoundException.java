package in.signalbridge.domain.exception;

/**
 * Symbol is not listed on the exchange. Permanent for the trade, never retried.
 */
public class SymbolNotFoundException extends RuntimeException {

    private final String symbol;

    public SymbolNotFoundException(String symbol) {
        super("Invalid symbol: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
