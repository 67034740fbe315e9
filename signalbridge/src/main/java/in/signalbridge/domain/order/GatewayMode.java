package in.signalbridge.domain.order;

public enum GatewayMode {
    LIVE,
    PAPER
}
