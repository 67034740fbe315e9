package in.signalbridge.infrastructure.gateway.paper;

public enum PaperOrderState {
    OPEN,
    CANCELLED,
    CLOSED
}
