package at.sv.huepanel.push;

public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    POLLING,
    CLOSING,
    CLOSED;

    public boolean isClosed() {
        return this == CLOSING || this == CLOSED;
    }
}
