package at.sv.huepanel.api;

/**
 * Exception to signal that the bridge could not be reached (IO error, timeout). Poll cycles retry on the next tick.
 */
public final class BridgeConnectionFailure extends RuntimeException {

    public BridgeConnectionFailure(String message) {
        super(message);
    }

    public BridgeConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
