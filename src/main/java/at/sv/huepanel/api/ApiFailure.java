package at.sv.huepanel.api;

/**
 * Exception to signal a backend error of the bridge API (5xx, 429, an error payload). Or when its response could
 * not be parsed. Poll cycles treat it as transient and retry on the next tick.
 */
public class ApiFailure extends RuntimeException {
    public ApiFailure(String message) {
        super(message);
    }

    public ApiFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
