package at.sv.huepanel.push;

/**
 * Socket close codes sent to clients. The 4xxx range is application defined.
 */
public final class CloseCodes {

    public static final int GOING_AWAY = 1001;
    public static final int INTERNAL_ERROR = 1011;
    public static final int AUTHENTICATION_FAILED = 4001;
    public static final int AUTHENTICATION_TIMEOUT = 4002;
    public static final int HEARTBEAT_TIMEOUT = 4003;

    private CloseCodes() {
    }
}
