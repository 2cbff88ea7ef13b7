package at.sv.huepanel.push;

/**
 * Owns all client connections: authenticates them, polls the bridge of each authenticated connection and pushes
 * the changes, and tears connections down on close, error, or missing heartbeat.
 */
public interface PushService {

    void onOpen(ClientChannel channel);

    void onMessage(ClientChannel channel, String message);

    /**
     * Called after the client or the transport closed the channel.
     */
    void onClose(ClientChannel channel, int code, String reason);

    void onError(ClientChannel channel, Throwable error);

    PushStats getStats();

    /**
     * Starts the orphan reaper.
     */
    void start();

    /**
     * Stops the reaper and closes all open connections.
     */
    void shutdown();
}
