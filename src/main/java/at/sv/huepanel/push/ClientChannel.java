package at.sv.huepanel.push;

/**
 * The server side of a single client socket, independent of the web server in use.
 */
public interface ClientChannel {
    /**
     * @return an id that is unique among all currently open channels
     */
    String getId();

    boolean isOpen();

    /**
     * Sends a text frame. Callers serialize sends per channel.
     */
    void send(String message);

    void close(int code, String reason);
}
