package at.sv.huepanel.server;

import at.sv.huepanel.push.ClientChannel;
import io.javalin.websocket.WsContext;

/**
 * Adapts the context of a Javalin socket to a {@link ClientChannel}. The context captured on connect stays valid
 * for sending until the socket is closed.
 */
final class JavalinClientChannel implements ClientChannel {

    private final WsContext context;
    private volatile boolean open = true;

    JavalinClientChannel(WsContext context) {
        this.context = context;
    }

    @Override
    public String getId() {
        return context.sessionId();
    }

    @Override
    public boolean isOpen() {
        return open && context.session.isOpen();
    }

    @Override
    public void send(String message) {
        context.send(message);
    }

    @Override
    public void close(int code, String reason) {
        open = false;
        context.closeSession(code, reason);
    }

    void markClosed() {
        open = false;
    }
}
