package at.sv.huepanel.push;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class TestClientChannel implements ClientChannel {

    private final String id;
    private final List<String> sent = new ArrayList<>();
    private volatile boolean open = true;
    private Integer closeCode;
    private String closeReason;
    private int closeCount;
    private volatile CountDownLatch sendGate;
    private final CountDownLatch sendBlocked = new CountDownLatch(1);

    TestClientChannel(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Blocks outside of the channel's monitor while sends are blocked, like a socket write to a client that stopped
     * reading.
     */
    @Override
    public void send(String message) {
        CountDownLatch gate = sendGate;
        if (gate != null) {
            sendBlocked.countDown();
            awaitQuietly(gate);
        }
        synchronized (this) {
            if (!open) {
                throw new IllegalStateException("Channel " + id + " is closed");
            }
            sent.add(message);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Send was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    void blockSends() {
        sendGate = new CountDownLatch(1);
    }

    boolean awaitBlockedSend() throws InterruptedException {
        return sendBlocked.await(5, TimeUnit.SECONDS);
    }

    void releaseSends() {
        CountDownLatch gate = sendGate;
        sendGate = null;
        if (gate != null) {
            gate.countDown();
        }
    }

    @Override
    public synchronized void close(int code, String reason) {
        open = false;
        closeCode = code;
        closeReason = reason;
        closeCount++;
    }

    /**
     * Simulates a transport that went away without a close callback.
     */
    void drop() {
        open = false;
    }

    synchronized List<String> getSent() {
        return new ArrayList<>(sent);
    }

    synchronized Integer getCloseCode() {
        return closeCode;
    }

    synchronized String getCloseReason() {
        return closeReason;
    }

    synchronized int getCloseCount() {
        return closeCount;
    }
}
