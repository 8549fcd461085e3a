package com.threatsentinel.server;

import com.threatsentinel.core.broadcast.Observer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * {@link Observer} writing broadcast messages to a server-sent-event stream.
 *
 * <p>
 * Each message becomes one {@code data:} frame. While the stream is open the
 * serving thread parks in {@link #serve(Duration)} and writes a comment frame
 * at every heartbeat, which is how a vanished client is noticed when nothing
 * is being broadcast.
 * </p>
 *
 * @since 1.0.0
 */
final class SseObserver implements Observer, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SseObserver.class);

    private final String id;
    private final OutputStream out;
    private final CountDownLatch closed = new CountDownLatch(1);

    SseObserver(String id, OutputStream out) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.out = Objects.requireNonNull(out, "OutputStream must not be null");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized void send(String message) throws IOException {
        write("data: " + message + "\n\n");
    }

    synchronized void comment(String text) throws IOException {
        write(": " + text + "\n\n");
    }

    private void write(String frame) throws IOException {
        if (isClosed()) {
            throw new IOException("Stream " + id + " is closed");
        }
        try {
            out.write(frame.getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            closed.countDown();
            throw e;
        }
    }

    /**
     * Block the calling thread until the stream breaks, {@link #close()} is
     * called or the thread is interrupted.
     *
     * @param heartbeat interval between keep-alive comments
     */
    void serve(Duration heartbeat) {
        try {
            while (!closed.await(heartbeat.toMillis(), TimeUnit.MILLISECONDS)) {
                try {
                    comment("keep-alive");
                } catch (IOException e) {
                    LOG.debug("Stream {} dropped: {}", id, e.getMessage());
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean isClosed() {
        return closed.getCount() == 0;
    }

    @Override
    public void close() {
        closed.countDown();
        try {
            out.close();
        } catch (IOException e) {
            LOG.debug("Closing stream {} failed: {}", id, e.getMessage());
        }
    }
}
