package com.labpulse.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stream client with a bounded outbound queue drained on a writer pool.
 *
 * <p>{@link #send(StreamEvent)} only enqueues and never blocks. When the queue is full, or a previous write
 * failed or timed out, the client closes itself and {@code send} throws, so a slow client never holds up a
 * broadcast.
 *
 * <p>With a watchdog configured, each write has a deadline. A write that exceeds it closes the client and
 * interrupts the writing thread. The transport is never closed while a write is in progress; the writer
 * closes it once the write returns.
 */
public abstract class BufferedStreamClient implements StreamClient {
    private static final Logger log = LoggerFactory.getLogger(BufferedStreamClient.class);

    private final String clientId;
    private final BlockingQueue<StreamEvent> pending;
    private final Executor writerPool;
    private final ScheduledExecutorService watchdog;
    private final long writeTimeoutMs;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean transportClosed = new AtomicBoolean(false);

    // Guards closed, writer and writeSeq.
    private final Object stateLock = new Object();
    private volatile boolean closed;
    private Thread writer;
    private long writeSeq;

    protected BufferedStreamClient(String clientId, int maxPendingEvents, Executor writerPool) {
        this(clientId, maxPendingEvents, writerPool, null, 0);
    }

    /**
     * @param clientId client id
     * @param maxPendingEvents queue capacity
     * @param writerPool pool running the writes
     * @param watchdog scheduler enforcing the write deadline; null disables it
     * @param writeTimeoutMs write deadline; non-positive disables it
     */
    protected BufferedStreamClient(String clientId, int maxPendingEvents, Executor writerPool,
                                   ScheduledExecutorService watchdog, long writeTimeoutMs) {
        if (maxPendingEvents <= 0) {
            throw new IllegalArgumentException("maxPendingEvents must be positive");
        }
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.pending = new ArrayBlockingQueue<>(maxPendingEvents);
        this.writerPool = Objects.requireNonNull(writerPool, "writerPool");
        this.watchdog = writeTimeoutMs > 0 ? watchdog : null;
        this.writeTimeoutMs = writeTimeoutMs;
    }

    @Override
    public String getClientId() {
        return clientId;
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        if (closed) {
            throw new IOException("Stream client closed: " + clientId);
        }
        if (!pending.offer(event)) {
            log.warn("Stream client buffer full, disconnecting: client_id={}, capacity={}", clientId, pending.size());
            close();
            throw new IOException("Stream client buffer overflow: " + clientId);
        }
        scheduleDrain();
    }

    @Override
    public void close() {
        boolean writeInProgress;
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
            writeInProgress = writer != null;
        }
        pending.clear();
        if (!writeInProgress) {
            closeTransportOnce();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Write one event to the transport. Called from the writer pool, never concurrently for one client.
     *
     * @param event event
     * @throws IOException if the write fails
     */
    protected abstract void write(StreamEvent event) throws IOException;

    protected abstract void closeTransport();

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            writerPool.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("Stream writer pool rejected drain, disconnecting: client_id={}", clientId);
            close();
        }
    }

    private void drain() {
        try {
            StreamEvent event;
            while ((event = pending.poll()) != null) {
                if (!writeWithDeadline(event)) {
                    break;
                }
            }
        } catch (Exception e) {
            log.debug("Stream write failed, disconnecting: client_id={}, reason={}", clientId, e.getMessage());
            close();
        } finally {
            draining.set(false);
        }
        if (closed) {
            closeTransportOnce();
            return;
        }
        // An event offered between the last poll and the flag reset would otherwise sit until the next send.
        if (!pending.isEmpty()) {
            scheduleDrain();
        }
    }

    /**
     * @return false if the client was closed before the write could start
     */
    private boolean writeWithDeadline(StreamEvent event) throws IOException {
        long seq;
        synchronized (stateLock) {
            if (closed) {
                return false;
            }
            writer = Thread.currentThread();
            seq = ++writeSeq;
        }

        ScheduledFuture<?> deadline = null;
        if (watchdog != null) {
            try {
                deadline = watchdog.schedule(() -> abortStalledWrite(seq), writeTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Stream write watchdog unavailable: client_id={}", clientId);
            }
        }

        try {
            write(event);
            return true;
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
            boolean timedOut;
            synchronized (stateLock) {
                writer = null;
                timedOut = closed;
            }
            if (timedOut) {
                // Clear an interrupt aimed at this write before the thread goes back to the pool.
                Thread.interrupted();
            }
        }
    }

    private void abortStalledWrite(long seq) {
        synchronized (stateLock) {
            if (writer == null || writeSeq != seq) {
                return;
            }
            log.warn("Stream write timed out, disconnecting: client_id={}, timeout_ms={}", clientId, writeTimeoutMs);
            closed = true;
            writer.interrupt();
        }
        pending.clear();
    }

    private void closeTransportOnce() {
        if (!transportClosed.compareAndSet(false, true)) {
            return;
        }
        try {
            closeTransport();
        } catch (Exception e) {
            log.debug("Failed to close stream transport: client_id={}", clientId, e);
        }
    }
}
