package com.questrail.gateway.adapter.netty;

import com.questrail.gateway.adapter.ConnectionClosedException;
import com.questrail.gateway.adapter.ReceiveTimeoutException;
import com.questrail.gateway.adapter.TransportException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Hand-off between a client channel's event loop and the worker blocked in
 * {@code receive}.
 *
 * <p>Handlers offer complete, already copied payloads. Closing the channel
 * enqueues a marker so a blocked receiver wakes immediately instead of sitting
 * out its deadline; the marker is put back after being seen so later receivers
 * observe the closure too.</p>
 */
final class InboundQueue
{
    private static final byte[] CLOSED = new byte[0];

    private final BlockingQueue<byte[]> payloads = new LinkedBlockingQueue<>();
    private volatile boolean closed;
    private volatile Throwable failure;

    void offer(byte[] payload)
    {
        if (!closed) {
            payloads.offer(payload);
        }
    }

    void markClosed(Throwable cause)
    {
        if (closed) {
            return;
        }
        if (cause != null) {
            failure = cause;
        }
        closed = true;
        payloads.offer(CLOSED);
    }

    /**
     * Drops buffered payloads, leaving the closed marker in place.
     */
    int clear()
    {
        List<byte[]> drained = new ArrayList<>();
        payloads.drainTo(drained);
        int dropped = 0;
        for (byte[] payload : drained) {
            if (payload == CLOSED) {
                payloads.offer(CLOSED);
            } else {
                dropped++;
            }
        }
        return dropped;
    }

    boolean isClosed()
    {
        return closed;
    }

    byte[] take(Duration timeout, String connectionId) throws TransportException
    {
        final byte[] next;
        try {
            next = payloads.poll(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReceiveTimeoutException("Interrupted while receiving on " + connectionId, e);
        }

        if (next == null) {
            throw new ReceiveTimeoutException("No data on " + connectionId + " within " + timeout.toMillis() + "ms");
        }
        if (next == CLOSED) {
            payloads.offer(CLOSED);
            Throwable cause = failure;
            throw cause == null
                    ? new ConnectionClosedException("Connection " + connectionId + " closed")
                    : new ConnectionClosedException("Connection " + connectionId + " failed", cause);
        }
        return next;
    }
}
