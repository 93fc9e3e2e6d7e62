package com.questrail.gateway.adapter;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * What a listener writes back after the gateway handled one inbound message.
 *
 * <p>A failed reply is rendered per protocol: HTTP and HTTP/2 answer with
 * status 502 and the reason as body; stream and datagram protocols send the
 * reason bytes prefixed with {@link #ERROR_PREFIX}.</p>
 */
public record InboundReply(Status status, byte[] payload)
{
    public static final String ERROR_PREFIX = "ERR ";

    public enum Status
    {
        OK,
        FAILED,
        /** Nothing is written back (fire-and-forget datagrams). */
        NONE
    }

    public InboundReply {
        Objects.requireNonNull(status, "status");
        payload = payload == null ? new byte[0] : payload.clone();
    }

    public static InboundReply ok(byte[] payload)
    {
        return new InboundReply(Status.OK, payload);
    }

    public static InboundReply failed(String reason)
    {
        return new InboundReply(Status.FAILED, reason.getBytes(StandardCharsets.UTF_8));
    }

    public static InboundReply none()
    {
        return new InboundReply(Status.NONE, null);
    }

    @Override
    public byte[] payload()
    {
        return payload.clone();
    }

    /**
     * Bytes to put on a stream or datagram transport.
     */
    public byte[] wirePayload()
    {
        if (status != Status.FAILED) {
            return payload();
        }
        byte[] prefix = ERROR_PREFIX.getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[prefix.length + payload.length];
        System.arraycopy(prefix, 0, out, 0, prefix.length);
        System.arraycopy(payload, 0, out, prefix.length, payload.length);
        return out;
    }
}
