package com.questrail.gateway.adapter.netty;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

/**
 * Length-prefix framing shared by the TCP adapter and listener:
 * {@code [int32 length, big-endian][payload]}. The decoder strips the prefix
 * so handlers see the bare payload.
 */
final class TcpFraming
{
    static final int LENGTH_FIELD_BYTES = 4;

    private TcpFraming()
    {
    }

    static void install(ChannelPipeline pipeline, int maxFrameLength)
    {
        pipeline.addLast("frame-decoder", new LengthFieldBasedFrameDecoder(
                maxFrameLength + LENGTH_FIELD_BYTES,
                0,
                LENGTH_FIELD_BYTES,
                0,
                LENGTH_FIELD_BYTES));
        pipeline.addLast("frame-encoder", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
    }
}
