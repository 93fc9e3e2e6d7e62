package com.questrail.gateway.runtime;

import com.questrail.gateway.api.GatewayResult;

import java.time.Duration;

/**
 * One request/reply round trip over a session's current backend connection.
 */
@FunctionalInterface
public interface BackendExchange
{
    GatewayResult<byte[]> exchange(byte[] payload, Duration timeout);
}
