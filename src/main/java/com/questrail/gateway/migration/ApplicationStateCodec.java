package com.questrail.gateway.migration;

import java.io.IOException;
import java.util.Map;

/**
 * Serializes a session's application state for a state-preserving migration.
 *
 * <p>Round-trip law: for a map of JSON-compatible values (strings, numbers,
 * booleans, {@code null}, lists and maps thereof), {@code decode(encode(m))}
 * equals {@code m}.</p>
 */
public interface ApplicationStateCodec
{
    byte[] encode(Map<String, Object> state) throws IOException;

    Map<String, Object> decode(byte[] bytes) throws IOException;
}
