package com.questrail.gateway.migration;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON {@link ApplicationStateCodec} backed by Jackson.
 *
 * <p>Key order is preserved. Integral numbers decode as the narrowest of
 * {@code Integer}, {@code Long} or {@code BigInteger} that fits, so integral
 * values written as {@code int} or {@code long} compare equal after the
 * round trip.</p>
 */
public final class JacksonApplicationStateCodec implements ApplicationStateCodec
{
    private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public JacksonApplicationStateCodec()
    {
        this(new ObjectMapper());
    }

    public JacksonApplicationStateCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(Map<String, Object> state) throws IOException
    {
        Objects.requireNonNull(state, "state");
        return mapper.writeValueAsBytes(state);
    }

    @Override
    public Map<String, Object> decode(byte[] bytes) throws IOException
    {
        Objects.requireNonNull(bytes, "bytes");
        Map<String, Object> decoded = mapper.readValue(bytes, STATE_TYPE);
        return decoded == null ? new LinkedHashMap<>() : decoded;
    }
}
