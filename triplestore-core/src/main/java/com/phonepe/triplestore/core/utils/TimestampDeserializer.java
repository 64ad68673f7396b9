package com.phonepe.triplestore.core.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Reads JSON timestamps with {@link Timestamps#parse(String)}, so JSON accepts the same formats as the builder API:
 * offset date-times, local date-times and bare dates (the latter two read as UTC).
 */
public class TimestampDeserializer extends StdScalarDeserializer<Instant> {

    public TimestampDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        return Timestamps.parse(p.getValueAsString());
    }
}
