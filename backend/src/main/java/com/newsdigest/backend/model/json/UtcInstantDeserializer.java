package com.newsdigest.backend.model.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.time.Instant;

/**
 * Lenient reader for the {@code published} field. Unparseable values become {@code null}
 * so one bad record does not invalidate a whole partition.
 */
public class UtcInstantDeserializer extends StdDeserializer<Instant> {

    public UtcInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        return IsoInstants.parse(p.getValueAsString()).orElse(null);
    }
}
