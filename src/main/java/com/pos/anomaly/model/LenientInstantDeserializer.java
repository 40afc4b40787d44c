package com.pos.anomaly.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Reads an ISO-8601 instant (or epoch millis) and maps anything unparseable to null,
 * so a single bad timestamp rejects its own row instead of the whole request body.
 */
public class LenientInstantDeserializer extends StdDeserializer<Instant> {

    private static final Logger log = LoggerFactory.getLogger(LenientInstantDeserializer.class);

    public LenientInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.VALUE_NUMBER_INT) {
            return Instant.ofEpochMilli(p.getLongValue());
        }
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            log.warn("Unreadable timestamp token {} in field {}", p.currentToken(), p.currentName());
            p.skipChildren();
            return null;
        }

        String text = p.getText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException notOffset) {
                log.warn("Unparseable timestamp '{}' in field {}: {}", text, p.currentName(), notOffset.getMessage());
                return null;
            }
        }
    }
}
