package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;

/**
 * Reads a long written either as a JSON number or as a decimal string.
 */
public class SafeLongDeserializer extends StdDeserializer<Long> {

    private static final long serialVersionUID = 1L;

    public SafeLongDeserializer() {
        super(Long.class);
    }

    @Override
    public Long deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return p.getLongValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText().trim();
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw InvalidFormatException.from(p, "Not a 64-bit integer: " + text, text, Long.class);
            }
        }
        return (Long) ctxt.handleUnexpectedToken(Long.class, p);
    }
}
