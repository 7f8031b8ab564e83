package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * Writes a long as a JSON number when it fits in 53 bits, otherwise as a decimal string,
 * so readers with double-based numbers keep full precision.
 */
public class SafeLongSerializer extends StdSerializer<Long> {

    private static final long serialVersionUID = 1L;

    public static final long MAX_SAFE_INTEGER = 9007199254740991L;

    public SafeLongSerializer() {
        super(Long.class);
    }

    @Override
    public void serialize(Long value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (isSafe(value)) {
            gen.writeNumber(value);
        } else {
            gen.writeString(Long.toString(value));
        }
    }

    public static boolean isSafe(long value) {
        return value <= MAX_SAFE_INTEGER && value >= -MAX_SAFE_INTEGER;
    }
}
