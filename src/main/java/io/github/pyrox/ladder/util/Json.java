package io.github.pyrox.ladder.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Single, centrally-configured Jackson {@link ObjectMapper}.
 *
 * *  Ignores unknown properties so config and routine files may carry extra keys
 * *  Keeps {@code Closeable} targets open so callers own their streams
 *
 * Every DTO in this project is a final record, so no polymorphic type metadata is needed.
 */
public final class Json {
    public static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.CLOSE_CLOSEABLE, false);
    }

    private Json() {}   // no instances
}
