package com.jsrefactor.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes literal values the way JavaScript prints numbers: integral doubles
 * lose their fraction, non-finite values become {@code null}.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Object> {
    // 2^53, the largest double that still maps to an exact long
    private static final double MAX_SAFE = 9007199254740992.0;

    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            writeDouble(d, gen);
        } else if (value instanceof Number n) {
            writeDouble(n.doubleValue(), gen);
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else {
            gen.writeObject(value);
        }
    }

    private static void writeDouble(double d, JsonGenerator gen) throws IOException {
        if (Double.isInfinite(d) || Double.isNaN(d)) {
            gen.writeNull();
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE) {
            gen.writeNumber((long) d);
        } else if (d == Math.floor(d) && Math.abs(d) < 1e21) {
            gen.writeNumber(new BigInteger(String.format("%.0f", d)));
        } else {
            gen.writeNumber(d);
        }
    }
}
