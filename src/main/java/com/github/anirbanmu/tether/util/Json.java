package com.github.anirbanmu.tether.util;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.JsonReader;
import com.dslplatform.json.ObjectConverter;
import com.dslplatform.json.runtime.Settings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class Json {
    public static final DslJson<Object> DSL = new DslJson<>(Settings.withRuntime().includeServiceLoader());

    private Json() {
    }

    public static byte[] toBytes(Object value) {
        try {
            ByteArrayOutputStream os = new ByteArrayOutputStream();
            DSL.serialize(value, os);
            return os.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static String toText(Object value) {
        return new String(toBytes(value), StandardCharsets.UTF_8);
    }

    // untyped parse: objects become maps, arrays lists, numbers Long/Double
    public static Object parse(byte[] bytes) throws IOException {
        JsonReader<Object> reader = DSL.newReader(bytes);
        reader.getNextToken();
        return ObjectConverter.deserializeObject(reader);
    }

    public static Map<String, Object> parseObject(byte[] bytes) throws IOException {
        Object value = parse(bytes);
        if (!(value instanceof Map)) {
            throw new IOException("Expected a JSON object");
        }
        return asObject(value);
    }

    // a parsed json object as a map, an empty map for anything else
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    public static <T> T parse(Class<T> type, byte[] bytes) throws IOException {
        T value = DSL.deserialize(type, bytes, bytes.length);
        if (value == null) {
            throw new IOException("Empty JSON document for " + type.getSimpleName());
        }
        return value;
    }
}
