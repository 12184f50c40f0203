package com.github.anirbanmu.tether.gateway;

import com.github.anirbanmu.tether.gateway.json.GatewayFrame;
import com.github.anirbanmu.tether.util.Json;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

// turns websocket messages into gateway frames. binary messages are pieces of one
// zlib stream spanning the whole connection; a message is complete once the buffered
// bytes end in the sync-flush suffix 00 00 ff ff. one codec per connection.
public final class FrameCodec implements AutoCloseable {
    private static final byte[] ZLIB_SUFFIX = {0x00, 0x00, (byte) 0xff, (byte) 0xff};

    private final Inflater inflater = new Inflater();
    private final ByteArrayOutputStream inflated = new ByteArrayOutputStream(8192);
    private final byte[] chunk = new byte[8192];
    private byte[] buffer = new byte[4096];
    private int buffered;

    public Optional<GatewayFrame> feed(byte[] data) {
        append(data);
        if (!endsWithSuffix()) {
            return Optional.empty();
        }

        byte[] json;
        try {
            json = inflate();
        } finally {
            buffered = 0;
        }
        return Optional.of(decode(json));
    }

    public Optional<GatewayFrame> feed(String text) {
        return Optional.of(decode(text.getBytes(StandardCharsets.UTF_8)));
    }

    public int bufferedBytes() {
        return buffered;
    }

    @Override
    public void close() {
        inflater.end();
    }

    private void append(byte[] data) {
        if (buffered + data.length > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, buffered + data.length));
        }
        System.arraycopy(data, 0, buffer, buffered, data.length);
        buffered += data.length;
    }

    private boolean endsWithSuffix() {
        if (buffered < ZLIB_SUFFIX.length) {
            return false;
        }
        for (int i = 0; i < ZLIB_SUFFIX.length; i++) {
            if (buffer[buffered - ZLIB_SUFFIX.length + i] != ZLIB_SUFFIX[i]) {
                return false;
            }
        }
        return true;
    }

    private byte[] inflate() {
        inflater.setInput(buffer, 0, buffered);
        inflated.reset();
        try {
            while (true) {
                int n = inflater.inflate(chunk);
                if (n > 0) {
                    inflated.write(chunk, 0, n);
                    continue;
                }
                if (inflater.needsDictionary()) {
                    throw new FrameDecodeException("zlib stream requires a preset dictionary");
                }
                break;
            }
        } catch (DataFormatException e) {
            throw new FrameDecodeException("Corrupt zlib stream", e);
        }
        return inflated.toByteArray();
    }

    private static GatewayFrame decode(byte[] json) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(json));
        } catch (CharacterCodingException e) {
            throw new FrameDecodeException("Gateway payload is not valid UTF-8", e);
        }

        Map<String, Object> object;
        try {
            object = Json.parseObject(json);
        } catch (IOException e) {
            throw new FrameDecodeException("Gateway payload is not a JSON object", e);
        }

        try {
            return GatewayFrame.fromJson(object);
        } catch (IllegalArgumentException e) {
            throw new FrameDecodeException(e.getMessage(), e);
        }
    }
}
