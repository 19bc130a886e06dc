package io.jobrelay.supervisor;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Keeps the last {@code capacity} bytes written to stderr.
 */
final class StderrTail {
    private final int capacity;
    private byte[] buf;
    private int len;

    StderrTail(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.buf = new byte[this.capacity * 2];
        this.len = 0;
    }

    void appendLine(String line) {
        byte[] bytes = (line + "\n").getBytes(StandardCharsets.UTF_8);
        if (bytes.length >= capacity) {
            System.arraycopy(bytes, bytes.length - capacity, buf, 0, capacity);
            len = capacity;
            return;
        }
        if (len + bytes.length > buf.length) {
            int keep = capacity - bytes.length;
            System.arraycopy(buf, len - keep, buf, 0, keep);
            len = keep;
        }
        System.arraycopy(bytes, 0, buf, len, bytes.length);
        len += bytes.length;
    }

    String snippet() {
        int from = Math.max(0, len - capacity);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(buf, from, len - from))
                    .toString();
        } catch (CharacterCodingException e) {
            return new String(buf, from, len - from, StandardCharsets.UTF_8);
        }
    }

    boolean isEmpty() {
        return len == 0;
    }
}
