package io.fieldsync.core;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Bytes in, bytes out: the only place that touches producer payloads.
 * <p>
 * Payloads are DEFLATE-compressed before storage and transmission; the record
 * digest is SHA-256 over the uncompressed bytes so it can be checked after
 * decompression on either side of the link.
 */
public final class PayloadCodec {

    private PayloadCodec() {
    }

    public static byte[] compress(byte[] raw) {
        Deflater deflater = new Deflater(Deflater.BEST_SPEED);
        try {
            deflater.setInput(raw);
            deflater.finish();
            var out = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
            byte[] buf = new byte[8192];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    /**
     * Inverse of {@link #compress}. Only the exact bytes {@code compress} produces are
     * accepted, so any change to the stored stream is detectable even when it still inflates.
     *
     * @throws IllegalArgumentException if the bytes are not a complete DEFLATE stream,
     *         carry trailing bytes, or are not the canonical encoding of their content.
     */
    public static byte[] decompress(byte[] compressed) {
        byte[] raw = inflate(compressed);
        if (!Arrays.equals(compress(raw), compressed)) {
            throw new IllegalArgumentException("non-canonical payload encoding");
        }
        return raw;
    }

    private static byte[] inflate(byte[] compressed) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            var out = new ByteArrayOutputStream(Math.max(64, compressed.length * 2));
            byte[] buf = new byte[8192];
            while (!inflater.finished()) {
                int n = inflater.inflate(buf);
                if (n == 0 && !inflater.finished() && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IllegalArgumentException("truncated payload");
                }
                out.write(buf, 0, n);
            }
            if (inflater.getRemaining() > 0) {
                throw new IllegalArgumentException(inflater.getRemaining() + " trailing bytes after payload");
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new IllegalArgumentException("corrupt payload", e);
        } finally {
            inflater.end();
        }
    }

    public static byte[] digest(byte[] raw) {
        return Hashing.sha256(raw);
    }
}
