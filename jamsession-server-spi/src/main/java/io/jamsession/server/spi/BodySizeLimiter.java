package io.jamsession.server.spi;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads request bodies under a byte cap. Exceeding it maps to 413 Payload Too Large.
 */
public final class BodySizeLimiter {

    private static final int CHUNK = 8192;

    private BodySizeLimiter() {}

    /**
     * Read the whole stream, failing as soon as more than {@code maxBytes} arrive.
     *
     * @param in body stream; null reads as empty
     * @param maxBytes cap; {@code <= 0} disables it
     */
    public static byte[] readAll(InputStream in, long maxBytes) throws IOException {
        if (in == null) return new byte[0];
        boolean unlimited = maxBytes <= 0 || maxBytes == Long.MAX_VALUE;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[CHUNK];
        long total = 0;
        while (true) {
            int want = unlimited ? CHUNK : (int) Math.min(CHUNK, maxBytes - total + 1);
            int n = in.read(buf, 0, want);
            if (n < 0) break;
            total += n;
            if (!unlimited && total > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    /**
     * Thrown when a body exceeds the configured limit.
     */
    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        public PayloadTooLargeException(long maxBytes) {
            super("Payload exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }
    }
}
