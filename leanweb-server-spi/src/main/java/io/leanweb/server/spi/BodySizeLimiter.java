package io.leanweb.server.spi;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Bounds how many bytes of a request body the server will buffer.
 *
 * <p>A limit of zero or less, or {@link #UNLIMITED}, disables the check. Without a limit a client
 * that stalls mid-body holds its worker until the transport gives up.
 */
public final class BodySizeLimiter {

    public static final long UNLIMITED = Long.MAX_VALUE;

    private static final int BUFFER_SIZE = 8192;

    private BodySizeLimiter() {}

    /**
     * Wraps a body stream so reading past {@code maxBytes} fails.
     *
     * @return the wrapped stream, the delegate itself when unlimited, or {@code null} for a
     *         {@code null} delegate
     */
    public static InputStream limit(InputStream delegate, long maxBytes) {
        if (delegate == null) return null;
        if (maxBytes <= 0 || maxBytes == UNLIMITED) return delegate;
        return new BoundedInputStream(delegate, maxBytes);
    }

    /**
     * Reads a whole body, honouring the limit. A {@code null} body reads as empty.
     *
     * @throws PayloadTooLargeException if the body is longer than {@code maxBytes}
     */
    public static byte[] readBody(InputStream body, long maxBytes) throws IOException {
        if (body == null) return new byte[0];
        InputStream in = limit(body, maxBytes);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[BUFFER_SIZE];
        int r;
        while ((r = in.read(buf)) >= 0) {
            out.write(buf, 0, r);
        }
        return out.toByteArray();
    }

    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        public PayloadTooLargeException(long maxBytes) {
            super("Request body exceeds " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }
    }

    private static final class BoundedInputStream extends FilterInputStream {
        private final long maxBytes;
        private long consumed;

        BoundedInputStream(InputStream in, long maxBytes) {
            super(in);
            this.maxBytes = maxBytes;
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b >= 0) {
                count(1);
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            // one byte past the limit is enough to detect an oversized body
            int allowed = (int) Math.min(len, maxBytes - consumed + 1);
            int n = super.read(b, off, allowed);
            if (n > 0) {
                count(n);
            }
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(Math.min(n, maxBytes - consumed + 1));
            count(skipped);
            return skipped;
        }

        private void count(long n) throws PayloadTooLargeException {
            consumed += n;
            if (consumed > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
        }
    }
}
