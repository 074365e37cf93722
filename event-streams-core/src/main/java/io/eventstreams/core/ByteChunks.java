package io.eventstreams.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Sources and sinks of byte chunks for attaching event streams to HTTP bodies.
 */
public final class ByteChunks {
    private ByteChunks() {}

    public static final int DEFAULT_CHUNK_SIZE = 8192;

    /**
     * A source handing out the given chunks in order. Zero-length chunks are delivered as-is.
     */
    public static EventReader<byte[]> of(byte[]... chunks) {
        List<byte[]> copies = new ArrayList<>(chunks.length);
        for (byte[] chunk : chunks) copies.add(chunk.clone());
        return EventReader.of(copies);
    }

    /**
     * A source delivering the UTF-8 bytes of {@code text} as one chunk.
     */
    public static EventReader<byte[]> ofUtf8(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * A source delivering {@code data} in chunks of at most {@code chunkSize} bytes.
     */
    public static EventReader<byte[]> split(byte[] data, int chunkSize) {
        Objects.requireNonNull(data, "data");
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        List<byte[]> chunks = new ArrayList<>();
        for (int i = 0; i < data.length; i += chunkSize) {
            chunks.add(Arrays.copyOfRange(data, i, Math.min(data.length, i + chunkSize)));
        }
        return EventReader.of(chunks);
    }

    public static EventReader<byte[]> oneBytePerChunk(byte[] data) {
        return split(data, 1);
    }

    public static EventReader<byte[]> fromInputStream(InputStream in) {
        return fromInputStream(in, DEFAULT_CHUNK_SIZE);
    }

    /**
     * A source reading {@code in} in chunks of up to {@code chunkSize} bytes. Closing the source
     * closes the stream.
     */
    public static EventReader<byte[]> fromInputStream(InputStream in, int chunkSize) {
        Objects.requireNonNull(in, "in");
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        return new EventReader<>() {
            private final byte[] buf = new byte[chunkSize];
            private boolean eof;

            @Override
            public byte[] next() throws IOException {
                if (eof) return null;
                int r = in.read(buf);
                if (r < 0) {
                    eof = true;
                    return null;
                }
                return Arrays.copyOf(buf, r);
            }

            @Override
            public void close() throws IOException {
                eof = true;
                in.close();
            }
        };
    }

    /**
     * Exposes a reader of chunks as an {@link InputStream}, e.g. for a request body publisher.
     */
    public static InputStream toInputStream(EventReader<byte[]> chunks) {
        return new ChunkInputStream(Objects.requireNonNull(chunks, "chunks"));
    }

    /**
     * Copies every chunk to {@code out}, flushing after each one so events leave promptly.
     *
     * @return the number of bytes written
     */
    public static long writeTo(EventReader<byte[]> chunks, OutputStream out) throws IOException {
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(out, "out");
        long total = 0;
        byte[] chunk;
        while ((chunk = chunks.next()) != null) {
            out.write(chunk);
            out.flush();
            total += chunk.length;
        }
        return total;
    }

    /**
     * Concatenates all remaining chunks.
     */
    public static byte[] readAllBytes(EventReader<byte[]> chunks) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeTo(chunks, out);
        return out.toByteArray();
    }

    private static final class ChunkInputStream extends InputStream {
        private final EventReader<byte[]> chunks;
        private byte[] current = new byte[0];
        private int pos;
        private boolean eof;

        ChunkInputStream(EventReader<byte[]> chunks) {
            this.chunks = chunks;
        }

        @Override
        public int read() throws IOException {
            if (!fill()) return -1;
            return current[pos++] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0) return 0;
            if (!fill()) return -1;
            int n = Math.min(len, current.length - pos);
            System.arraycopy(current, pos, b, off, n);
            pos += n;
            return n;
        }

        private boolean fill() throws IOException {
            while (pos >= current.length) {
                if (eof) return false;
                byte[] next = chunks.next();
                if (next == null) {
                    eof = true;
                    return false;
                }
                current = next;
                pos = 0;
            }
            return true;
        }

        @Override
        public void close() throws IOException {
            eof = true;
            chunks.close();
        }
    }
}
