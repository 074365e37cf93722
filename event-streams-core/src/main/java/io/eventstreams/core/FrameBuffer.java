package io.eventstreams.core;

import java.util.Arrays;

/**
 * Growable byte buffer holding the bytes received since the last emitted frame.
 *
 * <p>Owned by exactly one decoder. It only grows by {@link #append(byte[])} and only shrinks by
 * removing a prefix; {@link #take(int, int)} copies a payload out and drops it together with its
 * delimiter in one step, so the buffer never retains bytes of a frame that was already handed out.
 */
public final class FrameBuffer {

    private static final int INITIAL_CAPACITY = 256;

    private byte[] bytes;
    private int start;
    private int end;

    public FrameBuffer() {
        this.bytes = new byte[INITIAL_CAPACITY];
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return end == start;
    }

    /**
     * @param index position relative to the first buffered byte
     */
    public byte byteAt(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size());
        }
        return bytes[start + index];
    }

    public void append(byte[] chunk) {
        append(chunk, 0, chunk.length);
    }

    public void append(byte[] chunk, int offset, int length) {
        if (length == 0) return;
        ensureWritable(length);
        System.arraycopy(chunk, offset, bytes, end, length);
        end += length;
    }

    /**
     * @return index of the first occurrence of {@code b}, or -1
     */
    public int indexOf(byte b) {
        return indexOf(b, 0);
    }

    /**
     * @param from relative position to start searching at
     * @return index of the first occurrence of {@code b} at or after {@code from}, or -1
     */
    public int indexOf(byte b, int from) {
        checkFrom(from);
        for (int i = start + from; i < end; i++) {
            if (bytes[i] == b) return i - start;
        }
        return -1;
    }

    /**
     * @return index of the first byte contained in {@code candidates}, or -1
     */
    public int indexOfAny(byte[] candidates) {
        return indexOfAny(candidates, 0);
    }

    /**
     * @param from relative position to start searching at
     * @return index of the first byte contained in {@code candidates} at or after {@code from}, or -1
     */
    public int indexOfAny(byte[] candidates, int from) {
        if (candidates.length == 1) return indexOf(candidates[0], from);
        checkFrom(from);
        for (int i = start + from; i < end; i++) {
            byte b = bytes[i];
            for (byte c : candidates) {
                if (b == c) return i - start;
            }
        }
        return -1;
    }

    /**
     * Copies out the first {@code length} bytes and discards them plus the {@code skip} bytes that follow.
     */
    public byte[] take(int length, int skip) {
        if (length < 0 || skip < 0 || length + skip > size()) {
            throw new IndexOutOfBoundsException("cannot take " + length + "+" + skip + " of " + size());
        }
        byte[] out = Arrays.copyOfRange(bytes, start, start + length);
        discard(length + skip);
        return out;
    }

    public void discard(int count) {
        if (count < 0 || count > size()) {
            throw new IndexOutOfBoundsException("cannot discard " + count + " of " + size());
        }
        start += count;
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    /**
     * Copies out everything that is buffered and leaves the buffer empty.
     */
    public byte[] drain() {
        return take(size(), 0);
    }

    private void checkFrom(int from) {
        if (from < 0 || from > size()) {
            throw new IndexOutOfBoundsException("from " + from + " out of bounds for size " + size());
        }
    }

    private void ensureWritable(int length) {
        if (bytes.length - end >= length) return;
        int size = size();
        // reclaim the consumed prefix when that frees enough room
        if (start > 0 && bytes.length - size >= length) {
            System.arraycopy(bytes, start, bytes, 0, size);
        } else {
            int capacity = Math.max(bytes.length * 2, size + length);
            byte[] grown = new byte[capacity];
            System.arraycopy(bytes, start, grown, 0, size);
            bytes = grown;
        }
        start = 0;
        end = size;
    }
}
