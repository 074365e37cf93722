package io.eventstreams.core;

/**
 * Writes every payload followed by LF.
 */
public final class LinesSerializer extends AbstractEventSerializer<byte[]> {

    @Override
    protected byte[] encode(byte[] payload) {
        byte[] out = new byte[payload.length + 1];
        System.arraycopy(payload, 0, out, 0, payload.length);
        out[payload.length] = Ascii.LF;
        return out;
    }
}
