package io.eventstreams.core;

/**
 * Writes every payload as an RFC 7464 record: {@code <RS>payload<LF>}.
 */
public final class JsonSequenceSerializer extends AbstractEventSerializer<byte[]> {

    @Override
    protected byte[] encode(byte[] payload) {
        byte[] out = new byte[payload.length + 2];
        out[0] = Ascii.RS;
        System.arraycopy(payload, 0, out, 1, payload.length);
        out[payload.length + 1] = Ascii.LF;
        return out;
    }
}
