package io.eventstreams.core;

/**
 * Wire-mandated byte constants shared by the framers and serializers.
 */
public final class Ascii {
    private Ascii() {}

    /** Line feed {@code <LF>}. */
    public static final byte LF = 0x0A;

    /** Carriage return {@code <CR>}. */
    public static final byte CR = 0x0D;

    /** Record separator {@code <RS>}, the RFC 7464 record prefix. */
    public static final byte RS = 0x1E;

    public static final byte COLON = 0x3A;
    public static final byte SPACE = 0x20;
}
