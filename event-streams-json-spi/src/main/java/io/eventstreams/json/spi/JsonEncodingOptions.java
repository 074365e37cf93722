package io.eventstreams.json.spi;

/**
 * Output policy for JSON encoders.
 *
 * <p>Passed explicitly to each codec; there is no process-wide default that can be mutated.
 *
 * @param sortedKeys write object keys in lexicographic order
 * @param escapeForwardSlashes write {@code /} as {@code \/}
 */
public record JsonEncodingOptions(boolean sortedKeys, boolean escapeForwardSlashes) {

    private static final JsonEncodingOptions DEFAULTS = new JsonEncodingOptions(true, false);

    /**
     * Sorted keys, forward slashes written as-is.
     */
    public static JsonEncodingOptions defaults() {
        return DEFAULTS;
    }

    public JsonEncodingOptions withSortedKeys(boolean sortedKeys) {
        return new JsonEncodingOptions(sortedKeys, escapeForwardSlashes);
    }

    public JsonEncodingOptions withEscapeForwardSlashes(boolean escapeForwardSlashes) {
        return new JsonEncodingOptions(sortedKeys, escapeForwardSlashes);
    }
}
