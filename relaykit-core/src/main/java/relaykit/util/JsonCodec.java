package relaykit.util;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON codec for the two shapes relaykit persists: flat string-to-string objects and
 * string arrays.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. Applications
 * that already ship Jackson or Gson can implement this interface and hand it to
 * {@link relaykit.prefs.PreferenceFile}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object. An empty map encodes as {@code {}}.
     *
     * @param values the map to encode, must not contain null keys or values
     * @return JSON object text
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a JSON object of string values. Returns an empty map for {@code null}, blank, or
     * {@code "null"} input.
     *
     * @param json JSON object text
     * @return parsed map in document order (never {@code null})
     * @throws IllegalArgumentException if the input is not a flat object of strings
     */
    Map<String, String> parseObject(String json);

    /**
     * Encodes strings as a JSON array.
     *
     * @param values strings to encode, must not contain nulls
     * @return JSON array text
     */
    String toJsonArray(Collection<String> values);

    /**
     * Parses a JSON array of strings.
     *
     * @param json JSON array text
     * @return parsed strings in document order
     * @throws IllegalArgumentException if the input is not an array of strings
     */
    List<String> parseArray(String json);
}
