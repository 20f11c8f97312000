package relaykit.prefs;

/**
 * Unchecked exception wrapping I/O errors raised while persisting preferences.
 */
public final class PreferenceStoreException extends RuntimeException {
    public PreferenceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
