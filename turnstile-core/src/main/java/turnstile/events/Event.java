package turnstile.events;

/**
 * A structured build event before it is serialized into the log.
 *
 * <p>Implementations are plain data (usually records) serialized by an {@link EventCodec}.
 * The type tag selects the class when decoding; the version is stored alongside so
 * readers can tell payload generations apart.
 */
public interface Event {

    /**
     * Type tag stored in the {@code type} column, e.g. {@code "status"}.
     */
    String type();

    /**
     * Payload schema version stored in the {@code version} column.
     */
    String version();
}
