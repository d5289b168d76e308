package turnstile;

/**
 * Unchecked exception for failures of the backing database.
 *
 * <p>Wraps the underlying {@link java.sql.SQLException} unchanged as the cause, so callers
 * can inspect the SQL state of the original error.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
