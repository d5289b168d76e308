package turnstile.page;

/**
 * A request window over a collection ordered by descending id.
 *
 * <p>{@code since} and {@code until} are exclusive bounds: {@code since} asks for rows
 * older than the id, {@code until} for rows newer than it. {@code from}, {@code to} and
 * {@code around} are inclusive: {@code from} is the lowest id wanted, {@code to} the
 * highest, and {@code around} centres the window on one id. A page with no bound returns
 * the newest rows. Results are always newest first.
 *
 * @param since  return rows with {@code id < since}
 * @param until  return rows with {@code id > until}
 * @param from   return rows with {@code id >= from}
 * @param to     return rows with {@code id <= to}
 * @param around return rows nearest to {@code around}, including it
 * @param limit  maximum number of rows
 */
public record Page(Long since, Long until, Long from, Long to, Long around, int limit) {

    public Page {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        int exclusive = (since != null ? 1 : 0) + (until != null ? 1 : 0);
        boolean inclusive = from != null || to != null;
        if (exclusive > 1) {
            throw new IllegalArgumentException("since and until are mutually exclusive");
        }
        if (around != null && (exclusive > 0 || inclusive)) {
            throw new IllegalArgumentException("around cannot be combined with other bounds");
        }
        if (exclusive > 0 && inclusive) {
            throw new IllegalArgumentException("since/until cannot be combined with from/to");
        }
        if (from != null && to != null && from > to) {
            throw new IllegalArgumentException("from must be <= to");
        }
    }

    public static Page newest(int limit) {
        return new Page(null, null, null, null, null, limit);
    }

    public static Page since(long id, int limit) {
        return new Page(id, null, null, null, null, limit);
    }

    public static Page until(long id, int limit) {
        return new Page(null, id, null, null, null, limit);
    }

    public static Page from(long id, int limit) {
        return new Page(null, null, id, null, null, limit);
    }

    public static Page to(long id, int limit) {
        return new Page(null, null, null, id, null, limit);
    }

    public static Page range(long from, long to, int limit) {
        return new Page(null, null, from, to, null, limit);
    }

    public static Page around(long id, int limit) {
        return new Page(null, null, null, null, id, limit);
    }

    public boolean isUnbounded() {
        return since == null && until == null && from == null && to == null && around == null;
    }
}
