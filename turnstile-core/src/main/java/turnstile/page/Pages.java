package turnstile.page;

import java.util.List;
import java.util.Objects;
import java.util.function.ToLongFunction;

/**
 * Computes previous/next windows for keyset pagination.
 */
public final class Pages {

    private Pages() {
    }

    /**
     * Wraps rows already selected for a page.
     *
     * <p>{@code previous} points just above the first row when the collection holds a
     * larger id; {@code next} points just below the last row when it holds a smaller one.
     *
     * @param rows  the page's rows, newest first
     * @param idOf  extracts the ordering id of a row
     * @param minId smallest id in the whole (filtered) collection
     * @param maxId largest id in the whole (filtered) collection
     * @param limit page size carried into the returned windows
     */
    public static <T> PageResult<T> paginate(List<T> rows, ToLongFunction<T> idOf, long minId, long maxId, int limit) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(idOf, "idOf");
        if (rows.isEmpty()) {
            return PageResult.empty();
        }
        long first = idOf.applyAsLong(rows.get(0));
        long last = idOf.applyAsLong(rows.get(rows.size() - 1));
        Page previous = maxId > first ? Page.until(first, limit) : null;
        Page next = minId < last ? Page.since(last, limit) : null;
        return new PageResult<>(rows, new Pagination(previous, next));
    }
}
