package turnstile.page;

import java.util.List;
import java.util.Objects;

/**
 * Rows of one page, newest first, with the windows around them.
 */
public record PageResult<T>(List<T> items, Pagination pagination) {

    public PageResult {
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        Objects.requireNonNull(pagination, "pagination");
    }

    public static <T> PageResult<T> empty() {
        return new PageResult<>(List.of(), Pagination.NONE);
    }
}
