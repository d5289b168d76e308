package turnstile.page;

import java.util.Optional;

/**
 * Windows for continuing a traversal from a returned page.
 *
 * @param previous the page of newer rows, or {@code null} at the newest end
 * @param next     the page of older rows, or {@code null} at the oldest end
 */
public record Pagination(Page previous, Page next) {

    public static final Pagination NONE = new Pagination(null, null);

    public Optional<Page> previousPage() {
        return Optional.ofNullable(previous);
    }

    public Optional<Page> nextPage() {
        return Optional.ofNullable(next);
    }
}
