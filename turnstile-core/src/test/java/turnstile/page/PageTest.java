package turnstile.page;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PageTest {

    @Test
    void factoriesSetOneBound() {
        assertTrue(Page.newest(10).isUnbounded());
        assertEquals(5L, Page.since(5, 10).since());
        assertEquals(5L, Page.until(5, 10).until());
        assertEquals(5L, Page.from(5, 10).from());
        assertEquals(5L, Page.to(5, 10).to());
        assertEquals(5L, Page.around(5, 10).around());

        Page range = Page.range(2, 8, 10);
        assertEquals(2L, range.from());
        assertEquals(8L, range.to());
        assertFalse(range.isUnbounded());
    }

    @Test
    void limitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> Page.newest(0));
        assertThrows(IllegalArgumentException.class, () -> Page.since(1, -1));
    }

    @Test
    void exclusiveBoundsCannotBeCombined() {
        assertThrows(IllegalArgumentException.class, () -> new Page(5L, 1L, null, null, null, 10));
        assertThrows(IllegalArgumentException.class, () -> new Page(5L, null, 1L, null, null, 10));
        assertThrows(IllegalArgumentException.class, () -> new Page(null, 5L, null, 9L, null, 10));
    }

    @Test
    void aroundStandsAlone() {
        assertThrows(IllegalArgumentException.class, () -> new Page(null, null, 1L, null, 5L, 10));
        assertThrows(IllegalArgumentException.class, () -> new Page(3L, null, null, null, 5L, 10));
    }

    @Test
    void rangeMustBeOrdered() {
        assertThrows(IllegalArgumentException.class, () -> Page.range(8, 2, 10));
        assertDoesNotThrow(() -> Page.range(4, 4, 10));
    }
}
