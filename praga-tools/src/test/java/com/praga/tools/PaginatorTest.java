package com.praga.tools;

import com.praga.page.PageCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PaginatorTest {

    @Test
    void paginate_walksAllItemsWithOffsetCursors() {
        Paginator paginator = new Paginator(3, 100_000);
        List<SnippetPage> all = SnippetPage.numbered(10);

        List<String> cursors = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        String cursor = null;
        do {
            PaginatedResponse<SnippetPage> page = paginator.paginate(all, cursor);
            sizes.add(page.results().size());
            cursor = page.nextCursor();
            cursors.add(cursor);
        } while (cursor != null);

        assertEquals(List.of(3, 3, 3, 1), sizes);
        assertEquals(Arrays.asList("3", "6", "9", null), cursors);
    }

    @Test
    void paginate_tokenBudgetStopsEarlyButKeepsFirstItem() {
        List<SnippetPage> all = List.of(
                SnippetPage.of("a", "x".repeat(400)),
                SnippetPage.of("b", "y".repeat(400)),
                SnippetPage.of("c", "z"));
        int firstTokens = Paginator.estimateTokens(all.get(0));

        PaginatedResponse<SnippetPage> tight = new Paginator(10, 1).paginate(all, null);
        assertEquals(1, tight.results().size());
        assertEquals("1", tight.nextCursor());

        PaginatedResponse<SnippetPage> roomy = new Paginator(10, firstTokens + 5).paginate(all, null);
        assertEquals(1, roomy.results().size());

        PaginatedResponse<SnippetPage> all3 = new Paginator(10, 10_000).paginate(all, null);
        assertEquals(3, all3.results().size());
        assertNull(all3.nextCursor());
    }

    @Test
    void paginate_cursorPastEndGivesEmptyPage() {
        PaginatedResponse<SnippetPage> page = new Paginator(3, 1000).paginate(SnippetPage.numbered(2), "5");

        assertTrue(page.results().isEmpty());
        assertNull(page.nextCursor());
    }

    @Test
    void parseCursor_acceptsStartMarkersAndOffsets() {
        assertEquals(0, Paginator.parseCursor(null));
        assertEquals(0, Paginator.parseCursor(""));
        assertEquals(0, Paginator.parseCursor("start"));
        assertEquals(12, Paginator.parseCursor("12"));
    }

    @Test
    void parseCursor_rejectsGarbageAndNegatives() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Paginator.parseCursor("abc"));
        assertTrue(e.getMessage().startsWith("Invalid cursor format"));
        assertThrows(IllegalArgumentException.class, () -> Paginator.parseCursor("-3"));
    }

    @Test
    void estimateTokens_roundsUpQuarterOfJsonLength() {
        SnippetPage page = SnippetPage.of("a", "");
        int chars = PageCodec.toJson(page).length();

        assertEquals((chars + 3) / 4, Paginator.estimateTokens(page));
    }
}
