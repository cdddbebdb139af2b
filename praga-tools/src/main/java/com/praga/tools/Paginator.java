package com.praga.tools;

import com.praga.page.Page;
import com.praga.page.PageCodec;

import java.util.ArrayList;
import java.util.List;

/**
 * Cursor pagination over a full result list. The cursor is the decimal offset of the first item;
 * {@code null}, empty and {@code "start"} mean offset 0. A page holds at most {@code maxItems}
 * items and stops before the item that would push the estimated token total past
 * {@code maxTokens}. The first item of a page is always included so every page makes progress.
 */
public final class Paginator {

    public static final String START_CURSOR = "start";

    /** Characters of page JSON counted as one token. */
    static final int CHARS_PER_TOKEN = 4;

    private final int maxItems;
    private final int maxTokens;

    public Paginator(int maxItems, int maxTokens) {
        if (maxItems <= 0 || maxTokens <= 0) {
            throw new IllegalArgumentException("maxItems and maxTokens must be > 0: " + maxItems + ", " + maxTokens);
        }
        this.maxItems = maxItems;
        this.maxTokens = maxTokens;
    }

    public <T extends Page> PaginatedResponse<T> paginate(List<T> all, String cursor) {
        int start = parseCursor(cursor);
        if (start >= all.size()) {
            return new PaginatedResponse<>(List.of(), null);
        }
        int end = Math.min(all.size(), start + maxItems);
        List<T> page = new ArrayList<>();
        int tokens = 0;
        for (int i = start; i < end; i++) {
            T item = all.get(i);
            int itemTokens = estimateTokens(item);
            if (!page.isEmpty() && tokens + itemTokens > maxTokens) {
                break;
            }
            page.add(item);
            tokens += itemTokens;
        }
        int next = start + page.size();
        return new PaginatedResponse<>(page, next < all.size() ? Integer.toString(next) : null);
    }

    /**
     * Offset encoded by a cursor.
     *
     * @throws IllegalArgumentException if the cursor is neither a start marker nor a non-negative integer
     */
    public static int parseCursor(String cursor) {
        if (cursor == null || cursor.isBlank() || START_CURSOR.equals(cursor.trim())) {
            return 0;
        }
        int offset;
        try {
            offset = Integer.parseInt(cursor.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor format: " + cursor, e);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Invalid cursor format: " + cursor);
        }
        return offset;
    }

    /** Estimated tokens of the page's JSON form, rounded up. */
    public static int estimateTokens(Page page) {
        int chars = PageCodec.toJson(page).length();
        return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
