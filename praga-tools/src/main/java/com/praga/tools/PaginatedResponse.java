package com.praga.tools;

import com.praga.page.Page;

import java.util.List;

/**
 * One page of tool results plus the cursor for the next one ({@code null} when there is no more).
 */
public record PaginatedResponse<T extends Page>(List<T> results, String nextCursor) {

    public PaginatedResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
