package com.praga.tools;

/**
 * What a tool function returns.
 */
public enum ToolReturnKind {

    /** A collection of pages (optionally paginated by the toolkit). */
    PAGE_LIST,

    /** A {@link PaginatedResponse}; the function takes a {@code cursor} argument and paginates itself. */
    PAGINATED
}
