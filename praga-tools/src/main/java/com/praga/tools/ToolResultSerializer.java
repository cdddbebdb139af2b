package com.praga.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.praga.page.Page;
import com.praga.page.PageCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the maps tool invocations return: {@code {results: [...]}} for plain lists,
 * {@code {results: [...], next_cursor: ...}} for paginated ones, and the structured not-found
 * response. Pages become attribute maps with addresses as canonical strings.
 */
public final class ToolResultSerializer {

    public static final String RESULTS = "results";
    public static final String NEXT_CURSOR = "next_cursor";
    public static final String RESPONSE_CODE = "response_code";
    public static final String REFERENCES = "references";
    public static final String ERROR_MESSAGE = "error_message";
    public static final String NO_DOCUMENTS_FOUND = "error_no_documents_found";

    private ToolResultSerializer() {
    }

    public static Map<String, Object> results(List<? extends Page> pages) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(RESULTS, attributes(pages));
        return out;
    }

    public static Map<String, Object> paginated(PaginatedResponse<?> response) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(RESULTS, attributes(response.results()));
        out.put(NEXT_CURSOR, response.nextCursor());
        return out;
    }

    public static Map<String, Object> noDocumentsFound(String message) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(RESPONSE_CODE, NO_DOCUMENTS_FOUND);
        out.put(REFERENCES, List.of());
        out.put(ERROR_MESSAGE, message != null ? message : NoMatchingDocumentsException.DEFAULT_MESSAGE);
        return out;
    }

    /** JSON text of an invocation result, for transports that send strings. */
    public static String toJson(Map<String, Object> response) {
        try {
            return PageCodec.mapper().writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool response is not serializable: " + e.getMessage(), e);
        }
    }

    private static List<Map<String, Object>> attributes(List<? extends Page> pages) {
        List<Map<String, Object>> out = new ArrayList<>(pages.size());
        for (Page p : pages) {
            out.add(PageCodec.toAttributes(p));
        }
        return out;
    }
}
