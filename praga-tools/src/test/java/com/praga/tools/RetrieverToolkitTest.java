package com.praga.tools;

import com.praga.annotations.RetrieverTool;
import com.praga.annotations.ToolParam;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetrieverToolkitTest {

    static class NotesToolkit extends RetrieverToolkit {

        final AtomicInteger searches = new AtomicInteger();
        final AtomicInteger tops = new AtomicInteger();

        NotesToolkit() {
            super("notes");
        }

        @RetrieverTool(description = "Full-text note search", cache = true, paginate = true, maxItems = 2)
        public List<SnippetPage> search(@ToolParam("query") String query) {
            searches.incrementAndGet();
            return List.of(SnippetPage.of("a", query), SnippetPage.of("b", query), SnippetPage.of("c", query));
        }

        @RetrieverTool(name = "recent")
        public static List<SnippetPage> latestNotes(@ToolParam("limit") int limit) {
            return SnippetPage.numbered(limit);
        }

        @RetrieverTool
        public PaginatedResponse<SnippetPage> browse(@ToolParam("folder") String folder,
                                                     @ToolParam("cursor") String cursor) {
            int start = Paginator.parseCursor(cursor);
            List<SnippetPage> all = SnippetPage.numbered(4);
            int end = Math.min(start + 2, all.size());
            return new PaginatedResponse<>(all.subList(start, end), end < all.size() ? Integer.toString(end) : null);
        }

        @RetrieverTool
        public CompletableFuture<List<SnippetPage>> remote(@ToolParam("query") String query) {
            return CompletableFuture.supplyAsync(() -> List.of(SnippetPage.of("remote", query)));
        }

        @RetrieverTool(cache = true)
        public List<SnippetPage> top(@ToolParam("query") String query, @ToolParam("limit") int limit) {
            tops.incrementAndGet();
            return SnippetPage.numbered(limit);
        }

        @RetrieverTool(cache = true, invalidator = RejectAll.class)
        public List<SnippetPage> volatileLookup(@ToolParam("query") String query) {
            searches.incrementAndGet();
            return List.of(SnippetPage.of("v", query));
        }

        public List<SnippetPage> notATool(String query) {
            return List.of();
        }
    }

    public static final class RejectAll implements ToolCacheInvalidator {
        @Override
        public boolean isValid(String cacheKey, Object cachedValue) {
            return false;
        }
    }

    static class EmptyToolkit extends RetrieverToolkit {
    }

    static class StringReturningToolkit extends RetrieverToolkit {
        @RetrieverTool
        public String describe(@ToolParam("query") String query) {
            return query;
        }
    }

    static class RawListToolkit extends RetrieverToolkit {
        @SuppressWarnings("rawtypes")
        @RetrieverTool
        public List search(@ToolParam("query") String query) {
            return List.of();
        }
    }

    static class DoublePaginatedToolkit extends RetrieverToolkit {
        @RetrieverTool(paginate = true)
        public PaginatedResponse<SnippetPage> browse(@ToolParam("cursor") String cursor) {
            return new PaginatedResponse<>(List.of(), null);
        }
    }

    static class CursorlessToolkit extends RetrieverToolkit {
        @RetrieverTool
        public PaginatedResponse<SnippetPage> browse(@ToolParam("folder") String folder) {
            return new PaginatedResponse<>(List.of(), null);
        }
    }

    static class BadInvalidatorToolkit extends RetrieverToolkit {
        @RetrieverTool(cache = true, invalidator = String.class)
        public List<SnippetPage> search(@ToolParam("query") String query) {
            return List.of();
        }
    }

    @Test
    void constructor_registersAnnotatedMethods() {
        NotesToolkit toolkit = new NotesToolkit();

        assertEquals("notes", toolkit.getName());
        assertEquals(List.of("browse", "recent", "remote", "search", "top", "volatileLookup"),
                toolkit.getTools().stream().map(Tool::getName).toList());
        assertFalse(toolkit.hasTool("notATool"));
        assertFalse(toolkit.hasTool("latestNotes"));
        assertEquals("Full-text note search", toolkit.getTool("search").getDescription());
    }

    @Test
    void constructor_defaultsNameToClassName() {
        assertEquals("RetrieverToolkit", new RetrieverToolkit().getName());
        assertEquals("EmptyToolkit", new EmptyToolkit().getName());
    }

    @Test
    void annotatedSearch_isCachedAndPaginated() {
        NotesToolkit toolkit = new NotesToolkit();

        Map<String, Object> first = toolkit.invokeTool("search", "jvm");
        Map<String, Object> second = toolkit.invokeTool("search", Map.of("query", "jvm", "cursor", first.get("next_cursor")));

        assertEquals(2, ((List<?>) first.get("results")).size());
        assertEquals("2", first.get("next_cursor"));
        assertEquals(1, ((List<?>) second.get("results")).size());
        assertNull(second.get("next_cursor"));
        assertEquals(1, toolkit.searches.get());
    }

    @Test
    void staticTool_convertsArguments() {
        NotesToolkit toolkit = new NotesToolkit();

        Object result = toolkit.call("recent", Map.of("limit", "3"));

        assertEquals(3, ((List<?>) result).size());
    }

    @Test
    void cachedTool_convertedArgumentsShareCacheEntry() {
        NotesToolkit toolkit = new NotesToolkit();

        Object direct = toolkit.call("top", Map.of("query", "x", "limit", 2));
        Map<String, Object> invoked = toolkit.invokeTool("top", Map.of("query", "x", "limit", "2"));

        assertEquals(2, ((List<?>) direct).size());
        assertEquals(2, ((List<?>) invoked.get("results")).size());
        assertEquals(1, toolkit.tops.get());
    }

    @Test
    void invokeTool_passesResultsToCallbacks() {
        NotesToolkit toolkit = new NotesToolkit();
        List<String> seen = new ArrayList<>();

        toolkit.invokeTool("search", "jvm", List.of((tool, pages) ->
                pages.forEach(p -> seen.add(tool + " " + p.getAddress()))));

        assertEquals(List.of("search root/snippet:a", "search root/snippet:b"), seen);
    }

    @Test
    void staticTool_missingPrimitiveArgumentFails() {
        NotesToolkit toolkit = new NotesToolkit();

        assertThrows(IllegalArgumentException.class, () -> toolkit.call("recent", Map.of()));
    }

    @Test
    void nativePaginatedTool_receivesCursor() {
        NotesToolkit toolkit = new NotesToolkit();

        Map<String, Object> first = toolkit.invokeTool("browse", "inbox");
        Map<String, Object> second = toolkit.invokeTool("browse", Map.of("folder", "inbox", "cursor", "2"));

        assertEquals("2", first.get("next_cursor"));
        assertEquals(2, ((List<?>) second.get("results")).size());
        assertTrue(second.containsKey("next_cursor"));
        assertNull(second.get("next_cursor"));
    }

    @Test
    void asyncTool_isJoined() {
        NotesToolkit toolkit = new NotesToolkit();

        Map<String, Object> response = toolkit.invokeTool("remote", "q");

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> results = (List<Map<String, Object>>) response.get("results");
        assertEquals("root/snippet:remote", results.get(0).get("uri"));
    }

    @Test
    void declaredInvalidator_forcesRerun() {
        NotesToolkit toolkit = new NotesToolkit();

        toolkit.call("volatileLookup", Map.of("query", "q"));
        toolkit.call("volatileLookup", Map.of("query", "q"));

        assertEquals(2, toolkit.searches.get());
    }

    @Test
    void registration_rejectsUnsupportedReturnTypes() {
        assertThrows(ToolRegistrationException.class, StringReturningToolkit::new);
        assertThrows(ToolRegistrationException.class, RawListToolkit::new);
    }

    @Test
    void registration_rejectsPaginationConflicts() {
        assertThrows(ToolRegistrationException.class, DoublePaginatedToolkit::new);
        assertThrows(ToolRegistrationException.class, CursorlessToolkit::new);
    }

    @Test
    void registration_rejectsInvalidatorOfWrongType() {
        assertThrows(ToolRegistrationException.class, BadInvalidatorToolkit::new);
    }

    @Test
    void getTool_unknownNameFails() {
        RetrieverToolkit toolkit = new RetrieverToolkit("empty");

        UnknownToolException e = assertThrows(UnknownToolException.class, () -> toolkit.getTool("missing"));
        assertEquals("Tool 'missing' not found", e.getMessage());
        assertThrows(UnknownToolException.class, () -> toolkit.invokeTool("missing", "q"));
    }

    @Test
    void registerTool_sameNameReplacesEarlierTool() {
        RetrieverToolkit toolkit = new RetrieverToolkit("replace");
        toolkit.registerTool(ToolFunctions.pages("find", List.of("query"), args -> SnippetPage.numbered(1)));
        Tool replacement = toolkit.registerTool(
                ToolFunctions.pages("find", List.of("query"), args -> SnippetPage.numbered(2)));

        assertSame(replacement, toolkit.getTool("find"));
        assertEquals(1, toolkit.getTools().size());
        assertEquals(2, ((List<?>) toolkit.call("find", Map.of("query", "q"))).size());
    }

    @Test
    void registerTool_optionNameOverridesFunctionName() {
        RetrieverToolkit toolkit = new RetrieverToolkit("rename");

        toolkit.registerTool(ToolFunctions.pages("find", List.of("query"), args -> SnippetPage.numbered(1)),
                ToolOptions.builder().name("lookup").build());

        assertTrue(toolkit.hasTool("lookup"));
        assertFalse(toolkit.hasTool("find"));
    }
}
