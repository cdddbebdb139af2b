package com.praga.tools;

import com.praga.page.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A registered retrieval function with its caching and pagination policy.
 * <p>
 * Two entry points:
 * <ul>
 *   <li>{@link #call(Map)}: direct call, cached, never paginated; function errors propagate.</li>
 *   <li>{@link #invoke(Object)}: agent-facing call taking a plain string (bound to the first
 *       parameter) or an argument map; returns a serialized result map. Empty results and
 *       "no matching documents" failures give the structured not-found response; other failures
 *       are rethrown as {@link ToolExecutionException}.</li>
 * </ul>
 * Toolkit pagination strips {@code cursor} before calling, so paginated invocations share the cache
 * entry of the equivalent direct call. Arguments are converted to their declared types before the
 * cache fingerprint is taken, and cached results are stored as unmodifiable copies.
 */
public final class Tool {

    public static final String CURSOR = "cursor";

    private static final Logger log = LoggerFactory.getLogger(Tool.class);

    private final String name;
    private final String description;
    private final ToolFunction function;
    private final ToolOptions options;
    private final ToolCache cache;
    private final Paginator paginator;

    Tool(ToolFunction function, ToolOptions options, Clock clock) {
        this.function = Objects.requireNonNull(function, "function");
        this.options = Objects.requireNonNull(options, "options");
        this.name = options.getName() != null ? options.getName() : function.name();
        this.description = options.getDescription();
        validate();
        this.cache = options.isCache() ? new ToolCache(options.getTtl(), options.getInvalidator(), clock) : null;
        this.paginator = options.isPaginate() ? new Paginator(options.getMaxItems(), options.getMaxTokens()) : null;
    }

    private void validate() {
        if (name == null || name.isBlank()) {
            throw new ToolRegistrationException("Tool name must be non-blank");
        }
        boolean declaresCursor = function.parameters().stream().anyMatch(p -> CURSOR.equals(p.name()));
        if (function.returnKind() == ToolReturnKind.PAGINATED) {
            if (options.isPaginate()) {
                throw new ToolRegistrationException("Tool '" + name + "' already returns a PaginatedResponse; "
                        + "register it with paginate=false");
            }
            if (!declaresCursor) {
                throw new ToolRegistrationException("Tool '" + name + "' returns a PaginatedResponse but declares no '"
                        + CURSOR + "' parameter");
            }
        } else if (options.isPaginate() && declaresCursor) {
            throw new ToolRegistrationException("Tool '" + name + "' declares a '" + CURSOR
                    + "' parameter; toolkit pagination reserves that argument");
        }
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ToolFunction getFunction() {
        return function;
    }

    public ToolOptions getOptions() {
        return options;
    }

    public List<ToolParameter> getParameters() {
        return function.parameters();
    }

    /**
     * Direct call with named arguments. Returns the function's raw result: a list of pages or a
     * {@link PaginatedResponse}. Unchecked function exceptions propagate unchanged; checked ones are
     * wrapped in {@link ToolExecutionException}.
     *
     * @throws IllegalArgumentException for arguments the function does not declare
     */
    public Object call(Map<String, ?> arguments) {
        Map<String, Object> bound = bind(arguments);
        try {
            return execute(bound);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ToolExecutionException(name, e);
        }
    }

    /** Direct call with arguments in parameter order. */
    public Object callPositional(Object... arguments) {
        List<ToolParameter> params = function.parameters();
        if (arguments.length > params.size()) {
            throw new IllegalArgumentException("Tool '" + name + "' takes " + params.size()
                    + " argument(s) but got " + arguments.length);
        }
        Map<String, Object> named = new LinkedHashMap<>();
        for (int i = 0; i < arguments.length; i++) {
            named.put(params.get(i).name(), arguments[i]);
        }
        return call(named);
    }

    /** Direct call of a page-list tool, typed. */
    public List<Page> callForPages(Map<String, ?> arguments) {
        Object result = call(arguments);
        if (result instanceof PaginatedResponse<?> r) {
            return List.copyOf(r.results());
        }
        return asPageList(result);
    }

    /**
     * Agent-facing invocation.
     *
     * @param input a string bound to the first parameter, a map of named arguments, or {@code null}
     * @return {@code {results}}, {@code {results, next_cursor}} or the not-found response
     * @throws ToolExecutionException when the function (or argument handling) fails otherwise
     */
    public Map<String, Object> invoke(Object input) {
        return invoke(input, List.of());
    }

    /**
     * Agent-facing invocation that reports the pages it is about to return to {@code callbacks}, in
     * order, before they are serialized. Callbacks are not called for not-found responses; a
     * callback failure fails the invocation.
     */
    public Map<String, Object> invoke(Object input, List<ToolCallback> callbacks) {
        Objects.requireNonNull(callbacks, "callbacks");
        try {
            Map<String, Object> arguments = toArguments(input);
            if (paginator != null) {
                Object cursor = arguments.remove(CURSOR);
                List<Page> all = asPageList(execute(bind(arguments)));
                PaginatedResponse<Page> page = paginator.paginate(all, cursor != null ? cursor.toString() : null);
                if (page.results().isEmpty()) {
                    return notFound(null);
                }
                notifyCallbacks(callbacks, page.results());
                return ToolResultSerializer.paginated(page);
            }
            if (function.returnKind() == ToolReturnKind.PAGINATED) {
                PaginatedResponse<?> response = (PaginatedResponse<?>) execute(bind(arguments));
                if (response.results().isEmpty()) {
                    return notFound(null);
                }
                notifyCallbacks(callbacks, response.results());
                return ToolResultSerializer.paginated(response);
            }
            List<Page> pages = asPageList(execute(bind(arguments)));
            if (pages.isEmpty()) {
                return notFound(null);
            }
            notifyCallbacks(callbacks, pages);
            return ToolResultSerializer.results(pages);
        } catch (Exception e) {
            if (isNoMatchingDocuments(e)) {
                return notFound(e.getMessage());
            }
            if (e instanceof ToolExecutionException te) {
                throw te;
            }
            log.warn("Tool {} failed: {}", name, e.getMessage());
            throw new ToolExecutionException(name, e);
        }
    }

    /** Drops all cached results of this tool. */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    int cachedEntries() {
        return cache != null ? cache.size() : 0;
    }

    private Object execute(Map<String, Object> bound) throws Exception {
        if (cache == null) {
            return run(bound);
        }
        String key = ToolCache.fingerprint(function.identity(), bound);
        Optional<Object> hit = cache.get(key);
        if (hit.isPresent()) {
            log.debug("Tool {} cache hit {}", name, key);
            return hit.get();
        }
        Object value = frozen(run(bound));
        cache.put(key, value);
        return value;
    }

    /** Unmodifiable copy of a page collection; paginated responses are already immutable. */
    private static Object frozen(Object result) {
        if (result instanceof Collection<?> collection) {
            return Collections.unmodifiableList(new ArrayList<>(collection));
        }
        return result;
    }

    private void notifyCallbacks(List<ToolCallback> callbacks, List<? extends Page> pages) {
        for (ToolCallback callback : callbacks) {
            callback.onResults(name, pages);
        }
    }

    private Object run(Map<String, Object> bound) throws Exception {
        Object result = function.apply(bound);
        if (result == null) {
            throw new IllegalStateException("Tool '" + name + "' returned null");
        }
        if (function.returnKind() == ToolReturnKind.PAGINATED && !(result instanceof PaginatedResponse<?>)) {
            throw new IllegalStateException("Tool '" + name + "' must return a PaginatedResponse but returned "
                    + result.getClass().getName());
        }
        return result;
    }

    /**
     * One entry per declared parameter, in declaration order, converted by
     * {@link ToolFunction#normalize(Map)}; rejects undeclared names.
     */
    private Map<String, Object> bind(Map<String, ?> arguments) {
        Map<String, ?> given = arguments != null ? arguments : Map.of();
        Map<String, Object> bound = new LinkedHashMap<>();
        for (ToolParameter p : function.parameters()) {
            bound.put(p.name(), given.get(p.name()));
        }
        for (String key : given.keySet()) {
            if (!bound.containsKey(key)) {
                throw new IllegalArgumentException("Tool '" + name + "' has no parameter '" + key + "'");
            }
        }
        return function.normalize(bound);
    }

    private Map<String, Object> toArguments(Object input) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        if (input == null) {
            return arguments;
        }
        if (input instanceof Map<?, ?> map) {
            map.forEach((k, v) -> arguments.put(String.valueOf(k), v));
            return arguments;
        }
        if (input instanceof CharSequence s) {
            ToolParameter first = function.parameters().stream()
                    .filter(p -> !CURSOR.equals(p.name()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Tool '" + name + "' takes no arguments"));
            arguments.put(first.name(), s.toString());
            return arguments;
        }
        throw new IllegalArgumentException("Tool input must be a string or a map of arguments, got "
                + input.getClass().getName());
    }

    @SuppressWarnings("unchecked")
    private List<Page> asPageList(Object result) {
        if (result instanceof List<?> list) {
            return (List<Page>) list;
        }
        if (result instanceof Collection<?> collection) {
            return List.copyOf((Collection<Page>) collection);
        }
        throw new IllegalStateException("Tool '" + name + "' must return a collection of pages but returned "
                + result.getClass().getName());
    }

    private static boolean isNoMatchingDocuments(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof NoMatchingDocumentsException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("no matching documents")) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Object> notFound(String message) {
        log.debug("Tool {} found no documents", name);
        return ToolResultSerializer.noDocumentsFound(message);
    }
}
