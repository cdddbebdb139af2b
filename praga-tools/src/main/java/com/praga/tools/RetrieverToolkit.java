package com.praga.tools;

import com.praga.annotations.RetrieverTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named collection of tools.
 * <p>
 * Tools are added imperatively with {@link #registerTool(ToolFunction, ToolOptions)} or declared on a
 * subclass with {@link RetrieverTool} (instance or static methods). Declared methods are collected
 * into a pending list when the toolkit is constructed and registered before the constructor returns.
 * Registering a name again replaces the earlier tool.
 *
 * <pre>{@code
 * public class DocsToolkit extends RetrieverToolkit {
 *     @RetrieverTool(cache = true, paginate = true, maxItems = 10)
 *     public List<DocPage> searchDocs(@ToolParam("query") String query) { ... }
 * }
 * }</pre>
 */
public class RetrieverToolkit {

    private static final Logger log = LoggerFactory.getLogger(RetrieverToolkit.class);

    /** Annotated method waiting to be bound to this toolkit. */
    record PendingTool(Method method, RetrieverTool declaration) {
    }

    private final String name;
    private final Clock clock;
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public RetrieverToolkit() {
        this(null, Clock.systemUTC());
    }

    public RetrieverToolkit(String name) {
        this(name, Clock.systemUTC());
    }

    /**
     * @param name  toolkit name; {@code null} means the simple class name
     * @param clock time source for tool cache expiry
     */
    public RetrieverToolkit(String name, Clock clock) {
        this.name = name != null && !name.isBlank() ? name : getClass().getSimpleName();
        this.clock = Objects.requireNonNull(clock, "clock");
        for (PendingTool pending : collectDeclaredTools(getClass())) {
            registerDeclared(pending);
        }
    }

    public String getName() {
        return name;
    }

    public Tool registerTool(ToolFunction function) {
        return registerTool(function, ToolOptions.defaults());
    }

    /**
     * Registers a function as a tool.
     *
     * @throws ToolRegistrationException if the function's shape conflicts with the options
     */
    public Tool registerTool(ToolFunction function, ToolOptions options) {
        Tool tool = new Tool(function, options, clock);
        Tool previous = tools.put(tool.getName(), tool);
        if (previous != null) {
            log.info("Toolkit {}: replaced tool {}", name, tool.getName());
        } else {
            log.debug("Toolkit {}: registered tool {} (cache={}, paginate={})", name, tool.getName(),
                    options.isCache(), options.isPaginate());
        }
        return tool;
    }

    /**
     * @throws UnknownToolException if no tool has this name
     */
    public Tool getTool(String toolName) {
        Tool tool = toolName != null ? tools.get(toolName) : null;
        if (tool == null) {
            throw new UnknownToolException(toolName);
        }
        return tool;
    }

    public boolean hasTool(String toolName) {
        return toolName != null && tools.containsKey(toolName);
    }

    /** Tools sorted by name. */
    public List<Tool> getTools() {
        List<Tool> list = new ArrayList<>(tools.values());
        list.sort(Comparator.comparing(Tool::getName));
        return list;
    }

    /** Agent-facing invocation; see {@link Tool#invoke(Object)}. */
    public Map<String, Object> invokeTool(String toolName, Object input) {
        return getTool(toolName).invoke(input);
    }

    /** Agent-facing invocation with result callbacks; see {@link Tool#invoke(Object, List)}. */
    public Map<String, Object> invokeTool(String toolName, Object input, List<ToolCallback> callbacks) {
        return getTool(toolName).invoke(input, callbacks);
    }

    /** Direct call; see {@link Tool#call(Map)}. */
    public Object call(String toolName, Map<String, ?> arguments) {
        return getTool(toolName).call(arguments);
    }

    private void registerDeclared(PendingTool pending) {
        Method method = pending.method();
        Object target = Modifier.isStatic(method.getModifiers()) ? null : this;
        registerTool(ToolFunctions.fromMethod(target, method), toOptions(method, pending.declaration()));
    }

    /** {@link RetrieverTool} methods of {@code type} and its superclasses below this class, by name. */
    static List<PendingTool> collectDeclaredTools(Class<?> type) {
        List<PendingTool> pending = new ArrayList<>();
        for (Class<?> c = type; c != null && c != RetrieverToolkit.class && c != Object.class; c = c.getSuperclass()) {
            for (Method m : c.getDeclaredMethods()) {
                RetrieverTool declaration = m.getAnnotation(RetrieverTool.class);
                if (declaration != null && !m.isBridge() && !m.isSynthetic()) {
                    pending.add(new PendingTool(m, declaration));
                }
            }
        }
        pending.sort(Comparator.comparing(p -> p.method().getName()));
        return pending;
    }

    static ToolOptions toOptions(Method method, RetrieverTool declaration) {
        return ToolOptions.builder()
                .name(declaration.name().isBlank() ? method.getName() : declaration.name())
                .description(declaration.description())
                .cache(declaration.cache())
                .ttl(declaration.ttlMillis() > 0 ? Duration.ofMillis(declaration.ttlMillis()) : null)
                .invalidator(instantiateInvalidator(method, declaration.invalidator()))
                .paginate(declaration.paginate())
                .maxItems(declaration.maxItems())
                .maxTokens(declaration.maxTokens())
                .build();
    }

    private static ToolCacheInvalidator instantiateInvalidator(Method method, Class<?> type) {
        if (type == Void.class) {
            return null;
        }
        if (!ToolCacheInvalidator.class.isAssignableFrom(type)) {
            throw new ToolRegistrationException("Invalidator " + type.getName() + " of tool method " + method.getName()
                    + " does not implement " + ToolCacheInvalidator.class.getSimpleName());
        }
        try {
            var constructor = type.getDeclaredConstructor();
            constructor.trySetAccessible();
            return (ToolCacheInvalidator) constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ToolRegistrationException("Cannot create invalidator " + type.getName() + " for tool method "
                    + method.getName() + ": " + e.getMessage(), e);
        }
    }
}
