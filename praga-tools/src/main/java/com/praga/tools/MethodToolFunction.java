package com.praga.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.praga.annotations.ToolParam;
import com.praga.page.Page;
import com.praga.page.PageCodec;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * {@link ToolFunction} backed by a reflected method. The generic return type is checked once at
 * construction: a collection of a {@link Page} subtype, a {@link PaginatedResponse}, or either of
 * those inside a {@link CompletionStage} (which is joined on every call).
 */
final class MethodToolFunction implements ToolFunction {

    private static final ObjectMapper MAPPER = PageCodec.mapper();

    private final Object target;
    private final Method method;
    private final List<ToolParameter> parameters;
    private final ToolReturnKind returnKind;
    private final boolean async;

    MethodToolFunction(Object target, Method method) {
        this.method = Objects.requireNonNull(method, "method");
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (!isStatic && target == null) {
            throw new ToolRegistrationException("Instance method " + describe(method) + " needs a target");
        }
        this.target = isStatic ? null : target;
        method.trySetAccessible();

        Type returnType = method.getGenericReturnType();
        Type unwrapped = unwrapCompletionStage(returnType);
        this.async = unwrapped != returnType;
        this.returnKind = classify(unwrapped);
        this.parameters = readParameters(method);
    }

    @Override
    public String identity() {
        return method.getDeclaringClass().getName() + "." + method.getName();
    }

    @Override
    public String name() {
        return method.getName();
    }

    @Override
    public List<ToolParameter> parameters() {
        return parameters;
    }

    @Override
    public ToolReturnKind returnKind() {
        return returnKind;
    }

    @Override
    public Map<String, Object> normalize(Map<String, Object> arguments) {
        Map<String, Object> converted = new LinkedHashMap<>();
        for (ToolParameter p : parameters) {
            converted.put(p.name(), convert(p, arguments.get(p.name())));
        }
        return converted;
    }

    @Override
    public Object apply(Map<String, Object> arguments) throws Exception {
        Object[] values = new Object[parameters.size()];
        for (int i = 0; i < values.length; i++) {
            ToolParameter p = parameters.get(i);
            values[i] = convert(p, arguments.get(p.name()));
        }
        Object result;
        try {
            result = method.invoke(target, values);
        } catch (InvocationTargetException e) {
            throw rethrow(e.getCause());
        }
        if (async && result != null) {
            try {
                result = ((CompletionStage<?>) result).toCompletableFuture().get();
            } catch (ExecutionException e) {
                throw rethrow(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            }
        }
        return result;
    }

    private static Object convert(ToolParameter p, Object value) {
        Class<?> type = p.type();
        if (value == null) {
            if (type.isPrimitive()) {
                throw new IllegalArgumentException("Missing required argument '" + p.name() + "'");
            }
            return null;
        }
        if (type.isInstance(value)) {
            return value;
        }
        try {
            return MAPPER.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Argument '" + p.name() + "' cannot be converted to "
                    + type.getSimpleName() + ": " + value, e);
        }
    }

    private static Exception rethrow(Throwable cause) {
        if (cause instanceof Error err) {
            throw err;
        }
        return cause instanceof Exception e ? e : new RuntimeException(cause);
    }

    private static List<ToolParameter> readParameters(Method method) {
        List<ToolParameter> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Parameter p : method.getParameters()) {
            ToolParam named = p.getAnnotation(ToolParam.class);
            String name;
            if (named != null) {
                name = named.value();
            } else if (p.isNamePresent()) {
                name = p.getName();
            } else {
                throw new ToolRegistrationException("Parameter names of " + describe(method)
                        + " are not available; annotate them with @ToolParam or compile with -parameters");
            }
            if (!seen.add(name)) {
                throw new ToolRegistrationException("Duplicate parameter name '" + name + "' in " + describe(method));
            }
            params.add(new ToolParameter(name, p.getType()));
        }
        return List.copyOf(params);
    }

    private static Type unwrapCompletionStage(Type type) {
        if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> raw
                && CompletionStage.class.isAssignableFrom(raw)) {
            return pt.getActualTypeArguments()[0];
        }
        return type;
    }

    private ToolReturnKind classify(Type type) {
        if (type instanceof Class<?> c && PaginatedResponse.class.equals(c)) {
            return ToolReturnKind.PAGINATED;
        }
        if (type instanceof ParameterizedType pt && pt.getRawType() instanceof Class<?> raw) {
            if (PaginatedResponse.class.equals(raw)) {
                return ToolReturnKind.PAGINATED;
            }
            if (Collection.class.isAssignableFrom(raw) && isPageType(pt.getActualTypeArguments()[0])) {
                return ToolReturnKind.PAGE_LIST;
            }
        }
        throw new ToolRegistrationException("Tool method " + describe(method) + " must return a collection of pages or a "
                + "PaginatedResponse (optionally inside a CompletionStage), but returns " + method.getGenericReturnType().getTypeName());
    }

    private static boolean isPageType(Type type) {
        if (type instanceof Class<?> c) {
            return Page.class.isAssignableFrom(c);
        }
        if (type instanceof WildcardType w && w.getLowerBounds().length == 0) {
            Type[] upper = w.getUpperBounds();
            return upper.length == 1 && isPageType(upper[0]);
        }
        return false;
    }

    private static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName();
    }
}
