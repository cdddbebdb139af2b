package com.praga.tools;

import com.praga.page.Page;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factories for {@link ToolFunction}s.
 */
public final class ToolFunctions {

    private ToolFunctions() {
    }

    @FunctionalInterface
    public interface PageListBody {
        List<? extends Page> apply(ToolArguments arguments) throws Exception;
    }

    @FunctionalInterface
    public interface PaginatedBody {
        PaginatedResponse<? extends Page> apply(ToolArguments arguments) throws Exception;
    }

    /**
     * Function backed by a method. Instance methods need a target; static methods take {@code null}.
     *
     * @throws ToolRegistrationException if the return type or parameter names are unusable
     */
    public static ToolFunction fromMethod(Object target, Method method) {
        return new MethodToolFunction(target, method);
    }

    /** Function returning a list of pages. */
    public static ToolFunction pages(String name, List<String> parameterNames, PageListBody body) {
        Objects.requireNonNull(body, "body");
        return new LambdaToolFunction(name, parameterNames, ToolReturnKind.PAGE_LIST, body::apply);
    }

    /** Self-paginating function; {@code parameterNames} must include {@code cursor}. */
    public static ToolFunction paginated(String name, List<String> parameterNames, PaginatedBody body) {
        Objects.requireNonNull(body, "body");
        return new LambdaToolFunction(name, parameterNames, ToolReturnKind.PAGINATED, body::apply);
    }

    @FunctionalInterface
    private interface Body {
        Object apply(ToolArguments arguments) throws Exception;
    }

    private static final class LambdaToolFunction implements ToolFunction {

        private final String name;
        private final List<ToolParameter> parameters;
        private final ToolReturnKind returnKind;
        private final Body body;

        LambdaToolFunction(String name, List<String> parameterNames, ToolReturnKind returnKind, Body body) {
            this.name = Objects.requireNonNull(name, "name");
            List<ToolParameter> params = new ArrayList<>();
            for (String p : Objects.requireNonNull(parameterNames, "parameterNames")) {
                params.add(ToolParameter.of(p));
            }
            this.parameters = List.copyOf(params);
            this.returnKind = returnKind;
            this.body = body;
        }

        @Override
        public String identity() {
            return "fn:" + name;
        }

        @Override
        public String name() {
            return name;
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
        public Object apply(Map<String, Object> arguments) throws Exception {
            return body.apply(new ToolArguments(arguments));
        }
    }
}
