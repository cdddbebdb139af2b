package com.praga.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names a parameter of a {@link RetrieverTool} method. Without it the compiled parameter name
 * is used, which requires compiling with {@code -parameters}.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface ToolParam {

    /** Argument name used in tool invocations (e.g. "query", "cursor"). */
    String value();
}
