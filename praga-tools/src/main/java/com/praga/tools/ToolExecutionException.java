package com.praga.tools;

/**
 * Thrown when a tool's function fails for a reason other than "no matching documents".
 */
public final class ToolExecutionException extends RuntimeException {

    private final String toolName;

    public ToolExecutionException(String toolName, Throwable cause) {
        super("Tool execution failed: " + cause.getMessage(), cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
