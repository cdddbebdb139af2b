package com.praga.tools;

/**
 * Thrown when a toolkit has no tool under the requested name.
 */
public final class UnknownToolException extends RuntimeException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Tool '" + toolName + "' not found");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
