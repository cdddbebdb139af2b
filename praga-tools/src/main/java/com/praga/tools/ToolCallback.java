package com.praga.tools;

import com.praga.page.Page;

import java.util.List;

/**
 * Observer of agent-facing tool invocations. Receives the pages of each non-empty response before
 * they are serialized; for paginated tools, only the pages of the returned slice.
 */
@FunctionalInterface
public interface ToolCallback {

    void onResults(String toolName, List<? extends Page> pages);
}
