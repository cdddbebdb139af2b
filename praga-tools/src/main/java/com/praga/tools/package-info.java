/**
 * Retriever tools: page-returning functions registered in a {@link com.praga.tools.RetrieverToolkit}
 * with argument-keyed result caching, cursor pagination under an item cap and token budget, and
 * serialization of results for agents.
 */
package com.praga.tools;
