/**
 * Page model: versioned {@link com.praga.page.PageAddress addresses}, the {@link com.praga.page.Page}
 * base type and its JSON mapping.
 */
package com.praga.page;
