package com.praga.cache;

import com.praga.page.PageAddress;

/**
 * Thrown when a page cannot be stored under the requested parent.
 */
public final class ProvenanceException extends IllegalArgumentException {

    private final PageAddress child;
    private final PageAddress parent;

    public ProvenanceException(PageAddress child, PageAddress parent, String reason) {
        super("Cannot store " + child + " under parent " + parent + ": " + reason);
        this.child = child;
        this.parent = parent;
    }

    public PageAddress getChild() {
        return child;
    }

    public PageAddress getParent() {
        return parent;
    }
}
