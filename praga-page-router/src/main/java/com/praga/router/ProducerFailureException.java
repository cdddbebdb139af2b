package com.praga.router;

import com.praga.page.PageAddress;

/**
 * Wraps a checked exception thrown by a page producer. Unchecked exceptions from producers are
 * propagated as they are.
 */
public final class ProducerFailureException extends RuntimeException {

    private final String typeTag;
    private final PageAddress address;

    public ProducerFailureException(String typeTag, PageAddress address, Throwable cause) {
        super("Producer for page type " + typeTag + " failed on " + address + ": " + cause.getMessage(), cause);
        this.typeTag = typeTag;
        this.address = address;
    }

    public String getTypeTag() {
        return typeTag;
    }

    public PageAddress getAddress() {
        return address;
    }
}
