package com.praga.page;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Base type for every page. Subclasses add typed attributes and are mapped with Jackson
 * (see {@link PageCodec}); the address is written under the {@code uri} property.
 */
public abstract class Page {

    @JsonProperty("uri")
    private PageAddress address;

    /** For Jackson; the address is set from the {@code uri} property. */
    protected Page() {
    }

    protected Page(PageAddress address) {
        this.address = Objects.requireNonNull(address, "address");
    }

    @JsonProperty("uri")
    public PageAddress getAddress() {
        return address;
    }
}
