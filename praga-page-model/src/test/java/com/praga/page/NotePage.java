package com.praga.page;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Test page with a nested address, a timestamp and a list attribute. */
final class NotePage extends Page {

    private final String title;
    private final Instant modifiedAt;
    private final PageAddress parent;
    private final List<String> tags;

    @JsonCreator
    NotePage(@JsonProperty("uri") PageAddress address,
             @JsonProperty("title") String title,
             @JsonProperty("modifiedAt") Instant modifiedAt,
             @JsonProperty("parent") PageAddress parent,
             @JsonProperty("tags") List<String> tags) {
        super(address);
        this.title = title;
        this.modifiedAt = modifiedAt;
        this.parent = parent;
        this.tags = tags;
    }

    public String getTitle() {
        return title;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    public PageAddress getParent() {
        return parent;
    }

    public List<String> getTags() {
        return tags;
    }
}
