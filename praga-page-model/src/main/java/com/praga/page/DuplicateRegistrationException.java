package com.praga.page;

/**
 * Thrown when a registry refuses a second entry under a name that is already taken
 * (page type tag, type alias, toolkit name).
 */
public final class DuplicateRegistrationException extends IllegalArgumentException {

    private final String kind;
    private final String name;

    public DuplicateRegistrationException(String kind, String name) {
        super(kind + " already registered: " + name);
        this.kind = kind;
        this.name = name;
    }

    /** What was being registered (e.g. "Page handler", "Type alias"). */
    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
