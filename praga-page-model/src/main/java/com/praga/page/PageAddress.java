package com.praga.page;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Versioned address of a page: {@code root/type:id@version}.
 * <p>
 * The {@code @version} suffix is omitted when the version equals {@link #DEFAULT_VERSION}, so
 * {@code praga/doc:42} and {@code praga/doc:42@1} denote the same address and format to the former.
 * {@link #parse(String)} is the exact inverse of {@link #toString()}: the component rules below keep
 * every valid address unambiguous in its canonical form.
 * <ul>
 *   <li>root: may be empty, no {@code /}</li>
 *   <li>type: non-empty, no {@code /}, {@code :} or {@code @}</li>
 *   <li>id: non-empty, no {@code :} or {@code @}</li>
 *   <li>version: {@code >= 0}</li>
 * </ul>
 * Jackson reads and writes addresses as their canonical string.
 */
public record PageAddress(String root, String type, String id, int version) implements Comparable<PageAddress> {

    /** Version assumed when an address string carries no {@code @version} suffix. */
    public static final int DEFAULT_VERSION = 1;

    private static final Pattern CANONICAL = Pattern.compile("^([^/]*)/([^/:@]+):([^:@]+)(?:@(\\d+))?$");

    private static final Comparator<PageAddress> ORDER = Comparator
            .comparing(PageAddress::root)
            .thenComparing(PageAddress::type)
            .thenComparing(PageAddress::id)
            .thenComparingInt(PageAddress::version);

    public PageAddress {
        if (root == null || type == null || id == null) {
            throw new MalformedAddressException("Address components must be non-null: root=" + root + ", type=" + type + ", id=" + id);
        }
        if (root.indexOf('/') >= 0) {
            throw new MalformedAddressException("Address root must not contain '/': " + root);
        }
        if (type.isEmpty() || containsAny(type, "/:@")) {
            throw new MalformedAddressException("Address type must be non-empty without '/', ':' or '@': " + type);
        }
        if (id.isEmpty() || containsAny(id, ":@")) {
            throw new MalformedAddressException("Address id must be non-empty without ':' or '@': " + id);
        }
        if (version < 0) {
            throw new MalformedAddressException("Address version must be >= 0: " + version);
        }
    }

    /** Address with the default version. */
    public static PageAddress of(String root, String type, String id) {
        return new PageAddress(root, type, id, DEFAULT_VERSION);
    }

    /**
     * Parses a canonical address string.
     *
     * @throws MalformedAddressException when separators are missing, a component is empty or holds a
     *                                   forbidden character, or the version is not a non-negative int
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PageAddress parse(String value) {
        if (value == null) {
            throw new MalformedAddressException("Address string is null");
        }
        Matcher m = CANONICAL.matcher(value);
        if (!m.matches()) {
            throw new MalformedAddressException("Malformed page address: " + value);
        }
        int version = DEFAULT_VERSION;
        if (m.group(4) != null) {
            try {
                version = Integer.parseInt(m.group(4));
            } catch (NumberFormatException e) {
                throw new MalformedAddressException("Page address version out of range: " + value, e);
            }
        }
        return new PageAddress(m.group(1), m.group(2), m.group(3), version);
    }

    /** Same root, type and id with another version. */
    public PageAddress withVersion(int newVersion) {
        return new PageAddress(root, type, id, newVersion);
    }

    public boolean isDefaultVersion() {
        return version == DEFAULT_VERSION;
    }

    /** Version-less prefix {@code root/type:id}, shared by all versions of one page. */
    public String prefix() {
        return root + "/" + type + ":" + id;
    }

    @JsonValue
    @Override
    public String toString() {
        return version == DEFAULT_VERSION ? prefix() : prefix() + "@" + version;
    }

    @Override
    public int compareTo(PageAddress other) {
        return ORDER.compare(this, other);
    }

    private static boolean containsAny(String s, String chars) {
        for (int i = 0; i < chars.length(); i++) {
            if (s.indexOf(chars.charAt(i)) >= 0) return true;
        }
        return false;
    }
}
