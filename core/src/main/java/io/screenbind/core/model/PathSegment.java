package io.screenbind.core.model;

import java.util.Objects;

/**
 * One segment of a dot-path. Whether it addresses an object key or an array slot is decided when
 * it meets a container at runtime; {@link #isIndex()} only reports that the text is usable as
 * one.
 */
public record PathSegment(String name) {

    public PathSegment {
        Objects.requireNonNull(name, "name must not be null");
    }

    /** True if the segment is a non-empty run of ASCII digits. */
    public boolean isIndex() {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * The numeric index, or {@code -1} when the segment is not an index or overflows an int.
     */
    public int index() {
        if (!isIndex()) {
            return -1;
        }
        try {
            return Integer.parseInt(name);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
