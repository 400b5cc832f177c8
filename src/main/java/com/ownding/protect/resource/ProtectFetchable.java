package com.ownding.protect.resource;

import java.util.Comparator;
import java.util.Objects;

/**
 * A resource that can be listed from one collection endpoint of the Protect integration API.
 * <p>
 * Ordering and equality are deliberately name based and exposed as static helpers rather than
 * {@code compareTo}/{@code equals} overrides, so records keep their structural {@code equals}.
 * Two resources with the same name and different ids are equal under {@link #sameName}.
 */
public interface ProtectFetchable extends CsvConvertible {

    /**
     * Server assigned identifier, never generated or altered by this client.
     */
    String id();

    String name();

    default String description() {
        return name() + " [" + id() + "]";
    }

    /**
     * Ascending, locale independent ordering by name.
     */
    static <T extends ProtectFetchable> Comparator<T> byName() {
        return (left, right) -> left.name().compareTo(right.name());
    }

    static boolean sameName(ProtectFetchable left, ProtectFetchable right) {
        return Objects.equals(left.name(), right.name());
    }
}
