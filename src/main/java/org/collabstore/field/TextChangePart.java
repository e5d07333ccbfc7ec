package org.collabstore.field;

import java.util.Objects;

/**
 * One user-visible edit of a text value: at {@code index}, {@code removed} was replaced by {@code inserted}.
 * The index refers to the value as it was right before this part applied.
 *
 * @since 1.0
 */
public record TextChangePart(int index, String removed, String inserted) {

    public TextChangePart {
        Objects.requireNonNull(removed, "removed can not be null");
        Objects.requireNonNull(inserted, "inserted can not be null");
    }

    public boolean isEmpty() {
        return removed.isEmpty() && inserted.isEmpty();
    }
}
