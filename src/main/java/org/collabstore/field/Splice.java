package org.collabstore.field;

import java.util.Objects;

/**
 * A local text edit: remove {@code remove} characters at {@code index}, then insert {@code text} there.
 * <p>
 * A negative index is an offset from the end of the text. Index and count are clamped to the text when applied, so
 * every splice is valid.
 * </p>
 *
 * @since 1.0
 */
public record Splice(int index, int remove, String text) {

    public Splice {
        Objects.requireNonNull(text, "text can not be null");
    }

    public static Splice insert(int index, String text) {
        return new Splice(index, 0, text);
    }

    public static Splice remove(int index, int count) {
        return new Splice(index, count, "");
    }
}
