package org.collabstore.field;

import org.collabstore.crdt.Cemetery;
import org.collabstore.crdt.IdentifierList;

import net.jcip.annotations.NotThreadSafe;

/**
 * Replicated bookkeeping of one text field instance: one identifier per character of the value, in the same order,
 * and the tombstones of removals which overtook their insertions.
 * <p>
 * Created once per field instance and mutated in place by {@link TextField}. The identifiers are only consistent with
 * the value they were last applied to; pass both together.
 * </p>
 *
 * @since 1.0
 */
@NotThreadSafe
public class TextMetadata {
    protected final IdentifierList ids;
    protected final Cemetery       cemetery;

    public TextMetadata() {
        this(new IdentifierList(), new Cemetery());
    }

    protected TextMetadata(IdentifierList ids, Cemetery cemetery) {
        this.ids=ids;
        this.cemetery=cemetery;
    }

    public IdentifierList ids()      {return ids;}
    public Cemetery       cemetery() {return cemetery;}
    public int            size()     {return ids.size();}

    @Override
    public String toString() {
        return String.format("%d ids, %d tombstones", ids.size(), cemetery.size());
    }
}
