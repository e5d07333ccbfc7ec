package org.collabstore.crdt;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.RandomAccess;

import net.jcip.annotations.NotThreadSafe;

/**
 * Growable array of {@link Identifier}s kept in strictly increasing order, one per character of a text value.
 * <p>
 * Lookups are binary searches. Mutation only happens through {@link #splice(int, int, Identifier[])}, which callers
 * pair with the same splice on the text value so both stay the same length. This class is unsynchronized, it is
 * owned by a single replica.
 * </p>
 *
 * @since 1.0
 */
@NotThreadSafe
public class IdentifierList extends AbstractList<Identifier> implements RandomAccess {
    protected static final Identifier[] EMPTY=new Identifier[0];

    protected Identifier[] ids;
    protected int          size;

    public IdentifierList() {
        this(16);
    }

    public IdentifierList(int capacity) {
        ids=new Identifier[Math.max(capacity, 1)];
    }

    public IdentifierList(Collection<Identifier> c) {
        this(c.size());
        for(Identifier id: c)
            ids[size++]=Objects.requireNonNull(id);
    }

    @Override
    public Identifier get(int index) {
        Objects.checkIndex(index, size);
        return ids[index];
    }

    @Override
    public int size() {return size;}

    /**
     * Searches for an identifier.
     *
     * @return the index of the identifier if present, else {@code -(insertion point) - 1}
     */
    public int search(Identifier id) {
        return Arrays.binarySearch(ids, 0, size, id);
    }

    /** The index of the identifier, or -1 if absent */
    @Override
    public int indexOf(Object o) {
        if(!(o instanceof Identifier))
            return -1;
        int index=search((Identifier)o);
        return index >= 0? index : -1;
    }

    @Override
    public boolean contains(Object o) {
        return indexOf(o) >= 0;
    }

    /**
     * Removes {@code remove} identifiers at {@code index} and inserts {@code inserted} in their place.
     *
     * @return the removed identifiers
     */
    public Identifier[] splice(int index, int remove, Identifier[] inserted) {
        Objects.checkFromIndexSize(index, remove, size);
        Identifier[] removed=remove == 0? EMPTY : Arrays.copyOfRange(ids, index, index + remove);
        int delta=inserted.length - remove;
        if(delta > 0)
            ensureCapacity(size + delta);
        if(delta != 0)
            System.arraycopy(ids, index + remove, ids, index + inserted.length, size - index - remove);
        System.arraycopy(inserted, 0, ids, index, inserted.length);
        if(delta < 0)
            Arrays.fill(ids, size + delta, size, null);
        size+=delta;
        modCount++;
        return removed;
    }

    /** Copies the identifiers in {@code [from, to)} */
    public Identifier[] range(int from, int to) {
        Objects.checkFromToIndex(from, to, size);
        return Arrays.copyOfRange(ids, from, to);
    }

    /** The index of the first identifier which is not strictly greater than its predecessor, or -1 */
    public int firstDisorder() {
        for(int i=1; i < size; i++) {
            if(ids[i-1].compareTo(ids[i]) >= 0)
                return i;
        }
        return -1;
    }

    protected void ensureCapacity(int capacity) {
        if(capacity > ids.length)
            ids=Arrays.copyOf(ids, Math.max(capacity, ids.length + (ids.length >> 1)));
    }

    @Override
    public String toString() {
        return String.format("%d ids", size);
    }
}
