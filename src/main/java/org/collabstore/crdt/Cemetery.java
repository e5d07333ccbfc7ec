package org.collabstore.crdt;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import net.jcip.annotations.NotThreadSafe;

/**
 * Tombstone counts of identifiers whose removal arrived before their insertion.
 * <p>
 * A count is added when a remove references an identifier which is not (yet) present, and consumed when the matching
 * insert arrives. Only positive counts are stored: an entry is dropped as soon as its count reaches zero.
 * </p>
 *
 * @since 1.0
 */
@NotThreadSafe
public class Cemetery {
    protected final Map<Identifier,Integer> graves=new HashMap<>();

    /** The tombstone count of the identifier, {@code >= 0} */
    public int get(Identifier id) {
        return graves.getOrDefault(id, 0);
    }

    public boolean contains(Identifier id) {
        return graves.containsKey(id);
    }

    /** Adds one tombstone for the identifier and returns the new count */
    public int bury(Identifier id) {
        return graves.merge(Objects.requireNonNull(id), 1, Integer::sum);
    }

    /**
     * Consumes one tombstone of the identifier.
     *
     * @return true if the identifier had a tombstone (and the matching insert must be dropped), false otherwise
     */
    public boolean exhume(Identifier id) {
        Integer count=graves.get(id);
        if(count == null)
            return false;
        if(count <= 1)
            graves.remove(id);
        else
            graves.put(id, count - 1);
        return true;
    }

    public int     size()    {return graves.size();}
    public boolean isEmpty() {return graves.isEmpty();}

    /** A read-only view of the counts */
    public Map<Identifier,Integer> data() {
        return Collections.unmodifiableMap(graves);
    }

    @Override
    public String toString() {
        return graves.entrySet().stream().map(e -> String.format("%s: %d", e.getKey(), e.getValue()))
          .collect(Collectors.joining(", ", "{", "}"));
    }
}
