package org.collabstore.crdt;

import java.util.List;
import java.util.function.Predicate;

/**
 * Coalesces the identifiers of a patch into runs which can be applied to an {@link IdentifierList} in one step.
 * <p>
 * Both searches scan the patch identifiers backwards from an exclusive end position, so a caller consuming the
 * returned chunks walks a patch from its last identifier to its first. Runs applied in that order never shift the
 * positions of runs still to come. Only identifier order is consulted: the caller owns the values.
 * </p>
 *
 * @since 1.0
 */
public final class Chunks {

    public enum Kind {
        /** All identifiers of the run exist, at consecutive positions starting at {@link Chunk#index()} */
        PRESENT,
        /** No identifier of the run exists; for insertions they share the insertion point {@link Chunk#index()} */
        ABSENT,
        /** A single identifier which has a tombstone */
        TOMBSTONED
    }

    /**
     * A run of patch identifiers {@code [from, to)}.
     *
     * @param index the position in the identifier list the run maps to, or -1 if it maps to none
     */
    public record Chunk(Kind kind, int from, int to, int index) {
        public int size() {return to - from;}
    }

    private Chunks() { }

    /**
     * Finds the last run of identifiers before {@code end} to remove: either a run which is present at consecutive
     * positions, or a run of identifiers which are all absent.
     */
    public static Chunk removed(IdentifierList ids, List<Identifier> patch_ids, int end) {
        int j=end - 1;
        int index=ids.search(patch_ids.get(j));
        int k=j;
        if(index < 0) {
            while(k > 0 && ids.search(patch_ids.get(k - 1)) < 0)
                k--;
            return new Chunk(Kind.ABSENT, k, end, -1);
        }
        while(k > 0 && index > 0 && ids.get(index - 1).equals(patch_ids.get(k - 1))) {
            k--;
            index--;
        }
        return new Chunk(Kind.PRESENT, k, end, index);
    }

    /**
     * Finds the last run of identifiers before {@code end} to insert: a tombstoned identifier, a run which is already
     * present (duplicate delivery), or a run of increasing, absent identifiers which share one insertion point.
     *
     * @param tombstoned tells whether an identifier has been removed before its insertion arrived
     */
    public static Chunk inserted(IdentifierList ids, List<Identifier> patch_ids, int end, Predicate<Identifier> tombstoned) {
        int j=end - 1;
        Identifier last=patch_ids.get(j);
        if(tombstoned.test(last))
            return new Chunk(Kind.TOMBSTONED, j, end, -1);

        int index=ids.search(last);
        int k=j;
        if(index >= 0) {
            while(k > 0 && index > 0 && ids.get(index - 1).equals(patch_ids.get(k - 1))) {
                k--;
                index--;
            }
            return new Chunk(Kind.PRESENT, k, end, index);
        }

        int point=-index - 1;
        Identifier lower=point > 0? ids.get(point - 1) : null;
        while(k > 0) {
            Identifier prev=patch_ids.get(k - 1);
            if(prev.compareTo(patch_ids.get(k)) >= 0 || tombstoned.test(prev))
                break;
            // an existing identifier at or above prev means prev has another insertion point, or is present
            if(lower != null && lower.compareTo(prev) >= 0)
                break;
            k--;
        }
        return new Chunk(Kind.ABSENT, k, end, point);
    }
}
