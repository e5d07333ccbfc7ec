package org.collabstore.crdt;

import org.collabstore.configuration.Property;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import net.jcip.annotations.NotThreadSafe;

import static org.collabstore.configuration.RuntimeProperties.PROPERTY_PREFIX;

/**
 * Allocates dense identifiers between two bounds for one local update.
 * <p>
 * An allocator is bound to a single (version, store id) pair: every identifier it returns ends with a triplet
 * carrying that pair, which makes identifiers from different replicas, or from different updates of the same replica,
 * distinct. Within one update the allocator remembers what it issued, so a batch of splices which removes a fresh
 * character and inserts at the same spot never sees an identifier again.
 * </p>
 * <p>
 * Allocation walks both bounds triplet by triplet. Equal triplets are copied. Where the path gap is wider than one,
 * a new triplet is placed in the leading bucket of the gap. Otherwise the lower triplet is copied and the upper bound
 * is dropped, and the walk continues below the lower bound. When the lower bound runs out, a new triplet is appended.
 * </p>
 * Path selection is seeded from the version and store id, so the output is a function of the inputs.
 *
 * @since 1.0
 */
@NotThreadSafe
public class IdentifierAllocator {

    /**
     * Width of the bucket a new path is picked from. {@code 0} picks from the first {@code sqrt(gap)} slots, a positive
     * value caps the bucket at that many slots (the LSEQ boundary).
     */
    public static final Property BOUNDARY=Property.create(PROPERTY_PREFIX + ".ids.boundary")
      .label("Identifier allocation boundary")
      .description("Maximum distance between a new path and its lower neighbor; 0 selects sqrt(gap)")
      .defaultValue(0L)
      .build();

    protected final long            version;
    protected final long            store;
    protected final long            boundary;
    protected final Random          random;
    protected final Set<Identifier> issued=new HashSet<>();

    private static final String ZERO=Identifier.triplet(0, 0, 0);

    public IdentifierAllocator(long version, long store) {
        this(version, store, 0);
    }

    public IdentifierAllocator(long version, long store, long boundary) {
        if(version < 0 || version > Identifier.MAX_CLOCK)
            throw new IllegalArgumentException("version out of range: " + version);
        if(store < 0 || store > Identifier.MAX_STORE)
            throw new IllegalArgumentException("store id out of range: " + store);
        if(boundary < 0)
            throw new IllegalArgumentException("boundary must be >= 0: " + boundary);
        this.version=version;
        this.store=store;
        this.boundary=boundary;
        this.random=new Random(version * 0x9E3779B97F4A7C15L ^ store);
    }

    public long version()  {return version;}
    public long store()    {return store;}
    public int  issued()   {return issued.size();}

    /**
     * Creates {@code n} identifiers strictly between the bounds, in increasing order.
     *
     * @param lower the exclusive lower bound, or null for the start of the sequence
     * @param upper the exclusive upper bound, or null for the end of the sequence
     * @param n     the number of identifiers to create
     * @throws IllegalArgumentException if {@code n < 0} or the bounds are equal or badly ordered
     */
    public Identifier[] allocate(Identifier lower, Identifier upper, int n) {
        if(n < 0)
            throw new IllegalArgumentException("n must be >= 0: " + n);
        if(lower != null && upper != null) {
            int k=lower.compareTo(upper);
            if(k == 0)
                throw new IllegalArgumentException("bounds are equal: " + lower);
            if(k > 0)
                throw new IllegalArgumentException(String.format("bounds are badly ordered: %s > %s", lower, upper));
        }
        Identifier[] ids=new Identifier[n];
        Identifier prev=lower;
        for(int i=0; i < n; i++) {
            Identifier id=createId(prev, upper);
            // a dead identifier of this update sits between the bounds: go below it
            while(!issued.add(id))
                id=createId(id, upper);
            ids[i]=prev=id;
        }
        return ids;
    }

    protected Identifier createId(Identifier lower, Identifier upper) {
        StringBuilder sb=new StringBuilder();
        boolean bounded=upper != null;
        for(int i=0;; i++) {
            boolean has_lower=lower != null && i < lower.triplets();
            boolean has_upper=bounded && i < upper.triplets();
            if(!has_lower && !bounded)
                break;
            if(bounded && !has_upper)
                throw new IllegalArgumentException(String.format("no identifier fits between %s and %s", lower, upper));

            String lt=has_lower? lower.tripletAt(i) : null, ut=has_upper? upper.tripletAt(i) : null;
            long   lp=has_lower? lower.pathAt(i) : 0, up=has_upper? upper.pathAt(i) : Identifier.MAX_PATH + 1;

            // shared triplet: descend
            if(ut != null && ut.equals(has_lower? lt : ZERO)) {
                sb.append(ut);
                continue;
            }
            if(up - lp > 1) {
                sb.append(Identifier.triplet(pickPath(lp + 1, up - 1), version, store));
                return Identifier.of(sb.toString());
            }
            // no room at this level: stay on the lower side, below which the upper bound no longer constrains
            sb.append(has_lower? lt : ZERO);
            bounded=false;
        }
        sb.append(Identifier.triplet(pickPath(1, Identifier.MAX_PATH), version, store));
        return Identifier.of(sb.toString());
    }

    /** Picks a path in the leading bucket of the inclusive range {@code [min, max]} */
    protected long pickPath(long min, long max) {
        long span=max - min;
        long bucket=boundary > 0? Math.min(boundary - 1, span) : (long)Math.sqrt((double)span);
        return min + Math.round(random.nextDouble() * bucket);
    }

    @Override
    public String toString() {
        return String.format("allocator[version=%d, store=%d, issued=%d]", version, store, issued.size());
    }
}
