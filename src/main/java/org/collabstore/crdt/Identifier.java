package org.collabstore.crdt;

import org.jgroups.util.Bits;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Objects;

import net.jcip.annotations.Immutable;

/**
 * Position token of a single character in a replicated text.
 * <p>
 * An identifier is a path of one or more triplets. Every triplet is 8 chars wide:
 * <pre>| path (48 bits, 3 chars) | clock (48 bits, 3 chars) | store id (32 bits, 2 chars) |</pre>
 * Identifiers are ordered by plain {@link String#compareTo(String)} of their backing string, which compares the
 * chars as unsigned 16-bit values. A proper prefix therefore sorts before all of its extensions, and the string form
 * returned by {@link #asString()} can be compared by receivers without decoding.
 *
 * @since 1.0
 */
@Immutable
public final class Identifier implements Comparable<Identifier> {
    public static final int  TRIPLET_LENGTH=8;
    public static final long MAX_PATH=0xFFFF_FFFF_FFFFL;
    public static final long MAX_CLOCK=0xFFFF_FFFF_FFFFL;
    public static final long MAX_STORE=0xFFFF_FFFFL;

    private final String id;

    private Identifier(String id) {
        this.id=id;
    }

    /**
     * Wraps the string form of an identifier.
     *
     * @throws IllegalArgumentException if the string is empty or not a whole number of triplets
     */
    public static Identifier of(String id) {
        Objects.requireNonNull(id, "id can not be null");
        if(id.isEmpty() || id.length() % TRIPLET_LENGTH != 0)
            throw new IllegalArgumentException(String.format("malformed identifier of length %d", id.length()));
        return new Identifier(id);
    }

    /** Creates a single-triplet identifier */
    public static Identifier of(long path, long clock, long store) {
        return new Identifier(triplet(path, clock, store));
    }

    static String triplet(long path, long clock, long store) {
        if(path < 0 || path > MAX_PATH)
            throw new IllegalArgumentException("path out of range: " + path);
        if(clock < 0 || clock > MAX_CLOCK)
            throw new IllegalArgumentException("clock out of range: " + clock);
        if(store < 0 || store > MAX_STORE)
            throw new IllegalArgumentException("store id out of range: " + store);
        char[] buf={
          (char)(path >>> 32), (char)(path >>> 16), (char)path,
          (char)(clock >>> 32), (char)(clock >>> 16), (char)clock,
          (char)(store >>> 16), (char)store
        };
        return new String(buf);
    }

    public String asString()     {return id;}
    public int    triplets()     {return id.length() / TRIPLET_LENGTH;}

    public long pathAt(int triplet) {
        int i=triplet * TRIPLET_LENGTH;
        return ((long)id.charAt(i) << 32) | ((long)id.charAt(i+1) << 16) | id.charAt(i+2);
    }

    public long clockAt(int triplet) {
        int i=triplet * TRIPLET_LENGTH + 3;
        return ((long)id.charAt(i) << 32) | ((long)id.charAt(i+1) << 16) | id.charAt(i+2);
    }

    public long storeAt(int triplet) {
        int i=triplet * TRIPLET_LENGTH + 6;
        return ((long)id.charAt(i) << 16) | id.charAt(i+1);
    }

    /** The 8-char string form of the given triplet */
    String tripletAt(int triplet) {
        int i=triplet * TRIPLET_LENGTH;
        return id.substring(i, i + TRIPLET_LENGTH);
    }

    /** The clock of the last triplet, i.e. the version of the update that created this identifier */
    public long clock() {return clockAt(triplets()-1);}

    /** The store id of the last triplet, i.e. the replica that created this identifier */
    public long store() {return storeAt(triplets()-1);}

    @Override
    public int compareTo(Identifier other) {
        return id.compareTo(other.id);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Identifier && id.equals(((Identifier)obj).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    public int serializedSize() {
        return Bits.size(id.length()) + id.length() * Character.BYTES;
    }

    public void writeTo(DataOutput out) throws IOException {
        Bits.writeIntCompressed(id.length(), out);
        for(int i=0; i < id.length(); i++)
            out.writeChar(id.charAt(i));
    }

    public static Identifier readFrom(DataInput in) throws IOException {
        int len=Bits.readIntCompressed(in);
        if(len <= 0 || len % TRIPLET_LENGTH != 0)
            throw new IOException(String.format("malformed identifier of length %d", len));
        char[] buf=new char[len];
        for(int i=0; i < len; i++)
            buf[i]=in.readChar();
        return new Identifier(new String(buf));
    }

    /** Renders the triplets as {@code path.clock@store}, separated by '/' */
    @Override
    public String toString() {
        StringBuilder sb=new StringBuilder();
        for(int i=0; i < triplets(); i++) {
            if(i > 0)
                sb.append('/');
            sb.append(Long.toHexString(pathAt(i))).append('.').append(clockAt(i)).append('@').append(storeAt(i));
        }
        return sb.toString();
    }
}
