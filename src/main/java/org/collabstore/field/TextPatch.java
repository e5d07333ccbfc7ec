package org.collabstore.field;

import org.jgroups.util.Bits;
import org.jgroups.util.ByteArrayDataInputStream;
import org.jgroups.util.ByteArrayDataOutputStream;
import org.jgroups.util.SizeStreamable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of {@link TextPatchPart}s, the unit exchanged between replicas of a text field. Note that this class
 * is unsynchronized, as it is intended to be used by a single thread.
 * <br/>
 * Format: <pre>| num-parts | part0 | part1 ... | partN |</pre>
 *
 * @since 1.0
 */
public class TextPatch implements SizeStreamable, Iterable<TextPatchPart> {
    protected final List<TextPatchPart> parts=new ArrayList<>();


    public TextPatch() {}

    public TextPatch(Collection<TextPatchPart> c) {
        c.forEach(this::add);
    }

    public static TextPatch of(TextPatchPart... parts) {
        return new TextPatch(List.of(parts));
    }

    public TextPatch add(TextPatchPart part) {
        parts.add(Objects.requireNonNull(part));
        return this;
    }

    public TextPatch addAll(TextPatch other) {
        parts.addAll(other.parts);
        return this;
    }

    public TextPatchPart get(int index)  {return parts.get(index);}
    public int           size()          {return parts.size();}
    public boolean       isEmpty()       {return parts.isEmpty();}
    public List<TextPatchPart> parts()   {return Collections.unmodifiableList(parts);}

    @Override
    public Iterator<TextPatchPart> iterator() {
        return parts().iterator();
    }

    @Override
    public int serializedSize() {
        int retval=Bits.size(parts.size());
        for(TextPatchPart part: parts)
            retval+=part.serializedSize();
        return retval;
    }

    @Override
    public void writeTo(DataOutput out) throws IOException {
        Bits.writeIntCompressed(parts.size(), out);
        for(TextPatchPart part: parts)
            part.writeTo(out);
    }

    @Override
    public void readFrom(DataInput in) throws IOException {
        int size=Bits.readIntCompressed(in);
        if(size < 0)
            throw new IOException("negative part count: " + size);
        parts.clear();
        for(int i=0; i < size; i++) {
            TextPatchPart part=new TextPatchPart();
            part.readFrom(in);
            parts.add(part);
        }
    }

    public byte[] toByteArray() throws IOException {
        ByteArrayDataOutputStream out=new ByteArrayDataOutputStream(serializedSize());
        writeTo(out);
        return out.position() == out.buffer().length? out.buffer() : Arrays.copyOf(out.buffer(), out.position());
    }

    public static TextPatch fromByteArray(byte[] buf) throws IOException {
        return fromByteArray(buf, 0, buf.length);
    }

    public static TextPatch fromByteArray(byte[] buf, int offset, int length) throws IOException {
        if(buf == null || length <= 0)
            throw new IOException("empty patch buffer");
        if(offset < 0 || offset > buf.length - length)
            throw new IOException(String.format("range [%d, %d) outside of buffer of length %d",
                                                offset, (long)offset + length, buf.length));
        ByteArrayDataInputStream in=new ByteArrayDataInputStream(buf, offset, length);
        TextPatch patch=new TextPatch();
        patch.readFrom(in);
        if(in.position() != offset + length)
            throw new IOException(String.format("%d trailing bytes after patch", offset + length - in.position()));
        return patch;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TextPatch && parts.equals(((TextPatch)obj).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%d parts", size());
    }
}
