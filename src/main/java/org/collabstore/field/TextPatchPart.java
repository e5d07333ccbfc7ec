package org.collabstore.field;

import org.collabstore.crdt.Identifier;
import org.jgroups.util.Bits;
import org.jgroups.util.SizeStreamable;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One replica-facing edit of a text value, expressed in identifier space only: the characters with
 * {@code removedIds} were removed, the characters of {@code insertedText} were inserted with {@code insertedIds}.
 * <br/>
 * Format: <pre>| #removed | removed ids | removed text | #inserted | inserted ids | inserted text |</pre>
 * An identifier or a text is written as its length (compressed) followed by its chars.
 *
 * @since 1.0
 */
public class TextPatchPart implements SizeStreamable {
    protected List<Identifier> removed_ids=Collections.emptyList();
    protected String           removed_text="";
    protected List<Identifier> inserted_ids=Collections.emptyList();
    protected String           inserted_text="";


    public TextPatchPart() {}

    public TextPatchPart(List<Identifier> removed_ids, String removed_text, List<Identifier> inserted_ids, String inserted_text) {
        this.removed_ids=List.copyOf(removed_ids);
        this.removed_text=Objects.requireNonNull(removed_text);
        this.inserted_ids=List.copyOf(inserted_ids);
        this.inserted_text=Objects.requireNonNull(inserted_text);
        if(this.removed_ids.size() != removed_text.length())
            throw new IllegalArgumentException(String.format("%d removed ids for %d removed chars",
                                                             this.removed_ids.size(), removed_text.length()));
        if(this.inserted_ids.size() != inserted_text.length())
            throw new IllegalArgumentException(String.format("%d inserted ids for %d inserted chars",
                                                             this.inserted_ids.size(), inserted_text.length()));
    }

    public List<Identifier> removedIds()   {return removed_ids;}
    public String           removedText()  {return removed_text;}
    public List<Identifier> insertedIds()  {return inserted_ids;}
    public String           insertedText() {return inserted_text;}
    public boolean          isEmpty()      {return removed_ids.isEmpty() && inserted_ids.isEmpty();}

    @Override
    public int serializedSize() {
        return idsSize(removed_ids) + textSize(removed_text) + idsSize(inserted_ids) + textSize(inserted_text);
    }

    @Override
    public void writeTo(DataOutput out) throws IOException {
        writeIds(removed_ids, out);
        writeText(removed_text, out);
        writeIds(inserted_ids, out);
        writeText(inserted_text, out);
    }

    @Override
    public void readFrom(DataInput in) throws IOException {
        removed_ids=readIds(in);
        removed_text=readText(in);
        inserted_ids=readIds(in);
        inserted_text=readText(in);
        if(removed_ids.size() != removed_text.length() || inserted_ids.size() != inserted_text.length())
            throw new IOException(String.format("corrupt patch part: %d/%d removed, %d/%d inserted ids/chars",
                                                removed_ids.size(), removed_text.length(),
                                                inserted_ids.size(), inserted_text.length()));
    }

    @Override
    public boolean equals(Object obj) {
        if(!(obj instanceof TextPatchPart))
            return false;
        TextPatchPart other=(TextPatchPart)obj;
        return removed_ids.equals(other.removed_ids) && removed_text.equals(other.removed_text)
          && inserted_ids.equals(other.inserted_ids) && inserted_text.equals(other.inserted_text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(removed_ids, removed_text, inserted_ids, inserted_text);
    }

    @Override
    public String toString() {
        return String.format("removed=\"%s\" (%d ids), inserted=\"%s\" (%d ids)",
                             removed_text, removed_ids.size(), inserted_text, inserted_ids.size());
    }


    protected static int idsSize(List<Identifier> ids) {
        int retval=Bits.size(ids.size());
        for(Identifier id: ids)
            retval+=id.serializedSize();
        return retval;
    }

    protected static void writeIds(List<Identifier> ids, DataOutput out) throws IOException {
        Bits.writeIntCompressed(ids.size(), out);
        for(Identifier id: ids)
            id.writeTo(out);
    }

    protected static List<Identifier> readIds(DataInput in) throws IOException {
        int size=Bits.readIntCompressed(in);
        if(size < 0)
            throw new IOException("negative identifier count: " + size);
        if(size == 0)
            return Collections.emptyList();
        List<Identifier> ids=new ArrayList<>(size);
        for(int i=0; i < size; i++)
            ids.add(Identifier.readFrom(in));
        return Collections.unmodifiableList(ids);
    }

    protected static int textSize(String text) {
        return Bits.size(text.length()) + text.length() * Character.BYTES;
    }

    protected static void writeText(String text, DataOutput out) throws IOException {
        Bits.writeIntCompressed(text.length(), out);
        out.writeChars(text);
    }

    protected static String readText(DataInput in) throws IOException {
        int len=Bits.readIntCompressed(in);
        if(len < 0)
            throw new IOException("negative text length: " + len);
        char[] buf=new char[len];
        for(int i=0; i < len; i++)
            buf[i]=in.readChar();
        return new String(buf);
    }
}
