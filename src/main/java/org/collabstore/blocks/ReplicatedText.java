package org.collabstore.blocks;

import org.collabstore.crdt.Identifier;
import org.collabstore.field.Field.PatchResult;
import org.collabstore.field.Field.UpdateArgs;
import org.collabstore.field.Field.UpdateResult;
import org.collabstore.field.Splice;
import org.collabstore.field.TextChangePart;
import org.collabstore.field.TextField;
import org.collabstore.field.TextMetadata;
import org.collabstore.field.TextPatch;
import org.jgroups.logging.Log;
import org.jgroups.logging.LogFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

/**
 * One replica of a collaborative text: the value, its metadata and the local version, kept together.
 * <p>
 * Local edits return the {@link TextPatch} to ship to the other replicas; patches received from them are passed to
 * {@link #apply(TextPatch)}. Every update bumps the version once, so all identifiers created by one call carry the
 * same clock. Listeners are notified of every non-empty change, from the calling thread, while the replica is locked.
 * </p>
 *
 * @since 1.0
 */
@ThreadSafe
public class ReplicatedText {
    protected static final Log log=LogFactory.getLog(ReplicatedText.class);

    protected final TextField      field;
    protected final long           store_id;
    protected final List<Listener> listeners=new CopyOnWriteArrayList<>();

    @GuardedBy("this") protected final TextMetadata metadata;
    @GuardedBy("this") protected String             value;
    @GuardedBy("this") protected long               version;

    public ReplicatedText(TextField field, long store_id) {
        if(store_id < 0 || store_id > Identifier.MAX_STORE)
            throw new IllegalArgumentException("store id out of range: " + store_id);
        this.field=Objects.requireNonNull(field, "field can not be null");
        this.store_id=store_id;
        this.value=field.createValue();
        this.metadata=field.createMetadata();
    }

    public TextField                field()                           {return field;}
    public long                     storeId()                         {return store_id;}
    public synchronized long        version()                         {return version;}
    public synchronized String      value()                           {return value;}
    public synchronized int         size()                            {return value.length();}
    public synchronized boolean     isEmpty()                         {return value.isEmpty();}
    public ReplicatedText           addListener(Listener l)           {if(l != null) listeners.add(l); return this;}
    public ReplicatedText           removeListener(Listener l)        {listeners.remove(l); return this;}

    /** The tombstones still waiting for their insertion */
    public synchronized int tombstones() {
        return metadata.cemetery().size();
    }

    /**
     * The character at {@code index}; a negative index counts from the end.
     *
     * @throws IndexOutOfBoundsException if the index is outside the text
     */
    public synchronized char charAt(int index) {
        int len=value.length();
        int i=index < 0? index + len : index;
        if(i < 0 || i >= len)
            throw new IndexOutOfBoundsException(String.format("index %d out of bounds for length %d", index, len));
        return value.charAt(i);
    }

    /** The characters in {@code [start, stop)}; negative offsets count from the end, both are clamped */
    public synchronized String slice(int start, int stop) {
        int len=value.length();
        int from=clamp(start, len), to=clamp(stop, len);
        return from >= to? "" : value.substring(from, to);
    }

    public TextPatch assign(String text) {
        Objects.requireNonNull(text, "text can not be null");
        synchronized(this) {
            return update(List.of(new Splice(0, value.length(), text)));
        }
    }

    public TextPatch insert(int index, String text) {
        return update(List.of(Splice.insert(index, text)));
    }

    public TextPatch remove(int index, int count) {
        return update(List.of(Splice.remove(index, count)));
    }

    public TextPatch splice(int index, int remove, String text) {
        return update(List.of(new Splice(index, remove, text)));
    }

    public TextPatch clear() {
        synchronized(this) {
            return update(List.of(Splice.remove(0, value.length())));
        }
    }

    /** Applies a batch of splices as one update and returns the patch for the other replicas */
    public synchronized TextPatch update(List<Splice> splices) {
        UpdateResult<String,List<TextChangePart>,TextPatch> result=
          field.applyUpdate(new UpdateArgs<>(value, splices, metadata, version + 1, store_id));
        version++;
        value=result.value();
        if(log.isTraceEnabled())
            log.trace("%d: local update v%d with %d splice(s) -> %d chars", store_id, version, splices.size(), value.length());
        notifyListeners(result.change(), result.patch());
        return result.patch();
    }

    /** Applies a patch created by another replica and returns the change it caused */
    public synchronized List<TextChangePart> apply(TextPatch patch) {
        PatchResult<String,List<TextChangePart>> result=field.applyPatch(value, patch, metadata);
        value=result.value();
        if(log.isTraceEnabled())
            log.trace("%d: applied patch with %d part(s), %d change(s) -> %d chars", store_id, patch.size(),
                      result.change().size(), value.length());
        notifyListeners(result.change(), null);
        return result.change();
    }

    protected void notifyListeners(List<TextChangePart> change, TextPatch patch) {
        if(listeners.isEmpty())
            return;
        List<TextChangePart> parts=new ArrayList<>(change.size());
        for(TextChangePart part: change)
            if(!part.isEmpty())
                parts.add(part);
        if(parts.isEmpty())
            return;
        List<TextChangePart> c=List.copyOf(parts);
        for(Listener l: listeners)
            l.changed(this, c, patch);
    }

    protected static int clamp(int offset, int len) {
        return offset < 0? Math.max(0, offset + len) : Math.min(offset, len);
    }

    @Override
    public synchronized String toString() {
        return String.format("%d: v%d, %d chars, %d tombstones", store_id, version, value.length(),
                             metadata.cemetery().size());
    }


    /** Notified after the value of a replica changed */
    @FunctionalInterface
    public interface Listener {
        /**
         * @param text   the replica
         * @param change the non-empty parts of the change, in application order
         * @param patch  the outgoing patch for a local update, null for a remote patch
         */
        void changed(ReplicatedText text, List<TextChangePart> change, TextPatch patch);
    }
}
