package org.collabstore.field;

import org.collabstore.configuration.Property;
import org.collabstore.configuration.RuntimeProperties;
import org.collabstore.crdt.Cemetery;
import org.collabstore.crdt.Chunks;
import org.collabstore.crdt.Chunks.Chunk;
import org.collabstore.crdt.Identifier;
import org.collabstore.crdt.IdentifierAllocator;
import org.collabstore.crdt.IdentifierList;
import org.collabstore.exceptions.CollabStoreException;
import org.jgroups.logging.Log;
import org.jgroups.logging.LogFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import net.jcip.annotations.ThreadSafe;

import static org.collabstore.configuration.RuntimeProperties.PROPERTY_PREFIX;

/**
 * A collaborative text field.
 * <p>
 * Every character carries an {@link Identifier}; the identifiers of a value are kept strictly increasing, so the
 * position of a character on every replica is decided by identifier order alone, never by arrival order.
 * </p>
 *
 * <h3>Local updates</h3>
 * <p>
 * Each {@link Splice} is clamped to the current value, gets fresh identifiers between its neighbors and produces one
 * {@link TextChangePart} and one {@link TextPatchPart}. Splices of one update see the effect of the previous ones and
 * share the version of the update.
 * </p>
 *
 * <h3>Remote patches</h3>
 * <p>
 * Removals are applied first, then insertions, each scanning the patch from its end. A removal of an identifier which
 * does not exist leaves a tombstone in the {@link Cemetery}; an insertion of a tombstoned identifier consumes the
 * tombstone and inserts nothing; an insertion of an identifier which already exists is a duplicate and is skipped.
 * The returned change only reports what happened to the local value.
 * </p>
 *
 * Instances are immutable and can be shared by any number of replicas; the state lives in the value and the
 * {@link TextMetadata} passed to each call.
 *
 * @since 1.0
 */
@ThreadSafe
public class TextField implements Field<String, List<Splice>, TextMetadata, List<TextChangePart>, TextPatch> {
    protected static final Log log=LogFactory.getLog(TextField.class);

    public static final String TYPE="text";

    public static final String TEXT_PROPERTY_PREFIX=PROPERTY_PREFIX + ".text";

    public static final Property CHECK_INVARIANTS=Property.create(TEXT_PROPERTY_PREFIX + ".check-invariants")
      .label("Check text invariants")
      .description("Verify that identifiers are strictly increasing after every update and patch")
      .defaultValue(false)
      .build();

    protected static final Identifier[] NO_IDS={};

    protected final String  description;
    protected final boolean check_invariants;
    protected final long    boundary;

    public TextField() {
        this(builder());
    }

    protected TextField(Builder builder) {
        RuntimeProperties props=builder.properties;
        this.description=builder.description;
        this.check_invariants=props.getBoolean(CHECK_INVARIANTS);
        this.boundary=props.getLong(IdentifierAllocator.BOUNDARY);
        if(boundary < 0)
            throw new IllegalArgumentException(String.format("%s must be >= 0: %d", IdentifierAllocator.BOUNDARY.name(), boundary));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override public String  type()            {return TYPE;}
    @Override public String  description()     {return description;}
    public boolean           checkInvariants() {return check_invariants;}
    public long              boundary()        {return boundary;}

    @Override
    public String createValue() {
        return "";
    }

    @Override
    public TextMetadata createMetadata() {
        return new TextMetadata();
    }

    /** Applies a single splice, see {@link #applyUpdate(UpdateArgs)} */
    public UpdateResult<String, List<TextChangePart>, TextPatch> applyUpdate(String previous, Splice splice, TextMetadata metadata,
                                                                              long version, long store_id) {
        return applyUpdate(new UpdateArgs<>(previous, List.of(splice), metadata, version, store_id));
    }

    @Override
    public UpdateResult<String, List<TextChangePart>, TextPatch> applyUpdate(UpdateArgs<String, List<Splice>, TextMetadata> args) {
        TextMetadata metadata=args.metadata();
        IdentifierList ids=metadata.ids();
        String value=args.previous();
        checkLength(value, metadata);

        IdentifierAllocator allocator=new IdentifierAllocator(args.version(), args.storeId(), boundary);
        List<TextChangePart> change=new ArrayList<>(args.update().size());
        TextPatch patch=new TextPatch();
        for(Splice splice: args.update()) {
            int count=value.length();
            int index=splice.index() < 0? Math.max(0, splice.index() + count) : Math.min(splice.index(), count);
            int remove=Math.max(0, Math.min(splice.remove(), count - index));
            String text=splice.text();

            Identifier lower=index > 0? ids.get(index - 1) : null;
            Identifier upper=index < count? ids.get(index) : null;
            Identifier[] inserted_ids=allocator.allocate(lower, upper, text.length());
            Identifier[] removed_ids=ids.splice(index, remove, inserted_ids);

            String removed_text=value.substring(index, index + remove);
            value=value.substring(0, index) + text + value.substring(index + remove);
            change.add(new TextChangePart(index, removed_text, text));
            patch.add(new TextPatchPart(Arrays.asList(removed_ids), removed_text, Arrays.asList(inserted_ids), text));
        }
        checkOrder(metadata);
        return new UpdateResult<>(value, change, patch);
    }

    @Override
    public PatchResult<String, List<TextChangePart>> applyPatch(PatchArgs<String, TextPatch, TextMetadata> args) {
        TextMetadata metadata=args.metadata();
        checkLength(args.previous(), metadata);
        StringBuilder value=new StringBuilder(args.previous());
        List<TextChangePart> change=new ArrayList<>();
        for(TextPatchPart part: args.patch()) {
            applyRemovals(value, metadata, part.removedIds(), change);
            applyInsertions(value, metadata, part.insertedIds(), part.insertedText(), change);
        }
        checkOrder(metadata);
        return new PatchResult<>(value.toString(), change);
    }

    public PatchResult<String, List<TextChangePart>> applyPatch(String previous, TextPatch patch, TextMetadata metadata) {
        return applyPatch(new PatchArgs<>(previous, patch, metadata));
    }

    @Override
    public List<TextChangePart> mergeChange(List<TextChangePart> first, List<TextChangePart> second) {
        List<TextChangePart> retval=new ArrayList<>(first.size() + second.size());
        retval.addAll(first);
        retval.addAll(second);
        return retval;
    }

    @Override
    public TextPatch mergePatch(TextPatch first, TextPatch second) {
        return new TextPatch().addAll(first).addAll(second);
    }

    protected void applyRemovals(StringBuilder value, TextMetadata metadata, List<Identifier> removed,
                                 List<TextChangePart> change) {
        IdentifierList ids=metadata.ids();
        Cemetery cemetery=metadata.cemetery();
        for(int end=removed.size(); end > 0;) {
            Chunk chunk=Chunks.removed(ids, removed, end);
            if(chunk.kind() == Chunks.Kind.PRESENT) {
                int from=chunk.index(), to=from + chunk.size();
                ids.splice(from, chunk.size(), NO_IDS);
                String text=value.substring(from, to);
                value.delete(from, to);
                change.add(new TextChangePart(from, text, ""));
            }
            else {
                for(int i=chunk.from(); i < chunk.to(); i++) {
                    Identifier id=removed.get(i);
                    int count=cemetery.bury(id);
                    if(log.isTraceEnabled())
                        log.trace("%s: removal of %s arrived before its insertion (tombstones: %d)", this, id, count);
                }
            }
            end=chunk.from();
        }
    }

    protected void applyInsertions(StringBuilder value, TextMetadata metadata, List<Identifier> inserted, String text,
                                   List<TextChangePart> change) {
        IdentifierList ids=metadata.ids();
        Cemetery cemetery=metadata.cemetery();
        for(int end=inserted.size(); end > 0;) {
            Chunk chunk=Chunks.inserted(ids, inserted, end, cemetery::contains);
            if(chunk.kind() == Chunks.Kind.ABSENT) {
                Identifier[] run=inserted.subList(chunk.from(), chunk.to()).toArray(NO_IDS);
                String chars=text.substring(chunk.from(), chunk.to());
                ids.splice(chunk.index(), 0, run);
                value.insert(chunk.index(), chars);
                change.add(new TextChangePart(chunk.index(), "", chars));
            }
            else if(chunk.kind() == Chunks.Kind.TOMBSTONED) {
                Identifier id=inserted.get(chunk.from());
                cemetery.exhume(id);
                if(log.isTraceEnabled())
                    log.trace("%s: dropped insertion of %s, removed before it arrived (tombstones left: %d)",
                              this, id, cemetery.get(id));
            }
            else if(log.isTraceEnabled())
                log.trace("%s: skipped %d already inserted ids at %d", this, chunk.size(), chunk.index());
            end=chunk.from();
        }
    }

    protected static void checkLength(String value, TextMetadata metadata) {
        Objects.requireNonNull(value, "value can not be null");
        if(metadata.size() != value.length())
            throw CollabStoreException.invariant("metadata holds %d ids for a value of %d chars",
                                                 metadata.size(), value.length());
    }

    protected void checkOrder(TextMetadata metadata) {
        if(!check_invariants)
            return;
        int index=metadata.ids().firstDisorder();
        if(index >= 0)
            throw CollabStoreException.invariant("ids not strictly increasing at %d: %s >= %s", index,
                                                 metadata.ids().get(index - 1), metadata.ids().get(index));
    }

    @Override
    public String toString() {
        return description.isEmpty()? TYPE : String.format("%s[%s]", TYPE, description);
    }


    public static final class Builder {
        private String            description="";
        private RuntimeProperties properties=RuntimeProperties.EMPTY;

        private Builder() { }

        public Builder withDescription(String description) {
            this.description=Objects.requireNonNull(description, "description can not be null");
            return this;
        }

        public Builder withProperties(RuntimeProperties properties) {
            this.properties=Objects.requireNonNull(properties, "properties can not be null");
            return this;
        }

        public TextField build() {
            return new TextField(this);
        }
    }
}
