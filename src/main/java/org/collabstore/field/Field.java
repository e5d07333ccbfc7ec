package org.collabstore.field;

import java.util.Objects;

/**
 * A replicated field type.
 * <p>
 * A field is stateless: it describes how a value of type {@code V} and its bookkeeping metadata {@code M} evolve.
 * Local edits ({@code U}) go through {@link #applyUpdate(UpdateArgs)}, which returns the new value, the user-facing
 * change ({@code C}) and the replica-facing patch ({@code P}). Patches produced by other replicas go through
 * {@link #applyPatch(PatchArgs)}. The metadata is mutated in place by both and must never be shared between replicas.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Applying the same multiset of patches to two replicas which started from the same state must produce the same
 * value, whatever the delivery order and however often a patch is delivered.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * A replica calls into a field from one thread at a time. Implementations need no locking, but the value and the
 * metadata of one replica must not be touched concurrently.
 * </p>
 *
 * @param <V> the value type
 * @param <U> the update type
 * @param <M> the metadata type
 * @param <C> the change type
 * @param <P> the patch type
 * @since 1.0
 */
public interface Field<V, U, M, C, P> {

    /** The discriminated type name of the field, e.g. {@code "text"} */
    String type();

    /** The human-readable description of the field, never null */
    String description();

    V createValue();

    M createMetadata();

    /**
     * Applies a local update.
     *
     * @param args the previous value, the update, the metadata, and the identity of the local replica
     * @return the new value, the change for observers and the patch for the other replicas
     */
    UpdateResult<V, C, P> applyUpdate(UpdateArgs<V, U, M> args);

    /**
     * Applies a patch created by another replica.
     *
     * @param args the previous value, the patch and the metadata
     * @return the new value and the net change to it
     */
    PatchResult<V, C> applyPatch(PatchArgs<V, P, M> args);

    /** Combines two sequential changes into one */
    C mergeChange(C first, C second);

    /** Combines two sequential patches into one */
    P mergePatch(P first, P second);


    /**
     * @param version the monotonic version of the local replica
     * @param storeId the id of the local replica
     */
    record UpdateArgs<V, U, M>(V previous, U update, M metadata, long version, long storeId) {
        public UpdateArgs {
            Objects.requireNonNull(previous, "previous can not be null");
            Objects.requireNonNull(update, "update can not be null");
            Objects.requireNonNull(metadata, "metadata can not be null");
        }
    }

    record UpdateResult<V, C, P>(V value, C change, P patch) { }

    record PatchArgs<V, P, M>(V previous, P patch, M metadata) {
        public PatchArgs {
            Objects.requireNonNull(previous, "previous can not be null");
            Objects.requireNonNull(patch, "patch can not be null");
            Objects.requireNonNull(metadata, "metadata can not be null");
        }
    }

    record PatchResult<V, C>(V value, C change) { }
}
