package org.collabstore.testfwk;

import org.collabstore.blocks.ReplicatedText;
import org.collabstore.field.TextPatch;
import org.jgroups.logging.Log;
import org.jgroups.logging.LogFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import net.jcip.annotations.NotThreadSafe;

/**
 * Connects a number of {@link ReplicatedText} replicas in memory, to be used in unit tests.
 *
 * <p>
 * Every local update of a replica is captured as a pending delivery to each of the other replicas. Nothing is
 * delivered until the test asks for it, which gives the test full control over ordering: deliveries can be flushed
 * in order, shuffled, duplicated, or held back for a replica whose traffic is dropped. Patches travel in their wire
 * form, so each delivery also exercises the codec.
 * </p>
 *
 * @since 1.0
 */
@NotThreadSafe
public class ReplicaCluster {
    protected static final Log log=LogFactory.getLog(ReplicaCluster.class);

    protected final Map<Long,ReplicatedText> replicas=new LinkedHashMap<>();
    protected final List<Delivery>           pending=new ArrayList<>();
    protected final Set<Long>                dropped=new HashSet<>();
    protected int                            delivered;

    /**
     * Adds a replica. The store id of the replica must be unique in the cluster.
     *
     * @return the replica
     */
    public ReplicatedText add(ReplicatedText replica) {
        long id=replica.storeId();
        if(replicas.containsKey(id))
            throw new IllegalArgumentException("duplicate store id " + id);
        replicas.put(id, replica);
        replica.addListener((text, change, patch) -> {
            if(patch == null)
                return;
            try {
                send(text.storeId(), patch);
            }
            catch(IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        return replica;
    }

    public ReplicatedText       get(long store_id)  {return replicas.get(store_id);}
    public Collection<ReplicatedText> replicas()    {return Collections.unmodifiableCollection(replicas.values());}
    public int                  size()              {return replicas.size();}
    public int                  pending()           {return pending.size();}
    public int                  delivered()         {return delivered;}

    /** Holds back deliveries to the replica until {@link #clearDroppedTraffic()} is called */
    public ReplicaCluster dropTrafficTo(long store_id) {dropped.add(store_id); return this;}
    public ReplicaCluster clearDroppedTraffic()        {dropped.clear(); return this;}

    /** Delivers pending patches in the order they were sent; patches sent during delivery are delivered too */
    public int deliverAll() throws IOException {
        return deliverAll(null);
    }

    /**
     * Delivers pending patches in random order until nothing deliverable is left.
     *
     * @param random the source of the delivery order, or null for the order in which the patches were sent
     * @return the number of patches delivered
     */
    public int deliverAll(Random random) throws IOException {
        int count=0;
        for(;;) {
            List<Delivery> round=new ArrayList<>();
            for(Iterator<Delivery> it=pending.iterator(); it.hasNext();) {
                Delivery d=it.next();
                if(!dropped.contains(d.target())) {
                    round.add(d);
                    it.remove();
                }
            }
            if(round.isEmpty())
                break;
            if(random != null)
                Collections.shuffle(round, random);
            log.debug("delivering %d patch(es), %d held back", round.size(), pending.size());
            for(Delivery d: round) {
                ReplicatedText target=replicas.get(d.target());
                if(target != null)
                    target.apply(TextPatch.fromByteArray(d.patch()));
                count++;
            }
        }
        delivered+=count;
        return count;
    }

    /** Queues a second copy of every pending delivery, simulating at-least-once delivery */
    public ReplicaCluster duplicatePending() {
        pending.addAll(new ArrayList<>(pending));
        return this;
    }

    /** Reverses the order of pending deliveries, so the most recent patches arrive first */
    public ReplicaCluster reversePending() {
        Collections.reverse(pending);
        return this;
    }

    /** Discards all pending deliveries */
    public ReplicaCluster clearPending() {
        pending.clear();
        return this;
    }

    /** True if all replicas hold the same value */
    public boolean converged() {
        return values().stream().distinct().count() <= 1;
    }

    public List<String> values() {
        List<String> retval=new ArrayList<>(replicas.size());
        for(ReplicatedText r: replicas.values())
            retval.add(r.value());
        return retval;
    }

    protected void send(long source, TextPatch patch) throws IOException {
        byte[] buf=patch.toByteArray();
        for(long target: replicas.keySet()) {
            if(target != source)
                pending.add(new Delivery(source, target, buf));
        }
    }

    @Override
    public String toString() {
        return String.format("%d replicas: %s, %d pending%s", replicas.size(), replicas.keySet(), pending.size(),
                             dropped.isEmpty()? "" : String.format(" (dropping traffic to %s)", dropped));
    }

    protected record Delivery(long source, long target, byte[] patch) { }
}
