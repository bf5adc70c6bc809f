package eu.nebulouscloud.deployr.local;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

import eu.nebulouscloud.deployr.backend.Backend;
import eu.nebulouscloud.deployr.backend.MemorySlot;
import eu.nebulouscloud.deployr.backend.RpcTarget;
import eu.nebulouscloud.deployr.model.Topology;
import lombok.extern.slf4j.Slf4j;

/**
 * The backend of one participant of a {@link LocalCluster}.  Memory slots
 * are heap buffers; global slots are shared by reference, so {@link
 * #memcpy} between participants is a plain copy guarded by the slot locks.
 */
@Slf4j
public class LocalBackend implements Backend {

    private static final class RpcCall {
        final long sourceId;
        final String name;
        final byte[] argument;

        RpcCall(long sourceId, String name, byte[] argument) {
            this.sourceId = sourceId;
            this.name = name;
            this.argument = argument;
        }
    }

    private final LocalCluster cluster;
    private final long participantId;
    private final Map<String, RpcTarget> rpcTargets = new ConcurrentHashMap<>();
    private final BlockingQueue<RpcCall> inbox = new LinkedBlockingQueue<>();
    /** Return values sent to us, keyed by the id of the sender. */
    private final Map<Long, BlockingQueue<byte[]>> returnValues = new ConcurrentHashMap<>();
    private final Set<MemorySlot> localSlots = ConcurrentHashMap.newKeySet();
    /** The caller of the RPC currently being serviced by {@link #listen}. */
    private Long currentCaller = null;

    LocalBackend(LocalCluster cluster, long participantId) {
        this.cluster = cluster;
        this.participantId = participantId;
    }

    @Override
    public long getLocalParticipantId() {
        return participantId;
    }

    @Override
    public long getCoordinatorId() {
        return 0;
    }

    @Override
    public List<Long> getParticipantIds() {
        return cluster.getParticipantIds();
    }

    @Override
    public Topology detectLocalTopology() {
        return cluster.getTopology(Math.toIntExact(participantId));
    }

    @Override
    public void registerRpc(String name, RpcTarget target) {
        rpcTargets.put(name, target);
    }

    @Override
    public void listen() {
        RpcCall call = cluster.take(inbox);
        RpcTarget target = rpcTargets.get(call.name);
        if (target == null) {
            throw new IllegalStateException("Participant " + call.sourceId
                + " requested unknown RPC " + call.name);
        }
        log.trace("Servicing RPC {} for participant {}", call.name, call.sourceId);
        currentCaller = call.sourceId;
        try {
            target.handle(call.argument);
        } finally {
            currentCaller = null;
        }
    }

    @Override
    public void requestRpc(long targetId, String name, byte[] argument) {
        cluster.checkAborted();
        log.trace("Requesting RPC {} from participant {}", name, targetId);
        cluster.getBackend(Math.toIntExact(targetId)).inbox.add(new RpcCall(participantId, name, argument.clone()));
    }

    @Override
    public void submitReturnValue(byte[] value) {
        if (currentCaller == null) {
            throw new IllegalStateException("Return value submitted outside of an RPC");
        }
        cluster.getBackend(Math.toIntExact(currentCaller)).returnQueue(participantId).add(value.clone());
    }

    @Override
    public byte[] getReturnValue(long targetId) {
        return cluster.take(returnQueue(targetId));
    }

    private BlockingQueue<byte[]> returnQueue(long senderId) {
        return returnValues.computeIfAbsent(senderId, id -> new LinkedBlockingQueue<>());
    }

    @Override
    public MemorySlot allocateLocalMemorySlot(long size) {
        MemorySlot slot = new MemorySlot(participantId, ByteBuffer.allocate(Math.toIntExact(size)));
        localSlots.add(slot);
        return slot;
    }

    @Override
    public void freeLocalMemorySlot(MemorySlot slot) {
        if (!localSlots.remove(slot)) {
            log.warn("Freeing memory slot {} that was not allocated by participant {}", slot, participantId);
        }
    }

    @Override
    public MemorySlot registerLocalMemorySlot(ByteBuffer buffer) {
        MemorySlot slot = new MemorySlot(participantId, buffer);
        localSlots.add(slot);
        return slot;
    }

    @Override
    public void deregisterLocalMemorySlot(MemorySlot slot) {
        freeLocalMemorySlot(slot);
    }

    @Override
    public void exchangeGlobalMemorySlots(long tag, Map<Long, MemorySlot> slots) {
        cluster.publish(tag, slots);
        cluster.await();
    }

    @Override
    public void fence(long tag) {
        cluster.await();
    }

    @Override
    public MemorySlot getGlobalMemorySlot(long tag, long key) {
        return cluster.lookup(tag, key);
    }

    @Override
    public void memcpy(MemorySlot destination, long destinationOffset,
                       MemorySlot source, long sourceOffset, long size)
    {
        if (destinationOffset + size > destination.getSize() || sourceOffset + size > source.getSize()) {
            throw new IndexOutOfBoundsException("memcpy of " + size + " bytes from offset " + sourceOffset
                + " of " + source + " to offset " + destinationOffset + " of " + destination);
        }
        destination.getBuffer().put(Math.toIntExact(destinationOffset),
            source.getBuffer(), Math.toIntExact(sourceOffset), Math.toIntExact(size));
    }

    @Override
    public void acquireLock(MemorySlot slot) {
        // Channel users spin on peek, so this is where they notice an abort
        cluster.checkAborted();
        cluster.lockFor(slot).lock();
    }

    @Override
    public void releaseLock(MemorySlot slot) {
        cluster.lockFor(slot).unlock();
    }

    @Override
    public void abort(int exitCode) {
        cluster.abort(exitCode, participantId);
    }

    @Override
    public void shutdown() {
        log.debug("Participant {} shutting down", participantId);
        localSlots.clear();
    }
}
