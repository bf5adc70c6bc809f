package eu.nebulouscloud.deployr.backend;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import eu.nebulouscloud.deployr.model.Topology;

/**
 * The capabilities DeployR needs from the distributed runtime it runs on:
 * participant identity, a blocking RPC primitive and shared memory with
 * collective exchange.  One backend object exists per participant.
 *
 * <p>Implementations decide once, at construction, how participants are
 * realized (threads, processes, emulated cloud instances); the coordinator
 * protocol and the channel builder only ever talk to this interface.
 *
 * <p>Blocking operations ({@link #listen}, {@link #getReturnValue}, {@link
 * #exchangeGlobalMemorySlots}, {@link #fence}) have no timeout.  When the
 * job is aborted by any participant they throw {@link JobAbortedException}.
 */
public interface Backend {

    /** The id of this participant. */
    long getLocalParticipantId();

    /** The id of the participant that runs the matcher. */
    long getCoordinatorId();

    /**
     * All participant ids, including this one, in a fixed order that is the
     * same on every participant.  A participant's host index is its position
     * in this list.
     */
    List<Long> getParticipantIds();

    default boolean isCoordinator() {
        return getLocalParticipantId() == getCoordinatorId();
    }

    default int getLocalHostIndex() {
        return getParticipantIds().indexOf(getLocalParticipantId());
    }

    /** Probe the hardware of this participant. */
    Topology detectLocalTopology();

    // ----------------------------------------
    // RPC

    /** Make {@code target} callable by other participants under {@code name}. */
    void registerRpc(String name, RpcTarget target);

    /**
     * Block until one RPC request arrives, then run its target.  Returns
     * after the target has finished.
     *
     * @throws IllegalStateException if the request names an RPC that was
     *  not registered.
     */
    void listen();

    /** Ask participant {@code targetId} to run the RPC {@code name}. */
    void requestRpc(long targetId, String name, byte[] argument);

    default void requestRpc(long targetId, String name) {
        requestRpc(targetId, name, new byte[0]);
    }

    /**
     * Send a return value to the participant whose request is currently
     * being serviced.  Only valid inside an {@link RpcTarget}.
     */
    void submitReturnValue(byte[] value);

    /** Block until participant {@code targetId} returns a value to us. */
    byte[] getReturnValue(long targetId);

    // ----------------------------------------
    // Memory

    /** Allocate zero-initialized local memory. */
    MemorySlot allocateLocalMemorySlot(long size);

    void freeLocalMemorySlot(MemorySlot slot);

    /** Make existing memory usable as a source or target of {@link #memcpy}. */
    MemorySlot registerLocalMemorySlot(ByteBuffer buffer);

    void deregisterLocalMemorySlot(MemorySlot slot);

    /**
     * Collectively publish memory slots under {@code tag}.  Every
     * participant must call this, possibly with an empty map; keys must be
     * unique per tag across all participants.  Returns once every
     * participant's slots are visible.
     */
    void exchangeGlobalMemorySlots(long tag, Map<Long, MemorySlot> slots);

    /** Collective barrier over all participants. */
    void fence(long tag);

    /**
     * Look up a slot published under {@code tag} and {@code key}.
     *
     * @throws IllegalStateException if no such slot was published.
     */
    MemorySlot getGlobalMemorySlot(long tag, long key);

    /** Copy {@code size} bytes; offsets are in bytes. */
    void memcpy(MemorySlot destination, long destinationOffset, MemorySlot source, long sourceOffset, long size);

    /** Acquire the mutual-exclusion lock attached to a global slot. */
    void acquireLock(MemorySlot slot);

    void releaseLock(MemorySlot slot);

    // ----------------------------------------
    // Lifecycle

    /**
     * Abort the whole job: every participant blocked in, or later entering,
     * a blocking operation gets a {@link JobAbortedException}.
     */
    void abort(int exitCode);

    /** Orderly shutdown after a successful run. */
    void shutdown();
}
