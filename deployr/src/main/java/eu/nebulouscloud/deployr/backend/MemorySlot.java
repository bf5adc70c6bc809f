package eu.nebulouscloud.deployr.backend;

import java.nio.ByteBuffer;

import lombok.Getter;

/**
 * A contiguous region of memory owned by one participant.  Backends that
 * share an address space hand out the same slot object to every
 * participant after a global exchange.
 */
public class MemorySlot {

    /** Id of the participant that allocated or registered this slot. */
    @Getter
    private final long ownerId;
    private final ByteBuffer buffer;

    public MemorySlot(long ownerId, ByteBuffer buffer) {
        this.ownerId = ownerId;
        this.buffer = buffer;
    }

    /**
     * The underlying memory.  Only absolute get and put operations may be
     * used, since the buffer is shared between threads.
     */
    public ByteBuffer getBuffer() {
        return buffer;
    }

    public long getSize() {
        return buffer.capacity();
    }

    @Override
    public String toString() {
        return "MemorySlot{owner=" + ownerId + ", size=" + getSize() + "}";
    }
}
