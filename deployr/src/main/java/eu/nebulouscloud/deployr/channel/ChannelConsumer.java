package eu.nebulouscloud.deployr.channel;

import static eu.nebulouscloud.deployr.channel.ChannelLayout.HEAD_OFFSET;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.RECORD_SIZE;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.RECORD_SIZE_OFFSET;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.RECORD_START_OFFSET;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.TAIL_OFFSET;

import java.nio.ByteBuffer;

import eu.nebulouscloud.deployr.backend.Backend;
import eu.nebulouscloud.deployr.backend.MemorySlot;
import lombok.extern.slf4j.Slf4j;

/**
 * The consuming side of a channel.  The consumer owns all shared buffers
 * of its channel and reads them directly.
 */
@Slf4j
public class ChannelConsumer {

    private final Backend backend;
    private final String channelName;
    private final long capacity;
    private final long bufferSize;
    private final MemorySlot tokenBuffer;
    private final MemorySlot payloadBuffer;
    private final MemorySlot tokenCoordination;
    private final MemorySlot payloadCoordination;

    ChannelConsumer(Backend backend, String channelName, long capacity, long bufferSize,
                    MemorySlot tokenBuffer, MemorySlot payloadBuffer,
                    MemorySlot tokenCoordination, MemorySlot payloadCoordination)
    {
        this.backend = backend;
        this.channelName = channelName;
        this.capacity = capacity;
        this.bufferSize = bufferSize;
        this.tokenBuffer = tokenBuffer;
        this.payloadBuffer = payloadBuffer;
        this.tokenCoordination = tokenCoordination;
        this.payloadCoordination = payloadCoordination;
    }

    /** Look at the oldest token without removing it.  Never blocks. */
    public ChannelToken peek() {
        backend.acquireLock(tokenCoordination);
        try {
            ByteBuffer tokens = tokenCoordination.getBuffer();
            long head = tokens.getLong(HEAD_OFFSET);
            if (head == tokens.getLong(TAIL_OFFSET)) return ChannelToken.empty();
            int record = recordOffset(head);
            int start = Math.toIntExact(tokenBuffer.getBuffer().getLong(record + RECORD_START_OFFSET) % bufferSize);
            int size = Math.toIntExact(tokenBuffer.getBuffer().getLong(record + RECORD_SIZE_OFFSET));
            return ChannelToken.of(payloadBuffer.getBuffer().slice(start, size));
        } finally {
            backend.releaseLock(tokenCoordination);
        }
    }

    /**
     * Remove the oldest token, releasing its payload space.
     *
     * @return false if the channel was empty.
     */
    public boolean pop() {
        backend.acquireLock(tokenCoordination);
        try {
            ByteBuffer tokens = tokenCoordination.getBuffer();
            long head = tokens.getLong(HEAD_OFFSET);
            if (head == tokens.getLong(TAIL_OFFSET)) return false;
            int record = recordOffset(head);
            long start = tokenBuffer.getBuffer().getLong(record + RECORD_START_OFFSET);
            long size = tokenBuffer.getBuffer().getLong(record + RECORD_SIZE_OFFSET);
            tokens.putLong(HEAD_OFFSET, head + 1);
            payloadCoordination.getBuffer().putLong(HEAD_OFFSET, start + size);
            log.trace("Popped {} bytes from channel '{}'", size, channelName);
            return true;
        } finally {
            backend.releaseLock(tokenCoordination);
        }
    }

    /** Number of tokens currently in the channel. */
    public long getDepth() {
        backend.acquireLock(tokenCoordination);
        try {
            ByteBuffer tokens = tokenCoordination.getBuffer();
            return tokens.getLong(TAIL_OFFSET) - tokens.getLong(HEAD_OFFSET);
        } finally {
            backend.releaseLock(tokenCoordination);
        }
    }

    private int recordOffset(long tokenCounter) {
        return Math.toIntExact((tokenCounter % capacity) * RECORD_SIZE);
    }
}
