package eu.nebulouscloud.deployr.channel;

import static eu.nebulouscloud.deployr.channel.ChannelLayout.COORDINATION_SIZE;
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
 * The producing side of a channel.  Producers may live on any participant;
 * they only touch the consumer's buffers through the backend, under the
 * lock of the consumer's token coordination buffer, so several producers
 * can push into the same channel.
 */
@Slf4j
public class ChannelProducer {

    private final Backend backend;
    private final String channelName;
    private final long capacity;
    private final long bufferSize;
    private final MemorySlot tokenBuffer;
    private final MemorySlot payloadBuffer;
    private final MemorySlot tokenCoordination;
    private final MemorySlot payloadCoordination;
    // Private copies of the consumer's coordination buffers
    private final MemorySlot localTokenCoordination;
    private final MemorySlot localPayloadCoordination;
    private final MemorySlot recordStaging;

    ChannelProducer(Backend backend, String channelName, long capacity, long bufferSize,
                    MemorySlot tokenBuffer, MemorySlot payloadBuffer,
                    MemorySlot tokenCoordination, MemorySlot payloadCoordination,
                    MemorySlot localTokenCoordination, MemorySlot localPayloadCoordination,
                    MemorySlot recordStaging)
    {
        this.backend = backend;
        this.channelName = channelName;
        this.capacity = capacity;
        this.bufferSize = bufferSize;
        this.tokenBuffer = tokenBuffer;
        this.payloadBuffer = payloadBuffer;
        this.tokenCoordination = tokenCoordination;
        this.payloadCoordination = payloadCoordination;
        this.localTokenCoordination = localTokenCoordination;
        this.localPayloadCoordination = localPayloadCoordination;
        this.recordStaging = recordStaging;
    }

    /**
     * Copy the first {@code size} bytes of {@code data} into the channel as
     * one token.  Never blocks.
     *
     * @return true if the token was pushed, false if the channel holds
     *  {@code capacity} tokens already or the payload does not fit into the
     *  free part of the payload buffer.
     */
    public boolean push(byte[] data, int size) {
        if (size < 0 || size > data.length) {
            throw new IllegalArgumentException("Cannot push " + size + " bytes from a buffer of "
                + data.length + " bytes");
        }
        backend.acquireLock(tokenCoordination);
        try {
            backend.memcpy(localTokenCoordination, 0, tokenCoordination, 0, COORDINATION_SIZE);
            backend.memcpy(localPayloadCoordination, 0, payloadCoordination, 0, COORDINATION_SIZE);
            ByteBuffer tokens = localTokenCoordination.getBuffer();
            ByteBuffer payloads = localPayloadCoordination.getBuffer();
            long tokenHead = tokens.getLong(HEAD_OFFSET);
            long tokenTail = tokens.getLong(TAIL_OFFSET);
            long payloadHead = payloads.getLong(HEAD_OFFSET);
            long payloadTail = payloads.getLong(TAIL_OFFSET);

            if (tokenTail - tokenHead >= capacity) {
                log.debug("Channel '{}' full: {} tokens", channelName, capacity);
                return false;
            }
            long start = payloadTail;
            long position = start % bufferSize;
            if (position + size > bufferSize) {
                // Payloads are contiguous; skip the rest of the ring
                start += bufferSize - position;
            }
            if (start + size - payloadHead > bufferSize) {
                log.debug("Channel '{}': no room for {} bytes of payload", channelName, size);
                return false;
            }

            MemorySlot source = backend.registerLocalMemorySlot(ByteBuffer.wrap(data));
            try {
                backend.memcpy(payloadBuffer, start % bufferSize, source, 0, size);
            } finally {
                backend.deregisterLocalMemorySlot(source);
            }
            recordStaging.getBuffer()
                .putLong(RECORD_START_OFFSET, start)
                .putLong(RECORD_SIZE_OFFSET, size);
            backend.memcpy(tokenBuffer, (tokenTail % capacity) * RECORD_SIZE, recordStaging, 0, RECORD_SIZE);

            tokens.putLong(TAIL_OFFSET, tokenTail + 1);
            payloads.putLong(TAIL_OFFSET, start + size);
            backend.memcpy(payloadCoordination, 0, localPayloadCoordination, 0, COORDINATION_SIZE);
            backend.memcpy(tokenCoordination, 0, localTokenCoordination, 0, COORDINATION_SIZE);
            log.trace("Pushed {} bytes into channel '{}'", size, channelName);
            return true;
        } finally {
            backend.releaseLock(tokenCoordination);
        }
    }
}
