package eu.nebulouscloud.deployr.channel;

import eu.nebulouscloud.deployr.model.Channel;

/**
 * Memory layout shared by producers and consumers of a channel.
 *
 * <p>The consumer owns four buffers: a token ring of {@code capacity}
 * records, a payload ring of {@code bufferSize} bytes and two coordination
 * buffers holding the head and tail counters of the two rings.  Counters
 * grow monotonically; positions in a ring are counters modulo its size.
 * A token record holds the payload counter where the payload starts and
 * its size.
 */
final class ChannelLayout {

    private ChannelLayout() { }

    /** Tags of channel memory exchanges start here, plus the channel's index. */
    static final long CHANNEL_TAG_BASE = 0x1000;

    static final long TOKEN_BUFFER_KEY = 0;
    static final long PAYLOAD_BUFFER_KEY = 1;
    static final long TOKEN_COORDINATION_KEY = 2;
    static final long PAYLOAD_COORDINATION_KEY = 3;

    static final int HEAD_OFFSET = 0;
    static final int TAIL_OFFSET = Long.BYTES;
    static final int COORDINATION_SIZE = 2 * Long.BYTES;

    static final int RECORD_START_OFFSET = 0;
    static final int RECORD_SIZE_OFFSET = Long.BYTES;
    static final int RECORD_SIZE = Channel.TOKEN_RECORD_SIZE;
}
