package eu.nebulouscloud.deployr.channel;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import lombok.Getter;

/**
 * The result of peeking at a channel: either nothing, or a read-only view
 * of the payload of the oldest token.  The view stays valid until the
 * token is popped.
 */
public final class ChannelToken {

    private static final ChannelToken EMPTY = new ChannelToken(false, ByteBuffer.allocate(0).asReadOnlyBuffer());

    @Getter
    private final boolean success;
    private final ByteBuffer payload;

    private ChannelToken(boolean success, ByteBuffer payload) {
        this.success = success;
        this.payload = payload;
    }

    static ChannelToken empty() {
        return EMPTY;
    }

    static ChannelToken of(ByteBuffer payload) {
        return new ChannelToken(true, payload.asReadOnlyBuffer());
    }

    /** The payload, positioned at its first byte; empty if no token was available. */
    public ByteBuffer getPayload() {
        return payload.duplicate();
    }

    public int getSize() {
        return payload.remaining();
    }

    /** A copy of the payload. */
    public byte[] getBytes() {
        byte[] result = new byte[getSize()];
        payload.duplicate().get(result);
        return result;
    }

    /** The payload decoded as UTF-8. */
    public String getString() {
        return new String(getBytes(), StandardCharsets.UTF_8);
    }
}
