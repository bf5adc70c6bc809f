package eu.nebulouscloud.deployr.channel;

import static eu.nebulouscloud.deployr.channel.ChannelLayout.CHANNEL_TAG_BASE;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.COORDINATION_SIZE;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.HEAD_OFFSET;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.PAYLOAD_BUFFER_KEY;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.PAYLOAD_COORDINATION_KEY;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.RECORD_SIZE;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.TAIL_OFFSET;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.TOKEN_BUFFER_KEY;
import static eu.nebulouscloud.deployr.channel.ChannelLayout.TOKEN_COORDINATION_KEY;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import eu.nebulouscloud.deployr.backend.Backend;
import eu.nebulouscloud.deployr.backend.MemorySlot;
import eu.nebulouscloud.deployr.model.Channel;
import eu.nebulouscloud.deployr.model.Deployment;
import lombok.extern.slf4j.Slf4j;

/**
 * Sets up the channels of a deployment.  Every participant must call
 * {@link #build}, since each channel needs one memory exchange and one
 * fence involving everyone, including participants that neither produce
 * nor consume.
 */
@Slf4j
public class ChannelBuilder {

    private final Backend backend;

    public ChannelBuilder(Backend backend) {
        this.backend = backend;
    }

    /**
     * Create the channels of {@code deployment} as seen from the local
     * participant.
     *
     * @return one endpoint per channel of the request, keyed by channel
     *  name, in request order.
     */
    public Map<String, ChannelEndpoint> build(Deployment deployment) {
        int localHost = backend.getLocalHostIndex();
        List<Channel> channels = deployment.getRequest().getChannels();
        Map<String, ChannelEndpoint> result = new LinkedHashMap<>();
        for (int i = 0; i < channels.size(); i++) {
            Channel channel = channels.get(i);
            boolean consumer = isOnHost(deployment, channel.getConsumer(), localHost);
            boolean producer = channel.getProducers().stream()
                .anyMatch(p -> isOnHost(deployment, p, localHost));
            result.put(channel.getName(), build(CHANNEL_TAG_BASE + i, channel, producer, consumer));
        }
        return result;
    }

    private static boolean isOnHost(Deployment deployment, String instanceName, int hostIndex) {
        OptionalInt host = deployment.getAssignedHost(instanceName);
        return host.isPresent() && host.getAsInt() == hostIndex;
    }

    private ChannelEndpoint build(long tag, Channel channel, boolean isProducer, boolean isConsumer) {
        String name = channel.getName();
        int capacity = Math.toIntExact(channel.getCapacity());
        int bufferSize = Math.toIntExact(channel.getBufferSize());
        Map<Long, MemorySlot> published = new HashMap<>();
        if (isConsumer) {
            log.debug("Allocating buffers of channel '{}': {} tokens, {} bytes", name, capacity, bufferSize);
            published.put(TOKEN_BUFFER_KEY, backend.allocateLocalMemorySlot(Math.multiplyExact(capacity, RECORD_SIZE)));
            published.put(PAYLOAD_BUFFER_KEY, backend.allocateLocalMemorySlot(bufferSize));
            published.put(TOKEN_COORDINATION_KEY, coordinationBuffer());
            published.put(PAYLOAD_COORDINATION_KEY, coordinationBuffer());
        }
        MemorySlot localTokenCoordination = null;
        MemorySlot localPayloadCoordination = null;
        MemorySlot recordStaging = null;
        if (isProducer) {
            localTokenCoordination = coordinationBuffer();
            localPayloadCoordination = coordinationBuffer();
            recordStaging = backend.allocateLocalMemorySlot(RECORD_SIZE);
        }

        backend.exchangeGlobalMemorySlots(tag, published);
        backend.fence(tag);

        ChannelProducer producer = null;
        ChannelConsumer consumer = null;
        if (isProducer || isConsumer) {
            MemorySlot tokenBuffer = backend.getGlobalMemorySlot(tag, TOKEN_BUFFER_KEY);
            MemorySlot payloadBuffer = backend.getGlobalMemorySlot(tag, PAYLOAD_BUFFER_KEY);
            MemorySlot tokenCoordination = backend.getGlobalMemorySlot(tag, TOKEN_COORDINATION_KEY);
            MemorySlot payloadCoordination = backend.getGlobalMemorySlot(tag, PAYLOAD_COORDINATION_KEY);
            if (isProducer) {
                producer = new ChannelProducer(backend, name, capacity, bufferSize,
                    tokenBuffer, payloadBuffer, tokenCoordination, payloadCoordination,
                    localTokenCoordination, localPayloadCoordination, recordStaging);
            }
            if (isConsumer) {
                consumer = new ChannelConsumer(backend, name, capacity, bufferSize,
                    tokenBuffer, payloadBuffer, tokenCoordination, payloadCoordination);
            }
        }
        log.debug("Channel '{}' ready (producer: {}, consumer: {})", name, isProducer, isConsumer);
        return new ChannelEndpoint(name, producer, consumer);
    }

    private MemorySlot coordinationBuffer() {
        MemorySlot slot = backend.allocateLocalMemorySlot(COORDINATION_SIZE);
        slot.getBuffer().putLong(HEAD_OFFSET, 0).putLong(TAIL_OFFSET, 0);
        return slot;
    }
}
