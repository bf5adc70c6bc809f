package eu.nebulouscloud.deployr.channel;

import java.nio.charset.StandardCharsets;

import lombok.Getter;

/**
 * The handle a running function uses for one channel.  Depending on the
 * local instance's role the handle can push, peek and pop, or neither;
 * calling an operation of a role the instance does not have throws {@link
 * ChannelRoleException}.
 */
public class ChannelEndpoint {

    @Getter
    private final String name;
    private final ChannelProducer producer;
    private final ChannelConsumer consumer;

    ChannelEndpoint(String name, ChannelProducer producer, ChannelConsumer consumer) {
        this.name = name;
        this.producer = producer;
        this.consumer = consumer;
    }

    public boolean isProducer() {
        return producer != null;
    }

    public boolean isConsumer() {
        return consumer != null;
    }

    /** See {@link ChannelProducer#push}. */
    public boolean push(byte[] data, int size) {
        if (producer == null) throw new ChannelRoleException(name, "push", "producer");
        return producer.push(data, size);
    }

    public boolean push(byte[] data) {
        return push(data, data.length);
    }

    /** Push a string as UTF-8 bytes. */
    public boolean push(String message) {
        return push(message.getBytes(StandardCharsets.UTF_8));
    }

    public ChannelToken peek() {
        if (consumer == null) throw new ChannelRoleException(name, "peek", "consumer");
        return consumer.peek();
    }

    public boolean pop() {
        if (consumer == null) throw new ChannelRoleException(name, "pop", "consumer");
        return consumer.pop();
    }

    public long getDepth() {
        if (consumer == null) throw new ChannelRoleException(name, "query the depth of", "consumer");
        return consumer.getDepth();
    }
}
