package eu.nebulouscloud.deployr.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A requested channel: one or more producer instances sending
 * variable-sized tokens to a single consumer instance.  JSON format:
 *
 * <pre>{@code
 * {"Name": "Coordinator -> Worker 1",
 *  "Producers": ["Coordinator"],
 *  "Consumer": "Worker 1",
 *  "Buffer Capacity (Tokens)": 16,
 *  "Buffer Size (Bytes)": 4096}
 * }</pre>
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Channel {

    /** Bytes per token record in the consumer's token ring. */
    public static final int TOKEN_RECORD_SIZE = 16;
    /** Largest capacity whose token ring still fits one memory slot. */
    public static final long MAX_CAPACITY = Integer.MAX_VALUE / TOKEN_RECORD_SIZE;

    private final String name;
    /** Unmodifiable list of producer instance names. */
    private final List<String> producers;
    private final String consumer;
    /** How many tokens the channel holds before pushes fail. */
    private final long capacity;
    /** Size of the payload buffer in bytes. */
    private final long bufferSize;

    /**
     * Create a channel.
     *
     * @throws RequestParseException if the producer list is empty or has
     *  duplicates, if the consumer is also a producer, or if capacity or
     *  buffer size are not positive or too large for one memory slot.
     */
    public Channel(String name, List<String> producers, String consumer, long capacity, long bufferSize) {
        String context = "Channel '" + name + "'";
        if (producers.isEmpty()) {
            throw new RequestParseException(context + ": no producers given");
        }
        Set<String> seen = new HashSet<>();
        for (String p : producers) {
            if (!seen.add(p)) {
                throw new RequestParseException(context + ": producer '" + p + "' given more than once");
            }
        }
        if (seen.contains(consumer)) {
            throw new RequestParseException(context + ": consumer '" + consumer + "' is also listed as a producer");
        }
        if (capacity <= 0) {
            throw new RequestParseException(context + ": buffer capacity must be positive, got " + capacity);
        }
        if (bufferSize <= 0) {
            throw new RequestParseException(context + ": buffer size must be positive, got " + bufferSize);
        }
        if (capacity > MAX_CAPACITY) {
            throw new RequestParseException(context + ": buffer capacity must be at most " + MAX_CAPACITY
                + ", got " + capacity);
        }
        if (bufferSize > Integer.MAX_VALUE) {
            throw new RequestParseException(context + ": buffer size must be at most " + Integer.MAX_VALUE
                + ", got " + bufferSize);
        }
        this.name = name;
        this.producers = List.copyOf(producers);
        this.consumer = consumer;
        this.capacity = capacity;
        this.bufferSize = bufferSize;
    }

    public static Channel fromJson(JsonNode channelJs) {
        String name = JsonFields.getString(channelJs, "Name", "Channel");
        String context = "Channel '" + name + "'";
        return new Channel(name,
            JsonFields.getStringArray(channelJs, "Producers", context),
            JsonFields.getString(channelJs, "Consumer", context),
            JsonFields.getLong(channelJs, "Buffer Capacity (Tokens)", context),
            JsonFields.getLong(channelJs, "Buffer Size (Bytes)", context));
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Name", name);
        ArrayNode producersJs = result.putArray("Producers");
        producers.forEach(producersJs::add);
        result.put("Consumer", consumer);
        result.put("Buffer Capacity (Tokens)", capacity);
        result.put("Buffer Size (Bytes)", bufferSize);
        return result;
    }
}
