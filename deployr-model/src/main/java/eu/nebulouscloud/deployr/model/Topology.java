package eu.nebulouscloud.deployr.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A hardware topology: the devices of a host, or the devices an instance
 * requires.  Topologies are immutable; {@link #merge} produces a new
 * topology.
 *
 * <p>JSON format:
 *
 * <pre>{@code
 * {"Devices": [{"Type": "NUMA Domain",
 *               "Memory Spaces": [{"Type": "RAM", "Size": 17179869184}],
 *               "Compute Resources": [{"Type": "Processing Unit"}, ...]}]}
 * }</pre>
 */
@EqualsAndHashCode
@ToString
public final class Topology {

    private static final ObjectMapper mapper = new ObjectMapper();

    /** Unmodifiable device list, in the order reported or requested. */
    @Getter
    private final List<Device> devices;

    public Topology(List<Device> devices) {
        this.devices = List.copyOf(devices);
    }

    public static Topology empty() {
        return new Topology(List.of());
    }

    /**
     * Return the union of the two device lists.  Devices are not
     * deduplicated: merging a topology with itself doubles its devices,
     * since two identical devices are still two devices.
     */
    public static Topology merge(Topology a, Topology b) {
        List<Device> result = new ArrayList<>(a.devices.size() + b.devices.size());
        result.addAll(a.devices);
        result.addAll(b.devices);
        return new Topology(result);
    }

    public Topology merge(Topology other) {
        return merge(this, other);
    }

    /**
     * Check whether {@code given} contains everything {@code required} asks
     * for.  Required devices are visited in order; each one consumes the
     * first not yet consumed given device that {@link Device#satisfies
     * satisfies} it.  A given device satisfies at most one required device.
     *
     * <p>There is no backtracking, so an early requirement can consume a
     * device that a later one would have needed, even though another
     * assignment exists.  Callers relying on an exact answer must order
     * their required devices from most to least specific.
     *
     * @param given the topology of a host.
     * @param required the topology an instance asks for.
     * @return true if every required device found a distinct given device.
     */
    public static boolean isSubset(Topology given, Topology required) {
        boolean[] consumed = new boolean[given.devices.size()];
        for (Device requiredDevice : required.devices) {
            boolean found = false;
            for (int i = 0; i < consumed.length; i++) {
                if (!consumed[i] && given.devices.get(i).satisfies(requiredDevice)) {
                    consumed[i] = true;
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }

    public static Topology fromJson(JsonNode topologyJs) {
        if (topologyJs == null || !topologyJs.isObject()) {
            throw new RequestParseException("Topology: expected a JSON object");
        }
        return new Topology(JsonFields.getArray(topologyJs, "Devices", "Topology", false)
            .stream().map(Device::fromJson).collect(Collectors.toList()));
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode devicesJs = result.putArray("Devices");
        devices.forEach(d -> devicesJs.add(d.toJson()));
        return result;
    }

    /** Serialize this topology for sending to another participant. */
    public String serialize() {
        return toJson().toString();
    }

    /**
     * Read a topology as produced by {@link #serialize()}.
     *
     * @throws RequestParseException if {@code serialized} is not a valid
     *  topology.
     */
    public static Topology deserialize(String serialized) {
        try {
            return fromJson(mapper.readTree(serialized));
        } catch (JsonProcessingException e) {
            throw new RequestParseException("Topology: not valid JSON", e);
        }
    }
}
