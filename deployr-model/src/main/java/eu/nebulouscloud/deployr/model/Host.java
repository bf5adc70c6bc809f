package eu.nebulouscloud.deployr.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A runtime participant that can run one instance, together with the
 * topology it reported during topology gathering.  The host index is the
 * participant's position in the backend's participant enumeration.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Host {

    private final int hostIndex;
    private final Topology topology;

    public Host(int hostIndex, Topology topology) {
        this.hostIndex = hostIndex;
        this.topology = topology;
    }

    public boolean isCompatible(HostRequirement requirement) {
        return requirement.isSatisfiedBy(topology);
    }

    public static Host fromJson(JsonNode hostJs) {
        long index = JsonFields.getLong(hostJs, "Host Index", "Host");
        return new Host(Math.toIntExact(index),
            Topology.fromJson(JsonFields.getObject(hostJs, "Topology", "Host " + index)));
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Host Index", hostIndex);
        result.set("Topology", topology.toJson());
        return result;
    }
}
