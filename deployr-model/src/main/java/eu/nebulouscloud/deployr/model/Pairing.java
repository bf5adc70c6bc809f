package eu.nebulouscloud.deployr.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** The assignment of one requested instance to one host. */
@Getter
@EqualsAndHashCode
@ToString
public final class Pairing {

    private final String instanceName;
    private final int hostIndex;

    public Pairing(String instanceName, int hostIndex) {
        this.instanceName = instanceName;
        this.hostIndex = hostIndex;
    }

    public static Pairing fromJson(JsonNode pairingJs) {
        return new Pairing(JsonFields.getString(pairingJs, "Instance Name", "Pairing"),
            Math.toIntExact(JsonFields.getLong(pairingJs, "Assigned Host", "Pairing")));
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Instance Name", instanceName);
        result.put("Assigned Host", hostIndex);
        return result;
    }
}
