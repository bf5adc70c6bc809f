package eu.nebulouscloud.deployr.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A compute resource of a device, e.g., one processing unit (core or
 * hardware thread) of a NUMA domain.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ComputeResource {

    private final String type;

    public ComputeResource(String type) {
        this.type = type;
    }

    public static ComputeResource fromJson(JsonNode computeResourceJs) {
        return new ComputeResource(JsonFields.getString(computeResourceJs, "Type", "Compute resource"));
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Type", type);
        return result;
    }
}
