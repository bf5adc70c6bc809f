package eu.nebulouscloud.deployr.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A memory space of a device, e.g., the RAM of a NUMA domain.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class MemorySpace {

    /** The memory type, e.g., {@code RAM}. */
    private final String type;
    /** Size in bytes. */
    private final long size;

    public MemorySpace(String type, long size) {
        this.type = type;
        this.size = size;
    }

    public static MemorySpace fromJson(JsonNode memorySpaceJs) {
        return new MemorySpace(
            JsonFields.getString(memorySpaceJs, "Type", "Memory space"),
            JsonFields.getLong(memorySpaceJs, "Size", "Memory space"));
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Type", type);
        result.put("Size", size);
        return result;
    }
}
