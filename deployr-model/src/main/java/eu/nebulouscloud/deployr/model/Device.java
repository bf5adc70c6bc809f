package eu.nebulouscloud.deployr.model;

import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A device within a topology: a type tag plus the memory spaces and compute
 * resources it contains.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Device {

    /** Bytes per GB as used for all capacity comparisons. */
    public static final long BYTES_PER_GB = 1024L * 1024L * 1024L;

    /** The device type, e.g., {@code NUMA Domain} or {@code GPU}. */
    private final String type;
    /** Unmodifiable list of memory spaces. */
    private final List<MemorySpace> memorySpaces;
    /** Unmodifiable list of compute resources. */
    private final List<ComputeResource> computeResources;

    /**
     * @throws RequestParseException if the memory spaces add up to more
     *  bytes than a long holds.
     */
    public Device(String type, List<MemorySpace> memorySpaces, List<ComputeResource> computeResources) {
        totalBytes(type, memorySpaces);
        this.type = type;
        this.memorySpaces = List.copyOf(memorySpaces);
        this.computeResources = List.copyOf(computeResources);
    }

    /**
     * The memory of this device in whole GB: the sum of all memory space
     * sizes, divided by 2^30 and rounded down.
     */
    public long getMemoryGB() {
        return totalBytes(type, memorySpaces) / BYTES_PER_GB;
    }

    private static long totalBytes(String type, List<MemorySpace> memorySpaces) {
        long bytes = 0;
        for (MemorySpace m : memorySpaces) {
            try {
                bytes = Math.addExact(bytes, m.getSize());
            } catch (ArithmeticException e) {
                throw new RequestParseException("Device '" + type + "': total memory size overflows", e);
            }
        }
        return bytes;
    }

    /**
     * Check whether this device can stand in for the required device: it
     * must have the same type, at least as many compute resources and at
     * least as much memory (in whole GB).
     *
     * @param required the device as described in a required topology.
     * @return true if this device satisfies {@code required}.
     */
    public boolean satisfies(Device required) {
        return type.equals(required.type)
            && computeResources.size() >= required.computeResources.size()
            && getMemoryGB() >= required.getMemoryGB();
    }

    public static Device fromJson(JsonNode deviceJs) {
        String type = JsonFields.getString(deviceJs, "Type", "Device");
        String context = "Device '" + type + "'";
        List<MemorySpace> memorySpaces = JsonFields.getArray(deviceJs, "Memory Spaces", context, true)
            .stream().map(MemorySpace::fromJson).collect(Collectors.toList());
        List<ComputeResource> computeResources = JsonFields.getArray(deviceJs, "Compute Resources", context, true)
            .stream().map(ComputeResource::fromJson).collect(Collectors.toList());
        return new Device(type, memorySpaces, computeResources);
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Type", type);
        ArrayNode memorySpacesJs = result.putArray("Memory Spaces");
        memorySpaces.forEach(m -> memorySpacesJs.add(m.toJson()));
        ArrayNode computeResourcesJs = result.putArray("Compute Resources");
        computeResources.forEach(c -> computeResourcesJs.add(c.toJson()));
        return result;
    }
}
