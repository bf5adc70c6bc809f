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
 * A named host profile from the {@code "Host Types"} section of a request.
 * JSON format:
 *
 * <pre>{@code
 * {"Name": "Big Host",
 *  "Topology": {"Minimum Host RAM (GB)": 16,
 *               "Minimum Host Processing Units": 8,
 *               "Devices": [{"Type": "GPU", "Count": 1}]}}
 * }</pre>
 *
 * <p>Host RAM and processing units are counted on the host's {@value
 * #HOST_DEVICE_TYPE} devices only: the sizes of their {@value
 * #HOST_MEMORY_TYPE} memory spaces and the number of their {@value
 * #HOST_PROCESSING_UNIT_TYPE} compute resources.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HostType implements HostRequirement {

    public static final String HOST_DEVICE_TYPE = "NUMA Domain";
    public static final String HOST_MEMORY_TYPE = "RAM";
    public static final String HOST_PROCESSING_UNIT_TYPE = "Processing Unit";

    /** A device type and how many devices of that type a host needs. */
    @Getter
    @EqualsAndHashCode
    @ToString
    public static final class DeviceRequirement {
        private final String type;
        private final long count;

        public DeviceRequirement(String type, long count) {
            this.type = type;
            this.count = count;
        }
    }

    private final String name;
    private final long minMemoryGB;
    private final long minProcessingUnits;
    private final List<DeviceRequirement> devices;

    public HostType(String name, long minMemoryGB, long minProcessingUnits, List<DeviceRequirement> devices) {
        this.name = name;
        this.minMemoryGB = minMemoryGB;
        this.minProcessingUnits = minProcessingUnits;
        this.devices = List.copyOf(devices);
    }

    @Override
    public boolean isSatisfiedBy(Topology hostTopology) {
        long memoryBytes = 0;
        long processingUnits = 0;
        for (Device d : hostTopology.getDevices()) {
            if (!d.getType().equals(HOST_DEVICE_TYPE)) continue;
            for (MemorySpace m : d.getMemorySpaces()) {
                if (m.getType().equals(HOST_MEMORY_TYPE)) {
                    // saturating sum
                    memoryBytes = m.getSize() > Long.MAX_VALUE - memoryBytes
                        ? Long.MAX_VALUE : memoryBytes + m.getSize();
                }
            }
            for (ComputeResource c : d.getComputeResources()) {
                if (c.getType().equals(HOST_PROCESSING_UNIT_TYPE)) processingUnits++;
            }
        }
        if (memoryBytes / Device.BYTES_PER_GB < minMemoryGB) return false;
        if (processingUnits < minProcessingUnits) return false;
        for (DeviceRequirement required : devices) {
            long found = hostTopology.getDevices().stream()
                .filter(d -> d.getType().equals(required.getType()))
                .count();
            if (found < required.getCount()) return false;
        }
        return true;
    }

    public static HostType fromJson(JsonNode hostTypeJs) {
        String name = JsonFields.getString(hostTypeJs, "Name", "Host type");
        String context = "Host type '" + name + "'";
        JsonNode topologyJs = JsonFields.getObject(hostTypeJs, "Topology", context);
        List<DeviceRequirement> devices = JsonFields.getArray(topologyJs, "Devices", context, true)
            .stream()
            .map(d -> new DeviceRequirement(
                JsonFields.getString(d, "Type", context + " device"),
                JsonFields.getLong(d, "Count", context + " device")))
            .collect(Collectors.toList());
        return new HostType(name,
            JsonFields.getLong(topologyJs, "Minimum Host RAM (GB)", context),
            JsonFields.getLong(topologyJs, "Minimum Host Processing Units", context),
            devices);
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Name", name);
        ObjectNode topologyJs = result.putObject("Topology");
        topologyJs.put("Minimum Host RAM (GB)", minMemoryGB);
        topologyJs.put("Minimum Host Processing Units", minProcessingUnits);
        ArrayNode devicesJs = topologyJs.putArray("Devices");
        for (DeviceRequirement d : devices) {
            devicesJs.addObject().put("Type", d.getType()).put("Count", d.getCount());
        }
        return result;
    }
}
