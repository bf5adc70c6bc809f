package eu.nebulouscloud.deployr;

import java.util.ArrayList;
import java.util.List;

import eu.nebulouscloud.deployr.model.ComputeResource;
import eu.nebulouscloud.deployr.model.Device;
import eu.nebulouscloud.deployr.model.HostType;
import eu.nebulouscloud.deployr.model.Instance;
import eu.nebulouscloud.deployr.model.MemorySpace;
import eu.nebulouscloud.deployr.model.Topology;
import eu.nebulouscloud.deployr.model.TopologyRequirement;

/** Builders for emulated hosts and simple instances. */
public final class Hosts {

    private Hosts() { }

    public static Device device(String type, long memoryGB, int computeResources) {
        List<ComputeResource> crs = new ArrayList<>();
        for (int i = 0; i < computeResources; i++) crs.add(new ComputeResource(HostType.HOST_PROCESSING_UNIT_TYPE));
        List<MemorySpace> mss = memoryGB > 0
            ? List.of(new MemorySpace(HostType.HOST_MEMORY_TYPE, memoryGB * Device.BYTES_PER_GB))
            : List.of();
        return new Device(type, mss, crs);
    }

    /** A host with one NUMA domain of the given size, plus extra devices. */
    public static Topology host(long memoryGB, int processingUnits, Device... extraDevices) {
        List<Device> devices = new ArrayList<>();
        devices.add(device(HostType.HOST_DEVICE_TYPE, memoryGB, processingUnits));
        devices.addAll(List.of(extraDevices));
        return new Topology(devices);
    }

    /** {@code count} identical small hosts. */
    public static List<Topology> smallHosts(int count) {
        List<Topology> result = new ArrayList<>();
        for (int i = 0; i < count; i++) result.add(host(4, 2));
        return result;
    }

    /** An instance that runs on any host. */
    public static Instance anywhere(String name, String function) {
        return new Instance(name, function, new TopologyRequirement(Topology.empty()));
    }
}
