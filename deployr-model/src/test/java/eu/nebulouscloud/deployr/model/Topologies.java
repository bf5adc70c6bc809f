package eu.nebulouscloud.deployr.model;

import java.util.ArrayList;
import java.util.List;

/** Builders for test topologies. */
final class Topologies {

    private Topologies() { }

    static Device device(String type, long memoryGB, int computeResources) {
        List<ComputeResource> crs = new ArrayList<>();
        for (int i = 0; i < computeResources; i++) crs.add(new ComputeResource("Processing Unit"));
        List<MemorySpace> mss = memoryGB > 0
            ? List.of(new MemorySpace("RAM", memoryGB * Device.BYTES_PER_GB))
            : List.of();
        return new Device(type, mss, crs);
    }

    /** A host with one NUMA domain of the given size. */
    static Topology host(long memoryGB, int processingUnits, Device... extraDevices) {
        List<Device> devices = new ArrayList<>();
        devices.add(device(HostType.HOST_DEVICE_TYPE, memoryGB, processingUnits));
        devices.addAll(List.of(extraDevices));
        return new Topology(devices);
    }

    static Topology of(Device... devices) {
        return new Topology(List.of(devices));
    }
}
