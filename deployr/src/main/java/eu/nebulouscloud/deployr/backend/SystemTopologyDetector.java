package eu.nebulouscloud.deployr.backend;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.ArrayList;
import java.util.List;

import eu.nebulouscloud.deployr.model.ComputeResource;
import eu.nebulouscloud.deployr.model.Device;
import eu.nebulouscloud.deployr.model.HostType;
import eu.nebulouscloud.deployr.model.MemorySpace;
import eu.nebulouscloud.deployr.model.Topology;
import lombok.extern.slf4j.Slf4j;

/**
 * Reports the machine the JVM runs on as a single NUMA domain with its
 * physical memory as RAM and one processing unit per available processor.
 */
@Slf4j
public final class SystemTopologyDetector {

    private SystemTopologyDetector() { }

    public static Topology detect() {
        long memory;
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            memory = ((com.sun.management.OperatingSystemMXBean)os).getTotalMemorySize();
        } else {
            log.info("Cannot query physical memory size, reporting JVM maximum heap size instead");
            memory = Runtime.getRuntime().maxMemory();
        }
        int processors = Runtime.getRuntime().availableProcessors();
        List<ComputeResource> processingUnits = new ArrayList<>(processors);
        for (int i = 0; i < processors; i++) {
            processingUnits.add(new ComputeResource(HostType.HOST_PROCESSING_UNIT_TYPE));
        }
        log.debug("Detected local topology: {} bytes RAM, {} processing units", memory, processors);
        return new Topology(List.of(new Device(HostType.HOST_DEVICE_TYPE,
            List.of(new MemorySpace(HostType.HOST_MEMORY_TYPE, memory)),
            processingUnits)));
    }
}
