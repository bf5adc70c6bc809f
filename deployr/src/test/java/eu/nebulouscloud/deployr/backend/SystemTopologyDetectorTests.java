package eu.nebulouscloud.deployr.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import eu.nebulouscloud.deployr.model.Device;
import eu.nebulouscloud.deployr.model.HostType;
import eu.nebulouscloud.deployr.model.Topology;

public class SystemTopologyDetectorTests {

    @Test
    void thisMachineIsOneNumaDomain() {
        Topology topology = SystemTopologyDetector.detect();
        assertEquals(1, topology.getDevices().size());
        Device numa = topology.getDevices().get(0);
        assertEquals(HostType.HOST_DEVICE_TYPE, numa.getType());
        assertEquals(Runtime.getRuntime().availableProcessors(), numa.getComputeResources().size());
        assertEquals(HostType.HOST_MEMORY_TYPE, numa.getMemorySpaces().get(0).getType());
        assertTrue(numa.getMemorySpaces().get(0).getSize() > 0);
    }

    @Test
    void thisMachineSatisfiesAnEmptyHostType() {
        assertTrue(new HostType("Anything", 0, 1, List.of())
            .isSatisfiedBy(SystemTopologyDetector.detect()));
    }
}
