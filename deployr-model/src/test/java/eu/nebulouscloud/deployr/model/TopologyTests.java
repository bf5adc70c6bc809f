package eu.nebulouscloud.deployr.model;

import static eu.nebulouscloud.deployr.model.Topologies.device;
import static eu.nebulouscloud.deployr.model.Topologies.host;
import static eu.nebulouscloud.deployr.model.Topologies.of;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

public class TopologyTests {

    private static final ObjectMapper mapper = new ObjectMapper();

    static Path getResourcePath(String name) throws URISyntaxException {
        URL resourceUrl = TopologyTests.class.getClassLoader().getResource(name);
        return Paths.get(resourceUrl.toURI());
    }

    @Test
    void readTopologyFile() throws IOException, URISyntaxException {
        Topology t = Topology.fromJson(mapper.readTree(
            Files.readString(getResourcePath("topology-gpu-host.json"), StandardCharsets.UTF_8)));
        assertEquals(2, t.getDevices().size());
        Device numa = t.getDevices().get(0);
        assertEquals("NUMA Domain", numa.getType());
        assertEquals(16, numa.getMemoryGB());
        assertEquals(4, numa.getComputeResources().size());
        assertEquals(8, t.getDevices().get(1).getMemoryGB());
        // And back again
        assertEquals(t, Topology.fromJson(t.toJson()));
    }

    @Test
    void subsetIsReflexive() {
        List<Topology> topologies = List.of(
            Topology.empty(),
            host(16, 8),
            host(4, 2, device("GPU", 8, 1), device("GPU", 8, 1)),
            of(device("FPGA", 0, 0)));
        for (Topology t : topologies) {
            assertTrue(Topology.isSubset(t, t), "not a subset of itself: " + t);
        }
    }

    @Test
    void emptyRequirementAlwaysSatisfied() {
        assertTrue(Topology.isSubset(Topology.empty(), Topology.empty()));
        assertTrue(Topology.isSubset(host(1, 1), Topology.empty()));
        assertFalse(Topology.isSubset(Topology.empty(), host(1, 1)));
    }

    @Test
    void subsetChecksTypeMemoryAndComputeResources() {
        Topology given = host(16, 8);
        assertTrue(Topology.isSubset(given, host(16, 8)));
        assertTrue(Topology.isSubset(given, host(2, 1)));
        assertFalse(Topology.isSubset(given, host(17, 1)));
        assertFalse(Topology.isSubset(given, host(1, 9)));
        assertFalse(Topology.isSubset(given, of(device("GPU", 1, 1))));
    }

    @Test
    void memoryIsRoundedDownToWholeGB() {
        Device almostTwoGB = new Device("NUMA Domain",
            List.of(new MemorySpace("RAM", 2 * Device.BYTES_PER_GB - 1)), List.of());
        assertEquals(1, almostTwoGB.getMemoryGB());
        assertFalse(Topology.isSubset(of(almostTwoGB), of(device("NUMA Domain", 2, 0))));
        assertTrue(Topology.isSubset(of(almostTwoGB), of(device("NUMA Domain", 1, 0))));
    }

    @Test
    void givenDevicesAreConsumedOnce() {
        Topology oneGpu = host(8, 4, device("GPU", 8, 1));
        Topology twoGpus = host(8, 4, device("GPU", 8, 1), device("GPU", 8, 1));
        assertTrue(Topology.isSubset(twoGpus, twoGpus));
        assertFalse(Topology.isSubset(oneGpu, twoGpus));
    }

    @Test
    void greedyScanDoesNotBacktrack() {
        // The small requirement comes first and takes the big device, so the
        // big requirement finds nothing, although the opposite wiring fits.
        Topology given = of(device("GPU", 16, 1), device("GPU", 4, 1));
        Topology required = of(device("GPU", 4, 1), device("GPU", 16, 1));
        assertFalse(Topology.isSubset(given, required));
        // Most specific requirement first finds the assignment
        assertTrue(Topology.isSubset(given, of(device("GPU", 16, 1), device("GPU", 4, 1))));
        // Deterministic
        for (int i = 0; i < 10; i++) assertFalse(Topology.isSubset(given, required));
    }

    @Test
    void mergeKeepsAllDevices() {
        Topology a = host(8, 4);
        Topology b = of(device("GPU", 8, 1));
        Topology ab = Topology.merge(a, b);
        Topology ba = b.merge(a);
        assertEquals(2, ab.getDevices().size());
        assertTrue(Topology.isSubset(ab, ba) && Topology.isSubset(ba, ab));
        assertEquals(2, a.merge(a).getDevices().size());
        Topology abc = Topology.merge(Topology.merge(a, b), host(1, 1));
        assertEquals(abc, Topology.merge(a, Topology.merge(b, host(1, 1))));
    }

    @Test
    void rejectMalformedTopology() {
        assertThrows(RequestParseException.class,
            () -> Topology.fromJson(mapper.readTree("{\"Devices\": [{\"Memory Spaces\": []}]}")));
        assertThrows(RequestParseException.class,
            () -> Topology.fromJson(mapper.readTree("{\"Devices\": [{\"Type\": \"NUMA Domain\", \"Memory Spaces\": [{\"Type\": \"RAM\", \"Size\": -1}]}]}")));
        assertThrows(RequestParseException.class,
            () -> Topology.fromJson(mapper.readTree("[]")));
    }

    @Test
    void rejectDeviceWhoseMemoryOverflows() {
        List<MemorySpace> spaces = List.of(new MemorySpace("RAM", Long.MAX_VALUE), new MemorySpace("RAM", Long.MAX_VALUE));
        assertThrows(RequestParseException.class,
            () -> new Device(HostType.HOST_DEVICE_TYPE, spaces, List.of()));
    }

    @Test
    void hostTypeMemorySumSaturates() {
        Device big = new Device(HostType.HOST_DEVICE_TYPE,
            List.of(new MemorySpace("RAM", Long.MAX_VALUE - 1)), List.of(new ComputeResource("Processing Unit")));
        Topology twoBigDomains = of(big, big);
        assertTrue(new HostType("Big", 1024, 2, List.of()).isSatisfiedBy(twoBigDomains));
    }
}
