package eu.nebulouscloud.deployr.model;

import static eu.nebulouscloud.deployr.model.Topologies.device;
import static eu.nebulouscloud.deployr.model.Topologies.host;
import static eu.nebulouscloud.deployr.model.Topologies.of;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class MatcherTests {

    private static Instance cpuInstance(String name) {
        return new Instance(name, "Worker", new TopologyRequirement(of(device("CPU", 0, 1))));
    }

    private static Request request(Instance... instances) {
        return new Request("test", List.of(), List.of(instances), List.of());
    }

    private static List<Host> hosts(Topology... topologies) {
        List<Host> result = new ArrayList<>();
        for (int i = 0; i < topologies.length; i++) result.add(new Host(i, topologies[i]));
        return result;
    }

    /** Assert that the match pairs every instance with a distinct, compatible host. */
    private static void assertValidAssignment(Request request, List<Host> hosts, MatchResult result) {
        assertTrue(result.isComplete(), "incomplete match: " + result);
        Set<Integer> used = new HashSet<>();
        Set<String> paired = new HashSet<>();
        for (Pairing p : result.getPairings()) {
            assertTrue(used.add(p.getHostIndex()), "host used twice: " + p.getHostIndex());
            assertTrue(paired.add(p.getInstanceName()), "instance paired twice: " + p.getInstanceName());
            Instance i = request.getInstance(p.getInstanceName()).orElseThrow();
            assertTrue(hosts.get(p.getHostIndex()).isCompatible(i.getRequirement()),
                "incompatible pairing " + p);
        }
        assertEquals(request.getInstances().keySet(), paired);
    }

    @Test
    void twoInstancesTwoHosts() {
        Request request = request(cpuInstance("A"), cpuInstance("B"));
        List<Host> hosts = hosts(of(device("CPU", 4, 2)), of(device("CPU", 8, 1)));
        MatchResult result = Matcher.match(request, hosts);
        assertValidAssignment(request, hosts, result);
        assertEquals(List.of("A", "B"), List.of(result.getPairings().get(0).getInstanceName(),
                                                result.getPairings().get(1).getInstanceName()));
    }

    @Test
    void tooFewHosts() {
        Request request = request(cpuInstance("A"), cpuInstance("B"), cpuInstance("C"));
        MatchResult result = Matcher.match(request, hosts(of(device("CPU", 4, 2)), of(device("CPU", 8, 1))));
        assertFalse(result.isComplete());
        assertEquals(2, result.getMatchedCount());
        assertEquals(3, result.getRequestedCount());
    }

    @Test
    void noInstances() {
        MatchResult result = Matcher.match(request(), hosts(host(1, 1)));
        assertTrue(result.isComplete());
        assertTrue(result.getPairings().isEmpty());
        assertTrue(Matcher.match(request(), List.of()).isComplete());
    }

    @Test
    void augmentingPathIsFound() {
        // A greedy first-fit would give host 0 to A and leave B without a host.
        Instance a = new Instance("A", "F", new TopologyRequirement(Topology.empty()));
        Instance b = new Instance("B", "F", new TopologyRequirement(of(device("GPU", 0, 0))));
        Request request = request(a, b);
        List<Host> hosts = hosts(host(1, 1, device("GPU", 1, 1)), host(1, 1));
        MatchResult result = Matcher.match(request, hosts);
        assertValidAssignment(request, hosts, result);
        assertEquals(0, result.getPairings().get(1).getHostIndex());
    }

    @Test
    void hostIndicesAreTakenFromHosts() {
        Request request = request(cpuInstance("A"));
        List<Host> hosts = List.of(new Host(7, host(1, 1)), new Host(3, of(device("CPU", 1, 1))));
        MatchResult result = Matcher.match(request, hosts);
        assertTrue(result.isComplete());
        assertEquals(3, result.getPairings().get(0).getHostIndex());
    }

    @Test
    void randomInstancesMatchWheneverPossible() {
        Random random = new Random(4711);
        String[] types = {"CPU", "GPU", "FPGA"};
        for (int round = 0; round < 50; round++) {
            List<Instance> instances = new ArrayList<>();
            int n = 1 + random.nextInt(6);
            for (int i = 0; i < n; i++) {
                instances.add(new Instance("i" + i, "F",
                    new TopologyRequirement(of(device(types[random.nextInt(types.length)], random.nextInt(3), 1)))));
            }
            List<Host> hosts = new ArrayList<>();
            int m = random.nextInt(8);
            for (int j = 0; j < m; j++) {
                hosts.add(new Host(j, of(device(types[random.nextInt(types.length)], random.nextInt(4), 1))));
            }
            Request request = request(instances.toArray(new Instance[0]));
            MatchResult result = Matcher.match(request, hosts);
            if (result.isComplete()) {
                assertValidAssignment(request, hosts, result);
            } else {
                assertTrue(result.getMatchedCount() < n);
                assertFalse(bruteForceMatchable(instances, hosts, 0, new boolean[m]),
                    "matcher missed a complete assignment in round " + round);
            }
        }
    }

    private static boolean bruteForceMatchable(List<Instance> instances, List<Host> hosts, int next, boolean[] used) {
        if (next == instances.size()) return true;
        for (int j = 0; j < hosts.size(); j++) {
            if (!used[j] && hosts.get(j).isCompatible(instances.get(next).getRequirement())) {
                used[j] = true;
                if (bruteForceMatchable(instances, hosts, next + 1, used)) return true;
                used[j] = false;
            }
        }
        return false;
    }
}
