package eu.nebulouscloud.deployr.model;

import static eu.nebulouscloud.deployr.model.Topologies.device;
import static eu.nebulouscloud.deployr.model.Topologies.host;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.util.List;

import org.junit.jupiter.api.Test;

public class DeploymentTests {

    private static Deployment sampleDeployment() throws IOException, URISyntaxException {
        Request request = Request.fromJson(RequestTests.readResource("request-coordinator-workers.json"));
        List<Host> hosts = List.of(
            new Host(0, host(2, 2)),
            new Host(1, host(16, 8, device("GPU", 8, 1))),
            new Host(2, host(4, 4)));
        MatchResult match = Matcher.match(request, hosts);
        return Deployment.fromMatch(request, hosts, match);
    }

    @Test
    void deploymentSurvivesSerialization() throws IOException, URISyntaxException {
        Deployment deployment = sampleDeployment();
        Deployment copy = Deployment.deserialize(deployment.serialize());
        assertNotSame(deployment, copy);
        assertEquals(deployment.getRequest().getName(), copy.getRequest().getName());
        assertEquals(deployment.getPairings(), copy.getPairings());
        assertEquals(deployment.getHosts(), copy.getHosts());
        assertEquals(deployment.getStartTime(), copy.getStartTime());
        assertEquals(deployment, copy);
        // Serialization is stable, so every participant sees the same bytes
        assertEquals(deployment.serialize(), copy.serialize());
    }

    @Test
    void lookupAssignments() throws IOException, URISyntaxException {
        Deployment deployment = sampleDeployment();
        // Only host 1 has a GPU
        assertEquals(1, deployment.getAssignedHost("Worker 1").getAsInt());
        assertEquals("Worker 1", deployment.getInstanceForHost(1).orElseThrow().getName());
        assertTrue(deployment.getAssignedHost("Nobody").isEmpty());
        assertTrue(deployment.getInstanceForHost(42).isEmpty());
    }

    @Test
    void rejectIncompleteMatch() throws IOException, URISyntaxException {
        Request request = Request.fromJson(RequestTests.readResource("request-coordinator-workers.json"));
        List<Host> hosts = List.of(new Host(0, host(2, 2)));
        MatchResult match = Matcher.match(request, hosts);
        assertThrows(IllegalArgumentException.class, () -> Deployment.fromMatch(request, hosts, match));
    }

    @Test
    void rejectInconsistentPairings() throws IOException, URISyntaxException {
        Request request = Request.fromJson(RequestTests.readResource("request-coordinator-workers.json"));
        List<Host> hosts = List.of(new Host(0, host(2, 2)), new Host(1, host(2, 2)), new Host(2, host(2, 2)));
        assertThrows(RequestParseException.class, () -> new Deployment("now", request, hosts, List.of(
            new Pairing("Coordinator", 0), new Pairing("Worker 1", 0), new Pairing("Worker 2", 2))));
        assertThrows(RequestParseException.class, () -> new Deployment("now", request, hosts, List.of(
            new Pairing("Coordinator", 0), new Pairing("Worker 1", 1))));
        assertThrows(RequestParseException.class, () -> new Deployment("now", request, hosts, List.of(
            new Pairing("Coordinator", 0), new Pairing("Worker 1", 1), new Pairing("Worker 2", 5))));
        assertThrows(RequestParseException.class, () -> Deployment.deserialize("{not json"));
    }
}
