package eu.nebulouscloud.deployr.model;

import static eu.nebulouscloud.deployr.model.Topologies.device;
import static eu.nebulouscloud.deployr.model.Topologies.host;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class RequestTests {

    private static final ObjectMapper mapper = new ObjectMapper();

    static JsonNode readResource(String name) throws IOException, URISyntaxException {
        return mapper.readTree(Files.readString(TopologyTests.getResourcePath(name), StandardCharsets.UTF_8));
    }

    @Test
    void readValidRequest() throws IOException, URISyntaxException {
        Request request = Request.fromJson(readResource("request-coordinator-workers.json"));
        assertEquals("Coordinator and Workers", request.getName());
        assertEquals(List.of("Coordinator", "Worker 1", "Worker 2"), List.copyOf(request.getInstances().keySet()));
        assertEquals(2, request.getHostTypes().size());
        Instance worker = request.getInstance("Worker 1").orElseThrow();
        assertEquals("Worker", worker.getFunction());
        assertInstanceOf(HostType.class, worker.getRequirement());
        assertEquals("GPU Host", ((HostType)worker.getRequirement()).getName());
        Channel results = request.getChannel("Results").orElseThrow();
        assertEquals(List.of("Worker 1", "Worker 2"), results.getProducers());
        assertEquals("Coordinator", results.getConsumer());
        assertEquals(16, results.getCapacity());
        assertEquals(4096, results.getBufferSize());
    }

    @Test
    void requestSurvivesSerialization() throws IOException, URISyntaxException {
        Request request = Request.fromJson(readResource("request-coordinator-workers.json"));
        assertEquals(request, Request.fromJson(mapper.readTree(mapper.writeValueAsString(request.toJson()))));
    }

    @Test
    void rejectConsumerAmongProducers() {
        RequestParseException e = assertThrows(RequestParseException.class,
            () -> Request.fromJson(readResource("request-channel-consumer-is-producer.json")));
        assertTrue(e.getMessage().contains("Self"), e.getMessage());
    }

    @Test
    void rejectDuplicateNames() throws IOException, URISyntaxException {
        ObjectNode duplicateInstance = (ObjectNode)readResource("request-coordinator-workers.json");
        duplicateInstance.withArray("/Instances").addObject()
            .put("Name", "Worker 2").put("Host Type", "Small Host").put("Function", "Worker");
        assertThrows(RequestParseException.class, () -> Request.fromJson(duplicateInstance));

        ObjectNode duplicateHostType = (ObjectNode)readResource("request-coordinator-workers.json");
        duplicateHostType.withArray("/Host Types").add(duplicateHostType.at("/Host Types/0").deepCopy());
        assertThrows(RequestParseException.class, () -> Request.fromJson(duplicateHostType));

        ObjectNode duplicateChannel = (ObjectNode)readResource("request-coordinator-workers.json");
        duplicateChannel.withArray("/Channels").add(duplicateChannel.at("/Channels/0").deepCopy());
        assertThrows(RequestParseException.class, () -> Request.fromJson(duplicateChannel));
    }

    @Test
    void rejectDanglingReferences() throws IOException, URISyntaxException {
        ObjectNode unknownHostType = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)unknownHostType.at("/Instances/0")).put("Host Type", "Huge Host");
        assertThrows(RequestParseException.class, () -> Request.fromJson(unknownHostType));

        ObjectNode unknownConsumer = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)unknownConsumer.at("/Channels/0")).put("Consumer", "Worker 3");
        assertThrows(RequestParseException.class, () -> Request.fromJson(unknownConsumer));
    }

    @Test
    void rejectMalformedInstancesAndChannels() throws IOException, URISyntaxException {
        ObjectNode noFunction = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)noFunction.at("/Instances/0")).remove("Function");
        assertThrows(RequestParseException.class, () -> Request.fromJson(noFunction));

        ObjectNode bothRequirements = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)bothRequirements.at("/Instances/0")).putObject("Topology").putArray("Devices");
        assertThrows(RequestParseException.class, () -> Request.fromJson(bothRequirements));

        ObjectNode zeroCapacity = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)zeroCapacity.at("/Channels/0")).put("Buffer Capacity (Tokens)", 0);
        assertThrows(RequestParseException.class, () -> Request.fromJson(zeroCapacity));

        assertThrows(RequestParseException.class, () -> Request.fromJson(mapper.readTree("{\"Name\": \"x\"}")));
    }

    @Test
    void rejectChannelsTooLargeForOneSlot() throws IOException, URISyntaxException {
        ObjectNode hugeCapacity = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)hugeCapacity.at("/Channels/0")).put("Buffer Capacity (Tokens)", 3_000_000_000L);
        RequestParseException e = assertThrows(RequestParseException.class, () -> Request.fromJson(hugeCapacity));
        assertTrue(e.getMessage().contains("buffer capacity"));

        ObjectNode hugeBuffer = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)hugeBuffer.at("/Channels/0")).put("Buffer Size (Bytes)", (long)Integer.MAX_VALUE + 1);
        assertThrows(RequestParseException.class, () -> Request.fromJson(hugeBuffer));

        // the largest accepted sizes still parse
        ObjectNode largest = (ObjectNode)readResource("request-coordinator-workers.json");
        ((ObjectNode)largest.at("/Channels/0")).put("Buffer Capacity (Tokens)", Channel.MAX_CAPACITY);
        ((ObjectNode)largest.at("/Channels/0")).put("Buffer Size (Bytes)", Integer.MAX_VALUE);
        Channel channel = Request.fromJson(largest).getChannels().get(0);
        assertEquals(Channel.MAX_CAPACITY, channel.getCapacity());
    }

    @Test
    void hostTypeCompatibility() {
        HostType gpuHost = new HostType("GPU Host", 8, 4, List.of(new HostType.DeviceRequirement("GPU", 1)));
        assertTrue(gpuHost.isSatisfiedBy(host(8, 4, device("GPU", 8, 1))));
        assertTrue(gpuHost.isSatisfiedBy(host(64, 32, device("GPU", 8, 1), device("GPU", 8, 1))));
        assertFalse(gpuHost.isSatisfiedBy(host(8, 4)), "missing GPU");
        assertFalse(gpuHost.isSatisfiedBy(host(7, 4, device("GPU", 8, 1))), "too little RAM");
        assertFalse(gpuHost.isSatisfiedBy(host(8, 3, device("GPU", 8, 1))), "too few processing units");
        // Memory and processing units of two NUMA domains add up
        Topology twoDomains = Topology.merge(host(4, 2), host(4, 2, device("GPU", 1, 1)));
        assertTrue(gpuHost.isSatisfiedBy(twoDomains));
    }

    @Test
    void explicitTopologyRequirement() throws IOException {
        JsonNode requestJs = mapper.readTree("{\"Name\": \"Inline\", \"Instances\": [{\"Name\": \"A\", \"Function\": \"F\","
            + " \"Topology\": {\"Devices\": [{\"Type\": \"GPU\", \"Memory Spaces\": [], \"Compute Resources\": []}]}}]}");
        Request request = Request.fromJson(requestJs);
        HostRequirement requirement = request.getInstance("A").orElseThrow().getRequirement();
        assertInstanceOf(TopologyRequirement.class, requirement);
        assertTrue(requirement.isSatisfiedBy(host(1, 1, device("GPU", 4, 2))));
        assertFalse(requirement.isSatisfiedBy(host(1, 1)));
        assertTrue(request.getChannels().isEmpty());
        assertEquals(request, Request.fromJson(request.toJson()));
    }
}
