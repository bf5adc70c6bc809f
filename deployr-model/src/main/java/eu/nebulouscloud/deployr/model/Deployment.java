package eu.nebulouscloud.deployr.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The result of a successful match: which host runs which instance of a
 * request.  A deployment is created once by the coordinator and sent to all
 * other participants in serialized form; each participant deserializes its
 * own copy.
 *
 * <p>JSON format:
 *
 * <pre>{@code
 * {"Deployment Start Time": "2024-05-01 12:00:00",
 *  "Request": <request>,
 *  "Pairings": [{"Instance Name": "Coordinator", "Assigned Host": 0}, ...],
 *  "Hosts": [{"Host Index": 0, "Topology": <topology>}, ...]}
 * }</pre>
 */
@EqualsAndHashCode
@ToString
public final class Deployment {

    /** Format of {@link #startTime}. */
    public static final DateTimeFormatter START_TIME_FORMAT
        = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // Instantiating this is expensive, so we do it only once
    private static final ObjectMapper mapper = new ObjectMapper();

    @Getter
    private final String startTime;
    @Getter
    private final Request request;
    /** Unmodifiable list of all hosts that took part in matching. */
    @Getter
    private final List<Host> hosts;
    /** Unmodifiable list of pairings, one per requested instance. */
    @Getter
    private final List<Pairing> pairings;

    /**
     * Create a deployment.
     *
     * @throws RequestParseException if the pairings are not a total,
     *  injective map from the request's instances to the given hosts.
     */
    public Deployment(String startTime, Request request, List<Host> hosts, List<Pairing> pairings) {
        this.startTime = startTime;
        this.request = request;
        this.hosts = List.copyOf(hosts);
        this.pairings = List.copyOf(pairings);
        Set<Integer> hostIndices = this.hosts.stream().map(Host::getHostIndex).collect(Collectors.toSet());
        Set<String> pairedInstances = new HashSet<>();
        Set<Integer> usedHosts = new HashSet<>();
        for (Pairing p : this.pairings) {
            if (!request.getInstances().containsKey(p.getInstanceName())) {
                throw new RequestParseException("Deployment: pairing for unknown instance '" + p.getInstanceName() + "'");
            }
            if (!hostIndices.contains(p.getHostIndex())) {
                throw new RequestParseException("Deployment: instance '" + p.getInstanceName()
                    + "' paired with unknown host " + p.getHostIndex());
            }
            if (!pairedInstances.add(p.getInstanceName())) {
                throw new RequestParseException("Deployment: instance '" + p.getInstanceName() + "' paired more than once");
            }
            if (!usedHosts.add(p.getHostIndex())) {
                throw new RequestParseException("Deployment: host " + p.getHostIndex() + " assigned more than once");
            }
        }
        if (pairedInstances.size() != request.getInstances().size()) {
            throw new RequestParseException("Deployment: " + pairedInstances.size() + " of "
                + request.getInstances().size() + " instances paired");
        }
    }

    /**
     * Create a deployment from a complete match, stamped with the current
     * time.
     *
     * @throws IllegalArgumentException if {@code match} is not complete.
     */
    public static Deployment fromMatch(Request request, List<Host> hosts, MatchResult match) {
        if (!match.isComplete()) {
            throw new IllegalArgumentException("Cannot create deployment from incomplete match: "
                + match.getMatchedCount() + " of " + match.getRequestedCount() + " instances paired");
        }
        return new Deployment(LocalDateTime.now().format(START_TIME_FORMAT), request, hosts, match.getPairings());
    }

    /** The index of the host assigned to the named instance, if any. */
    public OptionalInt getAssignedHost(String instanceName) {
        return pairings.stream()
            .filter(p -> p.getInstanceName().equals(instanceName))
            .mapToInt(Pairing::getHostIndex)
            .findFirst();
    }

    /** The instance assigned to the given host, if any. */
    public Optional<Instance> getInstanceForHost(int hostIndex) {
        return pairings.stream()
            .filter(p -> p.getHostIndex() == hostIndex)
            .findFirst()
            .flatMap(p -> request.getInstance(p.getInstanceName()));
    }

    public Optional<Host> getHost(int hostIndex) {
        return hosts.stream().filter(h -> h.getHostIndex() == hostIndex).findFirst();
    }

    public ObjectNode toJson() {
        ObjectNode result = mapper.createObjectNode();
        result.put("Deployment Start Time", startTime);
        result.set("Request", request.toJson());
        ArrayNode pairingsJs = result.putArray("Pairings");
        pairings.forEach(p -> pairingsJs.add(p.toJson()));
        ArrayNode hostsJs = result.putArray("Hosts");
        hosts.forEach(h -> hostsJs.add(h.toJson()));
        return result;
    }

    public static Deployment fromJson(JsonNode deploymentJs) {
        if (deploymentJs == null || !deploymentJs.isObject()) {
            throw new RequestParseException("Deployment: expected a JSON object");
        }
        return new Deployment(
            JsonFields.getString(deploymentJs, "Deployment Start Time", "Deployment"),
            Request.fromJson(JsonFields.getObject(deploymentJs, "Request", "Deployment")),
            JsonFields.getArray(deploymentJs, "Hosts", "Deployment", false)
                .stream().map(Host::fromJson).collect(Collectors.toList()),
            JsonFields.getArray(deploymentJs, "Pairings", "Deployment", false)
                .stream().map(Pairing::fromJson).collect(Collectors.toList()));
    }

    /** Serialize this deployment for sending to other participants. */
    public String serialize() {
        try {
            return mapper.writeValueAsString(toJson());
        } catch (JsonProcessingException e) {
            // We only ever write trees we built ourselves
            throw new IllegalStateException("Could not serialize deployment (this should never happen)", e);
        }
    }

    /**
     * Read a deployment as produced by {@link #serialize()}.
     *
     * @throws RequestParseException if {@code serialized} is not a valid
     *  deployment.
     */
    public static Deployment deserialize(String serialized) {
        try {
            return fromJson(mapper.readTree(serialized));
        } catch (JsonProcessingException e) {
            throw new RequestParseException("Deployment: not valid JSON", e);
        }
    }
}
