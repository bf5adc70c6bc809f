package eu.nebulouscloud.deployr;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import eu.nebulouscloud.deployr.backend.Backend;
import eu.nebulouscloud.deployr.backend.JobAbortedException;
import eu.nebulouscloud.deployr.channel.ChannelBuilder;
import eu.nebulouscloud.deployr.channel.ChannelEndpoint;
import eu.nebulouscloud.deployr.channel.ChannelRoleException;
import eu.nebulouscloud.deployr.model.Deployment;
import eu.nebulouscloud.deployr.model.Host;
import eu.nebulouscloud.deployr.model.Instance;
import eu.nebulouscloud.deployr.model.MatchResult;
import eu.nebulouscloud.deployr.model.Matcher;
import eu.nebulouscloud.deployr.model.Request;
import eu.nebulouscloud.deployr.model.RequestParseException;
import eu.nebulouscloud.deployr.model.Topology;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * The per-participant deployment engine.  Every participant of a job
 * creates one DeployR object and calls {@link #deploy}; the participants
 * then run the same sequence of phases in lockstep:
 *
 * <ol><li>Topology gathering: the coordinator asks every other participant
 * for its hardware topology, one after another in participant order.
 *
 * <li>Matching: the coordinator pairs each requested instance with a
 * distinct compatible host, where host {@code i} is participant number
 * {@code i}.
 *
 * <li>Deployment propagation: every other participant asks the coordinator
 * for the serialized deployment.
 *
 * <li>Local assignment: each participant looks up the instance paired with
 * its own host, if any.
 *
 * <li>Channel setup: all participants collectively create the channels of
 * the request.
 *
 * <li>Running: each participant with an instance runs that instance's
 * registered function, once.
 * </ol>
 *
 * <p>Failures are reported as a {@link DeployOutcome}; {@link
 * DeploymentDriver} turns a failed outcome into a job abort.
 */
@Slf4j
public class DeployR {

    /** RPC serviced by non-coordinators: return the local topology. */
    public static final String GET_TOPOLOGY_RPC = "GetTopology";
    /** RPC serviced by the coordinator: return the serialized deployment. */
    public static final String GET_DEPLOYMENT_RPC = "GetDeployment";

    /**
     * The deployment phase of a participant.
     *
     * <ul><li>START: Created, {@link #deploy} not yet called.
     *
     * <li>TOPOLOGY_GATHERING, MATCHING, DEPLOYMENT_PROPAGATION,
     * LOCAL_ASSIGNMENT, CHANNEL_SETUP: The phases of {@link #deploy}.
     * MATCHING happens on the coordinator only.
     *
     * <li>RUNNING: The local function is running.
     *
     * <li>TERMINATED: Deployment finished successfully.
     *
     * <li>FAILED: Deployment failed or was aborted.  No more state changes
     * will happen.
     * </ul>
     */
    public enum State {
        START,
        TOPOLOGY_GATHERING,
        MATCHING,
        DEPLOYMENT_PROPAGATION,
        LOCAL_ASSIGNMENT,
        CHANNEL_SETUP,
        RUNNING,
        TERMINATED,
        FAILED
    }

    private final Backend backend;
    private final FunctionRegistry functions;

    @Getter
    private volatile State state = State.START;

    /**
     * The topology of every participant, in participant order.  Only
     * filled on the coordinator.
     */
    @Getter
    private List<Topology> globalTopology = List.of();

    /** The deployment, once received.  Null before deployment propagation. */
    @Getter
    private Deployment deployment = null;

    private Instance localInstance = null;
    private String serializedDeployment = null;
    private Map<String, ChannelEndpoint> channels = Map.of();

    public DeployR(Backend backend, FunctionRegistry functions) {
        this.backend = backend;
        this.functions = functions;
    }

    public Backend getBackend() {
        return backend;
    }

    public boolean isCoordinator() {
        return backend.isCoordinator();
    }

    /** The instance paired with this participant's host, if any. */
    public Optional<Instance> getLocalInstance() {
        return Optional.ofNullable(localInstance);
    }

    /**
     * The endpoint for a channel of the request.  Participants that neither
     * produce nor consume get an endpoint without roles.
     *
     * @throws IllegalArgumentException if the request has no such channel.
     */
    public ChannelEndpoint getChannel(String name) {
        ChannelEndpoint result = channels.get(name);
        if (result == null) {
            throw new IllegalArgumentException("No channel named '" + name + "'");
        }
        return result;
    }

    public boolean hasChannel(String name) {
        return channels.containsKey(name);
    }

    private void setState(State newState) {
        log.debug("Participant {}: {} -> {}", backend.getLocalParticipantId(), state, newState);
        state = newState;
    }

    /**
     * Run all deployment phases and then the local function, if any.
     * Must be called exactly once, on every participant of the job.
     *
     * @param request the request to deploy.  Only used on the coordinator;
     *  other participants pass null and receive the request as part of the
     *  deployment.
     * @return the outcome on this participant.
     */
    public DeployOutcome deploy(Request request) {
        if (state != State.START) {
            throw new IllegalStateException("deploy called twice");
        }
        DeployOutcome outcome;
        try {
            outcome = runPhases(request);
        } catch (JobAbortedException e) {
            outcome = DeployOutcome.aborted(e.getExitCode());
        }
        setState(outcome.isSuccess() ? State.TERMINATED : State.FAILED);
        return outcome;
    }

    private DeployOutcome runPhases(Request request) {
        backend.registerRpc(GET_TOPOLOGY_RPC, argument -> backend.submitReturnValue(
            backend.detectLocalTopology().serialize().getBytes(StandardCharsets.UTF_8)));
        backend.registerRpc(GET_DEPLOYMENT_RPC, argument -> backend.submitReturnValue(
            serializedDeployment.getBytes(StandardCharsets.UTF_8)));

        setState(State.TOPOLOGY_GATHERING);
        if (isCoordinator()) {
            if (request == null) {
                return DeployOutcome.failure(DeployError.CONFIGURATION, "coordinator started without a request");
            }
            try {
                globalTopology = gatherTopologies();
            } catch (RequestParseException e) {
                return DeployOutcome.failure(DeployError.CONFIGURATION, "could not read " + e.getMessage());
            }
            setState(State.MATCHING);
            DeployOutcome matched = match(request);
            if (!matched.isSuccess()) return matched;
        } else {
            backend.listen();
        }

        setState(State.DEPLOYMENT_PROPAGATION);
        if (isCoordinator()) {
            for (int i = 1; i < backend.getParticipantIds().size(); i++) {
                backend.listen();
            }
        } else {
            long coordinator = backend.getCoordinatorId();
            backend.requestRpc(coordinator, GET_DEPLOYMENT_RPC);
            String received = new String(backend.getReturnValue(coordinator), StandardCharsets.UTF_8);
            try {
                deployment = Deployment.deserialize(received);
            } catch (RequestParseException e) {
                return DeployOutcome.failure(DeployError.CONFIGURATION,
                    "could not read deployment sent by coordinator: " + e.getMessage());
            }
        }

        setState(State.LOCAL_ASSIGNMENT);
        int hostIndex = backend.getLocalHostIndex();
        if (deployment.getHost(hostIndex).isEmpty()) {
            return DeployOutcome.failure(DeployError.MISSING_ASSIGNMENT,
                "deployment does not contain host " + hostIndex);
        }
        localInstance = deployment.getInstanceForHost(hostIndex).orElse(null);
        if (localInstance == null) {
            log.info("No instance assigned to host {}, participating in channel setup only", hostIndex);
        } else {
            log.info("Host {} runs instance '{}'", hostIndex, localInstance.getName());
        }

        setState(State.CHANNEL_SETUP);
        channels = Collections.unmodifiableMap(new ChannelBuilder(backend).build(deployment));

        setState(State.RUNNING);
        if (localInstance != null) {
            return runLocalFunction();
        }
        return DeployOutcome.success();
    }

    private List<Topology> gatherTopologies() {
        List<Topology> result = new ArrayList<>();
        for (long participant : backend.getParticipantIds()) {
            if (participant == backend.getLocalParticipantId()) {
                result.add(backend.detectLocalTopology());
            } else {
                backend.requestRpc(participant, GET_TOPOLOGY_RPC);
                String topology = new String(backend.getReturnValue(participant), StandardCharsets.UTF_8);
                try {
                    result.add(Topology.deserialize(topology));
                } catch (RequestParseException e) {
                    throw new RequestParseException(
                        "topology of participant " + participant + ": " + e.getMessage(), e);
                }
            }
            log.debug("Received topology of participant {}", participant);
        }
        ArrayNode topologiesJs = JsonNodeFactory.instance.arrayNode();
        result.forEach(t -> topologiesJs.add(t.toJson()));
        Main.logFile("global-topology.json", topologiesJs.toPrettyString());
        return Collections.unmodifiableList(result);
    }

    private DeployOutcome match(Request request) {
        List<Host> hosts = new ArrayList<>();
        for (int i = 0; i < globalTopology.size(); i++) {
            hosts.add(new Host(i, globalTopology.get(i)));
        }
        MatchResult match = Matcher.match(request, hosts);
        if (!match.isComplete()) {
            return DeployOutcome.failure(DeployError.INFEASIBLE_DEPLOYMENT, String.format(
                "request '%s' needs %d instances but only %d could be paired with one of the %d hosts",
                request.getName(), match.getRequestedCount(), match.getMatchedCount(), hosts.size()));
        }
        deployment = Deployment.fromMatch(request, hosts, match);
        serializedDeployment = deployment.serialize();
        log.info("Deployment of request '{}' found: {}", request.getName(), deployment.getPairings());
        Main.logFile("deployment-" + request.getName().replaceAll("[^A-Za-z0-9_-]", "_") + ".json",
            deployment.toJson().toPrettyString());
        return DeployOutcome.success();
    }

    private DeployOutcome runLocalFunction() {
        String functionName = localInstance.getFunction();
        Optional<DeployrFunction> function = functions.get(functionName);
        if (function.isEmpty()) {
            return DeployOutcome.failure(DeployError.UNREGISTERED_FUNCTION, String.format(
                "instance '%s' needs function '%s', which is not registered",
                localInstance.getName(), functionName));
        }
        log.debug("Running function '{}' for instance '{}'", functionName, localInstance.getName());
        try {
            function.get().run(this);
        } catch (JobAbortedException e) {
            throw e;
        } catch (ChannelRoleException e) {
            return DeployOutcome.failure(DeployError.CHANNEL_ROLE, e.getMessage());
        } catch (RuntimeException | AssertionError | StackOverflowError e) {
            log.error("Function '{}' of instance '{}' failed", functionName, localInstance.getName(), e);
            return DeployOutcome.failure(DeployError.FUNCTION_FAILED, String.format(
                "function '%s' of instance '%s' threw %s", functionName, localInstance.getName(), e));
        }
        return DeployOutcome.success();
    }
}
