package eu.nebulouscloud.deployr.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A deployment request as written by the user: named host types, the
 * instances to deploy and the channels between them.  Requests are
 * immutable and fully validated on construction.
 *
 * <p>JSON format:
 *
 * <pre>{@code
 * {"Name": "My Job",
 *  "Host Types": [{"Name": "Small Host", "Topology": {...}}],
 *  "Instances": [{"Name": "Coordinator", "Host Type": "Small Host", "Function": "Coordinator"},
 *                {"Name": "Worker", "Topology": {"Devices": [...]}, "Function": "Worker"}],
 *  "Channels": [{"Name": ..., "Producers": [...], "Consumer": ..., ...}]}
 * }</pre>
 *
 * An instance names either a host type or gives an explicit required
 * topology.  The {@code "Host Types"} and {@code "Channels"} sections are
 * optional.
 */
@EqualsAndHashCode
@ToString
public final class Request {

    @Getter
    private final String name;
    /** Unmodifiable map from host type name to host type, in request order. */
    @Getter
    private final Map<String, HostType> hostTypes;
    /** Unmodifiable map from instance name to instance, in request order. */
    @Getter
    private final Map<String, Instance> instances;
    /** Unmodifiable list of channels, in request order. */
    @Getter
    private final List<Channel> channels;

    /**
     * Create a request.
     *
     * @throws RequestParseException if a channel refers to an instance not
     *  contained in {@code instances}, if channel names are not unique, or
     *  if an instance refers to a host type that is not contained in
     *  {@code hostTypes}.
     */
    public Request(String name, List<HostType> hostTypes, List<Instance> instances, List<Channel> channels) {
        this.name = name;
        Map<String, HostType> types = new LinkedHashMap<>();
        for (HostType t : hostTypes) {
            if (types.put(t.getName(), t) != null) {
                throw new RequestParseException("Request '" + name + "': duplicate host type name '" + t.getName() + "'");
            }
        }
        Map<String, Instance> insts = new LinkedHashMap<>();
        for (Instance i : instances) {
            if (insts.put(i.getName(), i) != null) {
                throw new RequestParseException("Request '" + name + "': duplicate instance name '" + i.getName() + "'");
            }
            if (i.getRequirement() instanceof HostType
                && !i.getRequirement().equals(types.get(((HostType)i.getRequirement()).getName()))) {
                throw new RequestParseException("Request '" + name + "': instance '" + i.getName()
                    + "' uses host type '" + ((HostType)i.getRequirement()).getName() + "' which is not declared");
            }
        }
        Map<String, Channel> chans = new LinkedHashMap<>();
        for (Channel c : channels) {
            if (chans.put(c.getName(), c) != null) {
                throw new RequestParseException("Request '" + name + "': duplicate channel name '" + c.getName() + "'");
            }
            for (String p : c.getProducers()) {
                if (!insts.containsKey(p)) {
                    throw new RequestParseException("Channel '" + c.getName() + "': unknown producer instance '" + p + "'");
                }
            }
            if (!insts.containsKey(c.getConsumer())) {
                throw new RequestParseException("Channel '" + c.getName() + "': unknown consumer instance '" + c.getConsumer() + "'");
            }
        }
        this.hostTypes = Collections.unmodifiableMap(types);
        this.instances = Collections.unmodifiableMap(insts);
        this.channels = List.copyOf(channels);
    }

    public Optional<Instance> getInstance(String instanceName) {
        return Optional.ofNullable(instances.get(instanceName));
    }

    public Optional<Channel> getChannel(String channelName) {
        return channels.stream().filter(c -> c.getName().equals(channelName)).findFirst();
    }

    /**
     * Parse a request document.
     *
     * @param requestJs the parsed JSON (or YAML) request.
     * @return the request.
     * @throws RequestParseException if the request is malformed.
     */
    public static Request fromJson(JsonNode requestJs) {
        if (requestJs == null || !requestJs.isObject()) {
            throw new RequestParseException("Request: expected a JSON object");
        }
        String name = JsonFields.getString(requestJs, "Name", "Request");
        String context = "Request '" + name + "'";
        List<HostType> hostTypes = JsonFields.getArray(requestJs, "Host Types", context, true)
            .stream().map(HostType::fromJson).collect(Collectors.toList());
        Map<String, HostType> typesByName = new LinkedHashMap<>();
        hostTypes.forEach(t -> typesByName.putIfAbsent(t.getName(), t));
        List<Instance> instances = JsonFields.getArray(requestJs, "Instances", context, false)
            .stream().map(i -> instanceFromJson(i, typesByName)).collect(Collectors.toList());
        List<Channel> channels = JsonFields.getArray(requestJs, "Channels", context, true)
            .stream().map(Channel::fromJson).collect(Collectors.toList());
        return new Request(name, hostTypes, instances, channels);
    }

    private static Instance instanceFromJson(JsonNode instanceJs, Map<String, HostType> hostTypes) {
        String name = JsonFields.getString(instanceJs, "Name", "Instance");
        String context = "Instance '" + name + "'";
        String function = JsonFields.getString(instanceJs, "Function", context);
        boolean hasHostType = instanceJs.has("Host Type");
        boolean hasTopology = instanceJs.has("Topology");
        if (hasHostType == hasTopology) {
            throw new RequestParseException(context + ": exactly one of 'Host Type' and 'Topology' must be given");
        }
        HostRequirement requirement;
        if (hasHostType) {
            String typeName = JsonFields.getString(instanceJs, "Host Type", context);
            requirement = hostTypes.get(typeName);
            if (requirement == null) {
                throw new RequestParseException(context + ": unknown host type '" + typeName + "'");
            }
        } else {
            requirement = new TopologyRequirement(Topology.fromJson(instanceJs.get("Topology")));
        }
        return new Instance(name, function, requirement);
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("Name", name);
        ArrayNode hostTypesJs = result.putArray("Host Types");
        hostTypes.values().forEach(t -> hostTypesJs.add(t.toJson()));
        ArrayNode instancesJs = result.putArray("Instances");
        for (Instance i : instances.values()) {
            ObjectNode instanceJs = instancesJs.addObject();
            instanceJs.put("Name", i.getName());
            if (i.getRequirement() instanceof HostType) {
                instanceJs.put("Host Type", ((HostType)i.getRequirement()).getName());
            } else if (i.getRequirement() instanceof TopologyRequirement) {
                instanceJs.set("Topology", ((TopologyRequirement)i.getRequirement()).getTopology().toJson());
            } else {
                throw new IllegalStateException("Instance '" + i.getName()
                    + "' has a requirement that cannot be serialized: " + i.getRequirement());
            }
            instanceJs.put("Function", i.getFunction());
        }
        ArrayNode channelsJs = result.putArray("Channels");
        channels.forEach(c -> channelsJs.add(c.toJson()));
        return result;
    }
}
