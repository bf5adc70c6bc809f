package eu.nebulouscloud.deployr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import eu.nebulouscloud.deployr.backend.SystemTopologyDetector;
import eu.nebulouscloud.deployr.local.LocalCluster;
import eu.nebulouscloud.deployr.model.Request;
import eu.nebulouscloud.deployr.model.RequestParseException;
import eu.nebulouscloud.deployr.model.Topology;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Deploy a request on hosts emulated by threads of this JVM.
 */
@Slf4j
@Command(name = "local",
    aliases = {"l"},
    description = "Deploy a request on local emulated hosts, one thread per host.",
    mixinStandardHelpOptions = true)
public class LocalExecution implements Callable<Integer> {

    private static final ObjectMapper jsonMapper = new ObjectMapper();
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @Parameters(description = "The file containing the request, in JSON or (with extension .yml or .yaml) YAML format")
    private Path requestFile;

    @Option(names = {"--hosts"},
        description = "File describing the emulated hosts, as {\"Hosts\": [{\"Topology\": ...}, ...]}.  Host i is participant i; participant 0 is the coordinator.")
    private Path hostsFile;

    @Option(names = {"--participants", "-n"},
        description = "Number of emulated hosts when no hosts file is given; each reports the topology of this machine.  Default: one per requested instance.",
        defaultValue = "0")
    private int participants;

    @Option(names = { "--demo-functions" },
        description = "Register the functions '" + DemoFunctions.COORDINATOR + "' and '" + DemoFunctions.WORKER + "' (default true).",
        defaultValue = "true", fallbackValue = "true",
        negatable = true)
    private boolean demoFunctions;

    /** Functions added by code that embeds this command. */
    private final FunctionRegistry functions;

    public LocalExecution() {
        this(new FunctionRegistry());
    }

    public LocalExecution(FunctionRegistry functions) {
        this.functions = functions;
    }

    static ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".yml") || name.endsWith(".yaml") ? yamlMapper : jsonMapper;
    }

    static JsonNode readFile(Path file) throws IOException {
        return mapperFor(file).readTree(Files.readString(file, StandardCharsets.UTF_8));
    }

    static List<Topology> readHosts(JsonNode hostsJs) {
        JsonNode hosts = hostsJs.get("Hosts");
        if (hosts == null || !hosts.isArray()) {
            throw new RequestParseException("Hosts file: expected an array under \"Hosts\"");
        }
        List<Topology> result = new ArrayList<>();
        for (JsonNode host : hosts) {
            result.add(Topology.fromJson(host.get("Topology")));
        }
        return result;
    }

    @Override public Integer call() {
        Request request;
        List<Topology> topologies;
        try {
            request = Request.fromJson(readFile(requestFile));
            if (hostsFile != null) {
                topologies = readHosts(readFile(hostsFile));
            } else {
                int count = participants > 0 ? participants : Math.max(1, request.getInstances().size());
                topologies = Collections.nCopies(count, SystemTopologyDetector.detect());
            }
        } catch (IOException e) {
            log.error("Could not read an input file", e);
            return DeployError.CONFIGURATION.getExitCode();
        } catch (RequestParseException e) {
            log.error("Invalid input: {}", e.getMessage());
            return DeployError.CONFIGURATION.getExitCode();
        }
        if (topologies.isEmpty()) {
            log.error("No hosts given");
            return DeployError.CONFIGURATION.getExitCode();
        }
        if (demoFunctions) {
            DemoFunctions.registerAll(functions);
        }
        log.info("Deploying request '{}' with {} instances on {} local hosts",
            request.getName(), request.getInstances().size(), topologies.size());

        LocalCluster cluster = new LocalCluster(topologies);
        List<Integer> exitCodes = cluster.run(backend ->
            DeploymentDriver.run(backend, functions, backend.isCoordinator() ? request : null));
        log.debug("Participant exit codes: {}", exitCodes);
        return exitCodes.stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
