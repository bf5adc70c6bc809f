package eu.nebulouscloud.deployr;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps function names, as used by instances in a request, to code.
 * Functions must be registered on every participant before deployment
 * starts, since any participant might be asked to run any instance.
 */
@Slf4j
public class FunctionRegistry {

    private final Map<String, DeployrFunction> functions = new ConcurrentHashMap<>();

    /**
     * Register a function.  A function registered earlier under the same
     * name is replaced.
     */
    public void register(String name, DeployrFunction function) {
        if (functions.put(name, function) != null) {
            log.warn("Function '{}' registered twice, keeping the later one", name);
        }
    }

    public Optional<DeployrFunction> get(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> getNames() {
        return Set.copyOf(functions.keySet());
    }
}
