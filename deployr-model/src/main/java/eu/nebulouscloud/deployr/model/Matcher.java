package eu.nebulouscloud.deployr.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.alg.interfaces.MatchingAlgorithm;
import org.jgrapht.alg.matching.HopcroftKarpMaximumCardinalityBipartiteMatching;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

import lombok.extern.slf4j.Slf4j;

/**
 * Pair requested instances with hosts.  We build a bipartite graph with
 * one vertex per instance and one per host, and an edge wherever the host
 * satisfies the instance's requirement, then compute a maximum matching
 * with the Hopcroft-Karp algorithm.
 *
 * <p>Vertices {@code 0..n-1} are the instances in request order, vertices
 * {@code n..n+m-1} are the hosts in host list order.  When more than one
 * maximum matching exists, which one is returned is unspecified.
 */
@Slf4j
public final class Matcher {

    private Matcher() { }

    /**
     * Match the request's instances to the given hosts.
     *
     * @param request the request.
     * @param hosts the hosts; a host's position in this list need not equal
     *  its host index.
     * @return the maximum matching found.  Check {@link
     *  MatchResult#isComplete()} before using it.
     */
    public static MatchResult match(Request request, List<Host> hosts) {
        List<Instance> instances = new ArrayList<>(request.getInstances().values());
        int n = instances.size();
        if (n == 0) {
            log.debug("Request '{}' has no instances, trivially matched", request.getName());
            return new MatchResult(0, List.of());
        }
        Graph<Integer, DefaultEdge> graph = new SimpleGraph<>(DefaultEdge.class);
        Set<Integer> instanceVertices = new LinkedHashSet<>();
        Set<Integer> hostVertices = new LinkedHashSet<>();
        for (int i = 0; i < n; i++) {
            graph.addVertex(i);
            instanceVertices.add(i);
        }
        for (int j = 0; j < hosts.size(); j++) {
            graph.addVertex(n + j);
            hostVertices.add(n + j);
        }
        int edges = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < hosts.size(); j++) {
                if (hosts.get(j).isCompatible(instances.get(i).getRequirement())) {
                    graph.addEdge(i, n + j);
                    edges++;
                }
            }
        }
        log.debug("Compatibility graph for request '{}': {} instances, {} hosts, {} edges",
            request.getName(), n, hosts.size(), edges);

        MatchingAlgorithm.Matching<Integer, DefaultEdge> matching
            = new HopcroftKarpMaximumCardinalityBipartiteMatching<>(graph, instanceVertices, hostVertices)
                .getMatching();

        // Index by instance vertex so that pairings come out in request order
        Pairing[] byInstance = new Pairing[n];
        for (DefaultEdge e : matching.getEdges()) {
            int a = graph.getEdgeSource(e);
            int b = graph.getEdgeTarget(e);
            int instance = Math.min(a, b);
            int host = Math.max(a, b) - n;
            byInstance[instance] = new Pairing(instances.get(instance).getName(), hosts.get(host).getHostIndex());
        }
        List<Pairing> ordered = new ArrayList<>();
        for (Pairing p : byInstance) {
            if (p != null) ordered.add(p);
        }
        log.debug("Matched {} of {} instances of request '{}'", ordered.size(), n, request.getName());
        return new MatchResult(n, ordered);
    }
}
