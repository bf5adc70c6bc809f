package eu.nebulouscloud.deployr.model;

/**
 * What an instance needs from the host it runs on.  The matcher draws an
 * edge between an instance and a host exactly when the host's topology
 * satisfies the instance's requirement.
 */
public interface HostRequirement {

    /**
     * @param hostTopology the topology reported by a host.
     * @return true if an instance with this requirement can run there.
     */
    boolean isSatisfiedBy(Topology hostTopology);
}
