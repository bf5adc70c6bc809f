package eu.nebulouscloud.deployr.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A requirement given as an explicit topology; satisfied by every host
 * topology it is a {@linkplain Topology#isSubset subset} of.
 */
@EqualsAndHashCode
@ToString
public final class TopologyRequirement implements HostRequirement {

    @Getter
    private final Topology topology;

    public TopologyRequirement(Topology topology) {
        this.topology = topology;
    }

    @Override
    public boolean isSatisfiedBy(Topology hostTopology) {
        return Topology.isSubset(hostTopology, topology);
    }
}
