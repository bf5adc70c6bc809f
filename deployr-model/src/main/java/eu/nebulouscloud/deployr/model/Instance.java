package eu.nebulouscloud.deployr.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A requested instance: a unit of work that needs one host satisfying its
 * requirement, and that runs the named function once deployed.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Instance {

    /** The instance name, unique within its request. */
    private final String name;
    /** Name of the function the instance runs after deployment. */
    private final String function;
    private final HostRequirement requirement;

    public Instance(String name, String function, HostRequirement requirement) {
        this.name = name;
        this.function = function;
        this.requirement = requirement;
    }
}
