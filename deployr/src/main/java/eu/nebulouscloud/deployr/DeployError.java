package eu.nebulouscloud.deployr;

import lombok.Getter;

/**
 * The ways a deployment can fail.  Each kind maps to the process exit code
 * reported for it.
 */
public enum DeployError {
    /** The request could not be read or parsed. */
    CONFIGURATION(2),
    /** Not every requested instance could be paired with a distinct host. */
    INFEASIBLE_DEPLOYMENT(3),
    /** An instance names a function that was never registered. */
    UNREGISTERED_FUNCTION(4),
    /** The deployment received by a participant does not mention its host. */
    MISSING_ASSIGNMENT(5),
    /** A function used a channel in a role its instance does not have. */
    CHANNEL_ROLE(6),
    /** A function threw an exception. */
    FUNCTION_FAILED(7),
    /** Another participant aborted the job. */
    ABORTED(8);

    @Getter
    private final int exitCode;

    DeployError(int exitCode) {
        this.exitCode = exitCode;
    }
}
