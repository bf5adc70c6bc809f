package eu.nebulouscloud.deployr;

import lombok.Getter;
import lombok.ToString;

/**
 * The result of running {@link DeployR#deploy} on one participant.
 */
@ToString
public final class DeployOutcome {

    private static final DeployOutcome SUCCESS = new DeployOutcome(null, "success", 0);

    /** The failure kind, or null on success. */
    @Getter
    private final DeployError error;
    @Getter
    private final String message;
    @Getter
    private final int exitCode;

    private DeployOutcome(DeployError error, String message, int exitCode) {
        this.error = error;
        this.message = message;
        this.exitCode = exitCode;
    }

    public static DeployOutcome success() {
        return SUCCESS;
    }

    public static DeployOutcome failure(DeployError error, String message) {
        return new DeployOutcome(error, message, error.getExitCode());
    }

    /** The job was aborted elsewhere with {@code exitCode}. */
    public static DeployOutcome aborted(int exitCode) {
        return new DeployOutcome(DeployError.ABORTED,
            "job aborted by another participant with exit code " + exitCode,
            exitCode == 0 ? DeployError.ABORTED.getExitCode() : exitCode);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
