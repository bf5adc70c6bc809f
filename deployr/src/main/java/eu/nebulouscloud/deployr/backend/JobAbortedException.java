package eu.nebulouscloud.deployr.backend;

import lombok.Getter;

/**
 * Thrown out of a blocking {@link Backend} operation when some participant
 * aborted the job.
 */
public class JobAbortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** The exit code passed to {@link Backend#abort}. */
    @Getter
    private final int exitCode;

    public JobAbortedException(int exitCode) {
        super("Job aborted with exit code " + exitCode);
        this.exitCode = exitCode;
    }
}
