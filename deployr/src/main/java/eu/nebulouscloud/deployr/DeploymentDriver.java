package eu.nebulouscloud.deployr;

import eu.nebulouscloud.deployr.backend.Backend;
import eu.nebulouscloud.deployr.model.Request;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a deployment on one participant and turns its outcome into an exit
 * code.  This is the only place where a failed deployment aborts the job.
 */
@Slf4j
public final class DeploymentDriver {

    private DeploymentDriver() { }

    /**
     * Deploy on one participant.
     *
     * @param backend the participant's backend.
     * @param functions the functions instances may run.
     * @param request the request; only used on the coordinator.
     * @return 0 on success, otherwise the exit code of the failure.
     */
    public static int run(Backend backend, FunctionRegistry functions, Request request) {
        DeployR deployr = new DeployR(backend, functions);
        DeployOutcome outcome = deployr.deploy(request);
        if (outcome.isSuccess()) {
            log.info("Participant {} finished", backend.getLocalParticipantId());
            backend.shutdown();
            return 0;
        }
        if (outcome.getError() == DeployError.ABORTED) {
            log.info("Participant {} stopped: {}", backend.getLocalParticipantId(), outcome.getMessage());
            return outcome.getExitCode();
        }
        log.error("Deployment failed on participant {} ({}): {}",
            backend.getLocalParticipantId(), outcome.getError(), outcome.getMessage());
        backend.abort(outcome.getExitCode());
        return outcome.getExitCode();
    }
}
