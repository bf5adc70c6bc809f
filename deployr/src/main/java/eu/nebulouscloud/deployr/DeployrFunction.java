package eu.nebulouscloud.deployr;

/**
 * User code run by a deployed instance.  The function receives the local
 * {@link DeployR} object, which gives access to the local instance, the
 * deployment and the instance's channels.
 */
@FunctionalInterface
public interface DeployrFunction {

    void run(DeployR deployr);
}
