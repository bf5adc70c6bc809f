package eu.nebulouscloud.deployr.backend;

/**
 * Code run by {@link Backend#listen()} on behalf of a remote participant.
 * The target answers via {@link Backend#submitReturnValue}.
 */
@FunctionalInterface
public interface RpcTarget {

    void handle(byte[] argument);
}
