package eu.nebulouscloud.deployr.channel;

/**
 * Thrown when a channel operation is called by an instance that does not
 * hold the required role, e.g., {@code pop} on a producer.
 */
public class ChannelRoleException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ChannelRoleException(String channelName, String operation, String requiredRole) {
        super("Cannot " + operation + " on channel '" + channelName
            + "': this instance is not its " + requiredRole);
    }
}
