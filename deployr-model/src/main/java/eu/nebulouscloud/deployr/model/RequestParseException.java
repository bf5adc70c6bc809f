package eu.nebulouscloud.deployr.model;

/**
 * Thrown when a request, topology or deployment document is malformed:
 * missing or mistyped fields, duplicate names, dangling references, or a
 * channel whose consumer is also one of its producers.
 */
public class RequestParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public RequestParseException(String message) {
        super(message);
    }

    public RequestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
