package dao.da.node.exception;

/**
 * Base of every failure the node reports to a caller. Each subclass maps to one
 * {@link ErrorCode}, which the API layer turns into a status.
 */
public abstract class NodeException extends RuntimeException {

    protected NodeException(String message) {
        super(message);
    }

    protected NodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode getCode();
}
