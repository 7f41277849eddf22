package dao.da.node.exception;

/**
 * Chain height could not be read. Retryable, like a storage outage.
 */
public class ChainUnavailableException extends NodeException {

    public ChainUnavailableException(String message) {
        super(message);
    }

    public ChainUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.UNAVAILABLE;
    }
}
