package dao.da.node.exception;

/**
 * Key-value backend failure. Fatal for the call, not for the process.
 */
public class StorageException extends NodeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.STORAGE;
    }
}
