package dao.da.node.exception;

/**
 * The call ran past its configured deadline. Nothing was committed; callers retry elsewhere.
 */
public class DeadlineExceededException extends NodeException {

    public DeadlineExceededException(String message) {
        super(message);
    }

    public DeadlineExceededException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.TIMEOUT;
    }
}
