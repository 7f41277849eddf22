package dao.da.node.exception;

public class CommitmentException extends NodeException {

    public CommitmentException(String message) {
        super(message);
    }

    public CommitmentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.COMMITMENT;
    }
}
