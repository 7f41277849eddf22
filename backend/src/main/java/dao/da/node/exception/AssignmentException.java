package dao.da.node.exception;

public class AssignmentException extends NodeException {

    public AssignmentException(String message) {
        super(message);
    }

    public AssignmentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.ASSIGNMENT;
    }
}
