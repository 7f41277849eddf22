package dao.da.node.exception;

public class ValidationException extends NodeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.VALIDATION;
    }
}
