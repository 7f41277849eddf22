package dao.da.node.exception;

public enum ErrorCode {
    VALIDATION,
    ASSIGNMENT,
    COMMITMENT,
    NOT_FOUND,
    TIMEOUT,
    STORAGE,
    UNAVAILABLE
}
