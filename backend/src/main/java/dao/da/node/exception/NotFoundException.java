package dao.da.node.exception;

import lombok.Getter;

/**
 * Unknown or expired retrieval key. A normal outcome, not a fault.
 */
@Getter
public class NotFoundException extends NodeException {

    public enum Reason {
        /** Never stored here, or stored and already reclaimed. */
        UNKNOWN,
        /** Known batch whose custody window has elapsed by chain height. */
        EXPIRED
    }

    private final Reason reason;

    public NotFoundException(String message) {
        this(Reason.UNKNOWN, message);
    }

    public NotFoundException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    @Override
    public ErrorCode getCode() {
        return ErrorCode.NOT_FOUND;
    }
}
