package me.golemcore.flow.domain.model;

/**
 * Typed execution error returned to the workflow executor.
 */
public class NodeExecutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final NodeErrorCode code;

    public NodeExecutionException(NodeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public NodeExecutionException(NodeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public NodeErrorCode getCode() {
        return code;
    }
}
