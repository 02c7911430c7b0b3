package me.golemcore.flow.domain.model;

/**
 * Typed failure categories a node reports back to the workflow executor.
 */
public enum NodeErrorCode {

    /** Node input or configuration is unusable (missing credential, bad field). */
    VALIDATION_ERROR(400),

    /** The node does not implement the requested operation. */
    UNSUPPORTED_OPERATION(422),

    /** The node ran but failed unexpectedly. */
    EXECUTION_FAILED(502);

    private final int httpStatus;

    NodeErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
