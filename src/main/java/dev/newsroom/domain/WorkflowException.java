package dev.newsroom.domain;

/**
 * Carries a failed {@link Outcome} through a reactive pipeline so the
 * exception handler can turn it into an error response.
 */
public class WorkflowException extends RuntimeException {

    private final ErrorKind kind;

    public WorkflowException(ErrorKind kind) {
        super(kind.name());
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
