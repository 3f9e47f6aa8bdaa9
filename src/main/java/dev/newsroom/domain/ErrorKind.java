package dev.newsroom.domain;

/**
 * Recoverable failure kinds returned by the workflow engine.
 * The name doubles as the stable error code exposed to clients.
 */
public enum ErrorKind {
    ROLE_MISMATCH,
    INVALID_TRANSITION,
    NO_PUBLISHER_SCOPE,
    AMBIGUOUS_TARGET,
    NOT_OWNER,
    ALREADY_DECIDED,
    NOT_FOUND;

    /**
     * i18n key used by the exception handler to render a message.
     */
    public String messageKey() {
        return "error.workflow." + name().toLowerCase(java.util.Locale.ROOT);
    }
}
