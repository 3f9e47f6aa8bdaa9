package dev.newsroom.security;

import java.util.Locale;

/**
 * Stable reason codes attached to every denied {@link Decision}.
 */
public enum DenialReason {
    UNAUTHENTICATED,
    NOT_JOURNALIST,
    NOT_AUTHOR,
    NOT_AUTHOR_OR_EDITOR,
    NOT_EDITOR,
    NO_PUBLISHER_SCOPE,
    NOT_PUBLISHER_EDITOR,
    NOT_VISIBLE,
    NOT_PUBLISHER_OWNER,
    NOT_STAFF,
    NOT_READER,
    NOT_SUBSCRIPTION_OWNER,
    UNSUPPORTED_TARGET;

    public String messageKey() {
        return "error.denied." + name().toLowerCase(Locale.ROOT);
    }
}
