package dev.newsroom.exception;

import dev.newsroom.security.Action;
import dev.newsroom.security.Decision;
import dev.newsroom.security.DenialReason;

/**
 * Raised by services when the access control gate denies an action.
 */
public class ActionDeniedException extends RuntimeException {

    private final Action action;
    private final DenialReason reason;

    public ActionDeniedException(Action action, DenialReason reason) {
        super(action + " denied: " + reason);
        this.action = action;
        this.reason = reason;
    }

    public static ActionDeniedException of(Action action, Decision decision) {
        return new ActionDeniedException(action, decision.reason());
    }

    public Action getAction() {
        return action;
    }

    public DenialReason getReason() {
        return reason;
    }
}
