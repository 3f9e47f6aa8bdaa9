package dev.newsroom.security;

/**
 * Allow/deny outcome of {@link AccessControlGate#authorize}. A denial always carries a reason.
 */
public record Decision(boolean allowed, DenialReason reason) {

    private static final Decision ALLOW = new Decision(true, null);

    public Decision {
        if (!allowed && reason == null) {
            throw new IllegalArgumentException("A denial needs a reason");
        }
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny(DenialReason reason) {
        return new Decision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
