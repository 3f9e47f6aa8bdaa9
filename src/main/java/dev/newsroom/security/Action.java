package dev.newsroom.security;

/**
 * Operations guarded by {@link AccessControlGate}.
 */
public enum Action {
    CREATE_ARTICLE,
    EDIT_ARTICLE,
    SUBMIT_ARTICLE,
    APPROVE_ARTICLE,
    REJECT_ARTICLE,
    VIEW_ARTICLE,
    CREATE_NEWSLETTER,
    MANAGE_PUBLISHER_TEAM,
    CREATE_PUBLISHER,
    EDIT_PUBLISHER,
    LIST_PUBLISHERS,
    SUBSCRIBE,
    UNSUBSCRIBE
}
