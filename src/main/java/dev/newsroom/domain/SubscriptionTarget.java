package dev.newsroom.domain;

/**
 * What a reader subscribes to: exactly one publisher or one journalist.
 */
public record SubscriptionTarget(Long publisherId, Long journalistId) {

    public static Outcome<SubscriptionTarget> of(Long publisherId, Long journalistId) {
        if ((publisherId == null) == (journalistId == null)) {
            return Outcome.failed(ErrorKind.AMBIGUOUS_TARGET);
        }
        return Outcome.changed(new SubscriptionTarget(publisherId, journalistId));
    }

    public boolean isPublisher() {
        return publisherId != null;
    }

    public boolean isJournalist() {
        return journalistId != null;
    }
}
