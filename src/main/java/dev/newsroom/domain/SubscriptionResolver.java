package dev.newsroom.domain;

import dev.newsroom.entity.Newsletter;
import dev.newsroom.entity.Subscription;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the newsletters a reader sees from their subscriptions.
 * <p>
 * Visible = newsletters whose publisher is subscribed OR whose author is
 * subscribed, deduplicated by id, newest first (ties broken by id), capped
 * at the page size.
 */
public final class SubscriptionResolver {

    public static final int DEFAULT_PAGE_SIZE = 50;

    private static final Comparator<Newsletter> NEWEST_FIRST = Comparator
            .comparing(Newsletter::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(Newsletter::getId, Comparator.nullsLast(Comparator.<Long>reverseOrder()));

    private SubscriptionResolver() {
        // utility class
    }

    public static Set<Long> publisherIds(Collection<Subscription> subscriptions) {
        return subscriptions.stream()
                .map(Subscription::getPublisherId)
                .filter(java.util.Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    public static Set<Long> journalistIds(Collection<Subscription> subscriptions) {
        return subscriptions.stream()
                .map(Subscription::getJournalistId)
                .filter(java.util.Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param subscriptions the reader's subscription rows
     * @param candidates    newsletters to choose from; anything not matching a subscription is dropped
     * @param pageSize      maximum number of newsletters returned
     */
    public static List<Newsletter> resolveVisibleNewsletters(Collection<Subscription> subscriptions,
                                                             Collection<Newsletter> candidates,
                                                             int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        Set<Long> publishers = publisherIds(subscriptions);
        Set<Long> journalists = journalistIds(subscriptions);
        if (publishers.isEmpty() && journalists.isEmpty()) {
            return List.of();
        }

        Map<Long, Newsletter> unique = new LinkedHashMap<>();
        for (Newsletter newsletter : candidates) {
            boolean visible = (newsletter.getPublisherId() != null && publishers.contains(newsletter.getPublisherId()))
                    || (newsletter.getAuthorId() != null && journalists.contains(newsletter.getAuthorId()));
            if (visible) {
                unique.putIfAbsent(newsletter.getId(), newsletter);
            }
        }
        return unique.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(pageSize)
                .toList();
    }
}
