package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubscriptionResponse {
    private String id;
    private String publisherId;
    private String journalistId;
    private LocalDateTime createdAt;
    /** {@code false} when the subscription already existed. */
    private boolean created;

    public static SubscriptionResponse from(Subscription subscription, boolean created) {
        return SubscriptionResponse.builder()
                .id(String.valueOf(subscription.getId()))
                .publisherId(ArticleResponse.idOrNull(subscription.getPublisherId()))
                .journalistId(ArticleResponse.idOrNull(subscription.getJournalistId()))
                .createdAt(subscription.getCreatedAt())
                .created(created)
                .build();
    }
}
