package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Newsletter;
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
public class NewsletterResponse {
    private String id;
    private String title;
    private String content;
    private String authorId;
    private String publisherId;
    private LocalDateTime createdAt;

    public static NewsletterResponse from(Newsletter newsletter) {
        return NewsletterResponse.builder()
                .id(String.valueOf(newsletter.getId()))
                .title(newsletter.getTitle())
                .content(newsletter.getContent())
                .authorId(ArticleResponse.idOrNull(newsletter.getAuthorId()))
                .publisherId(ArticleResponse.idOrNull(newsletter.getPublisherId()))
                .createdAt(newsletter.getCreatedAt())
                .build();
    }
}
