package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Article;
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
public class ArticleResponse {
    private String id;
    private String title;
    private String summary;
    private String content;
    private String authorId;
    private String publisherId;
    private String categoryId;
    private String status;
    private boolean approved;
    private String approvedBy;
    private LocalDateTime approvedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ArticleResponse from(Article article) {
        return ArticleResponse.builder()
                .id(String.valueOf(article.getId()))
                .title(article.getTitle())
                .summary(article.getSummary())
                .content(article.getContent())
                .authorId(idOrNull(article.getAuthorId()))
                .publisherId(idOrNull(article.getPublisherId()))
                .categoryId(idOrNull(article.getCategoryId()))
                .status(article.getStatus().name())
                .approved(article.isApproved())
                .approvedBy(idOrNull(article.getApprovedBy()))
                .approvedAt(article.getApprovedAt())
                .createdAt(article.getCreatedAt())
                .updatedAt(article.getUpdatedAt())
                .build();
    }

    static String idOrNull(Long id) {
        return id != null ? String.valueOf(id) : null;
    }
}
