package dev.newsroom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublisherDashboardResponse {
    private PublisherResponse publisher;
    private List<ArticleResponse> recentArticles;
    private List<NewsletterResponse> recentNewsletters;
    private long articleCount;
    private long subscriberCount;
}
