package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.domain.PublisherTeam;
import dev.newsroom.entity.Publisher;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PublisherResponse {
    private String id;
    private String name;
    private String description;
    private String website;
    private String ownerId;
    private List<String> editorIds;
    private List<String> journalistIds;
    private LocalDateTime createdAt;

    public static PublisherResponse from(Publisher publisher, PublisherTeam team) {
        PublisherResponseBuilder builder = PublisherResponse.builder()
                .id(String.valueOf(publisher.getId()))
                .name(publisher.getName())
                .description(publisher.getDescription())
                .website(publisher.getWebsite())
                .ownerId(ArticleResponse.idOrNull(publisher.getOwnerId()))
                .createdAt(publisher.getCreatedAt());
        if (team != null) {
            builder.editorIds(ids(team.editorIds())).journalistIds(ids(team.journalistIds()));
        }
        return builder.build();
    }

    private static List<String> ids(Set<Long> ids) {
        return ids.stream().sorted().map(String::valueOf).toList();
    }
}
