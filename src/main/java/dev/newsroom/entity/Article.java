package dev.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("articles")
@Getter
@Setter
@ToString(exclude = {"content"})
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Article implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String title;

    private String summary;

    private String content;

    @Column("author_id")
    private Long authorId;

    @Column("publisher_id")
    private Long publisherId;

    @Column("category_id")
    private Long categoryId;

    @Builder.Default
    private ArticleStatus status = ArticleStatus.DRAFT;

    @Column("approved_by")
    private Long approvedBy;

    @Column("approved_at")
    private LocalDateTime approvedAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public boolean isApproved() {
        return status == ArticleStatus.PUBLISHED;
    }

    public boolean isPublished() {
        return status == ArticleStatus.PUBLISHED;
    }

    public boolean hasPublisher() {
        return publisherId != null;
    }
}
