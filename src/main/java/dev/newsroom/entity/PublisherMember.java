package dev.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Membership row: unique on (publisher_id, user_id, member_role).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("publisher_members")
public class PublisherMember implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("publisher_id")
    private Long publisherId;

    @Column("user_id")
    private Long userId;

    @Column("member_role")
    private MemberRole memberRole;

    @Column("created_at")
    private LocalDateTime createdAt;
}
