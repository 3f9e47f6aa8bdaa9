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

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Entity representing a single-use password reset token.
 * The stored {@code token} is the SHA-256 hash of the value sent by email.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("password_reset_tokens")
public class PasswordResetToken implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("user_id")
    private Long userId;

    @Column("token")
    private String token;

    @Column("used")
    @Builder.Default
    private Boolean used = false;

    @Column("used_at")
    private LocalDateTime usedAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    public boolean isExpired(Duration validity, LocalDateTime now) {
        return createdAt == null || !now.isBefore(createdAt.plus(validity));
    }

    public boolean isValid(Duration validity, LocalDateTime now) {
        return !Boolean.TRUE.equals(used) && !isExpired(validity, now);
    }
}
