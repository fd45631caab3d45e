package com.studytrack.badges.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 用户获得徽章的事实记录（只追加，不更新、不删除）。
 * (user_id, badge_id) 唯一约束是并发颁发时唯一的仲裁者。
 */
@Entity
@Table(name = "user_badges",
       uniqueConstraints = @UniqueConstraint(name = "uk_user_badges_user_badge",
                                             columnNames = {"user_id", "badge_id"}),
       indexes = @Index(name = "idx_user_badges_user_id", columnList = "user_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserBadge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "badge_id", nullable = false, length = 50)
    private String badgeId;

    /**
     * 首次满足条件的时间 (NOT NULL)
     */
    @Column(name = "achieved_at", nullable = false)
    private LocalDateTime achievedAt;

    public UserBadge(UUID userId, String badgeId, LocalDateTime achievedAt) {
        this.userId = userId;
        this.badgeId = badgeId;
        this.achievedAt = achievedAt;
    }
}
