package com.studytrack.badges.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * StudySession Entity: 学习记录表 study_sessions（只读）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "study_sessions",
       indexes = @Index(name = "idx_study_sessions_user_id", columnList = "user_id"))
public class StudySession {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /**
     * space_id: 所属自习室，可为空
     */
    @Column(name = "space_id")
    private UUID spaceId;

    @Column(name = "duration_minutes", nullable = false)
    private Integer durationMinutes;

    /**
     * efficiency: 专注效率 (DECIMAL(5,2))，未记录时为 null，不参与平均值计算
     */
    @Column(name = "efficiency", precision = 5, scale = 2)
    private BigDecimal efficiency;

    /**
     * created_at: 用于判定"活跃日"及连续天数
     */
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
