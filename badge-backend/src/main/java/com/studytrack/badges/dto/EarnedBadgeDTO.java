package com.studytrack.badges.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户已获得的徽章：颁发记录 + 目录元数据
 */
@Data
public class EarnedBadgeDTO {
    private Long id;                // user_badges 记录 ID
    private String badgeId;
    private String title;
    private String description;
    private String icon;
    private String category;
    private LocalDateTime achievedAt;
}
