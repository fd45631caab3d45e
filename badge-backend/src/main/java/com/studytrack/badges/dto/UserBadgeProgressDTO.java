package com.studytrack.badges.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 目录中每个徽章对某个用户的状态（是否获得 + 进度）
 */
@Data
public class UserBadgeProgressDTO {
    private BadgeDTO badge;
    private Boolean earned;
    private LocalDateTime achievedAt;   // 未获得时为 null
    private BadgeProgressDTO progress;
}
