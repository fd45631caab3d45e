package com.studytrack.badges.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次检测颁发的结果。newBadges 为空是正常结果，不是错误。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BadgeAwardResultDTO {
    // 本次调用真正新建了记录的徽章，按评估顺序
    private List<BadgeDTO> newBadges;
    // 写入失败的徽章 ID（部分成功时才会非空）
    private List<String> failedBadgeIds;

    public int getBadgeCount() {
        return newBadges == null ? 0 : newBadges.size();
    }

    public static BadgeAwardResultDTO none() {
        return new BadgeAwardResultDTO(List.of(), List.of());
    }
}
