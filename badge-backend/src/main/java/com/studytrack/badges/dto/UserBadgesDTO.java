package com.studytrack.badges.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 用户徽章全量视图
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserBadgesDTO {
    // 按获得时间倒序
    private List<EarnedBadgeDTO> badges;
    private Integer totalBadges;
    // 分类 -> 已获得数量，数量为 0 的分类不出现
    private Map<String, Integer> badgeCategories;
    private List<EarnedBadgeDTO> recentBadges;

    public static UserBadgesDTO empty() {
        return new UserBadgesDTO(List.of(), 0, Map.of(), List.of());
    }
}
