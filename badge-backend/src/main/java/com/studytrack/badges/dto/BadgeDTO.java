package com.studytrack.badges.dto;

import com.studytrack.badges.entity.Badge;
import lombok.Data;

import java.math.BigDecimal;

/**
 * 徽章目录条目
 */
@Data
public class BadgeDTO {
    private String id;
    private String title;
    private String description;
    private String icon;
    private String category;
    private String requirementType;
    private BigDecimal requirementValue;

    public static BadgeDTO from(Badge badge) {
        BadgeDTO dto = new BadgeDTO();
        dto.setId(badge.getId());
        dto.setTitle(badge.getTitle());
        dto.setDescription(badge.getDescription());
        dto.setIcon(badge.getIcon());
        dto.setCategory(badge.getCategory());
        dto.setRequirementType(badge.getRequirementType());
        dto.setRequirementValue(badge.getRequirementValue());
        return dto;
    }
}
