package com.studytrack.badges.service;

import com.studytrack.badges.dto.BadgeDTO;
import com.studytrack.badges.dto.UserBadgeProgressDTO;
import com.studytrack.badges.dto.UserBadgesDTO;

import java.util.List;
import java.util.UUID;

public interface BadgeQueryService {
    UserBadgesDTO getUserBadges(UUID userId);
    List<BadgeDTO> getBadgeCatalog();
    List<UserBadgeProgressDTO> getBadgeProgress(UUID userId);
}
