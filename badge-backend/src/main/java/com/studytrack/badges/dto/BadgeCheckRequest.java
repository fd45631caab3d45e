package com.studytrack.badges.dto;

import lombok.Data;

/**
 * POST /api/badges/check 请求体：{"user_id": "..."}
 */
@Data
public class BadgeCheckRequest {
    private String userId;
}
