package com.studytrack.badges.controller;

import com.studytrack.badges.dto.BadgeAwardResultDTO;
import com.studytrack.badges.dto.BadgeCheckRequest;
import com.studytrack.badges.dto.BadgeDTO;
import com.studytrack.badges.dto.CommonResponse;
import com.studytrack.badges.dto.LeaderboardDTO;
import com.studytrack.badges.dto.UserBadgeProgressDTO;
import com.studytrack.badges.dto.UserBadgesDTO;
import com.studytrack.badges.service.BadgeFacade;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/badges")
public class BadgeController {

    private final BadgeFacade badgeFacade;

    public BadgeController(BadgeFacade badgeFacade) {
        this.badgeFacade = badgeFacade;
    }

    /**
     * **路径: GET /api/badges**
     * 功能: 获取徽章目录
     */
    @GetMapping
    public ResponseEntity<CommonResponse<List<BadgeDTO>>> getBadgeCatalog() {
        return toResponse(badgeFacade.getBadgeCatalog());
    }

    /**
     * **路径: GET /api/badges/user/{userId}**
     * 功能: 获取用户已获得的徽章、分类统计和最近获得的徽章
     */
    @GetMapping("/user/{userId}")
    public ResponseEntity<CommonResponse<UserBadgesDTO>> getUserBadges(@PathVariable("userId") String userId) {
        return toResponse(badgeFacade.getUserBadges(userId));
    }

    /**
     * **路径: GET /api/badges/user/{userId}/progress**
     * 功能: 目录中每个徽章的获得状态和进度
     */
    @GetMapping("/user/{userId}/progress")
    public ResponseEntity<CommonResponse<List<UserBadgeProgressDTO>>> getBadgeProgress(
            @PathVariable("userId") String userId) {
        return toResponse(badgeFacade.getBadgeProgress(userId));
    }

    /**
     * **路径: POST /api/badges/check**  body: {"user_id": "uuid"}
     * 功能: 检测并颁发新徽章
     */
    @PostMapping("/check")
    public ResponseEntity<CommonResponse<BadgeAwardResultDTO>> checkAndAward(
            @RequestBody(required = false) BadgeCheckRequest request) {
        return toResponse(badgeFacade.checkAndAward(request == null ? null : request.getUserId()));
    }

    /**
     * **路径: GET /api/badges/leaderboard?limit=50**
     * @param limit 结果数量 (1-100, 默认 50)
     */
    @GetMapping("/leaderboard")
    public ResponseEntity<CommonResponse<LeaderboardDTO>> getLeaderboard(
            @RequestParam(value = "limit", required = false, defaultValue = "50") String limit) {
        return toResponse(badgeFacade.getLeaderboard(limit));
    }

    private <T> ResponseEntity<CommonResponse<T>> toResponse(CommonResponse<T> body) {
        return ResponseEntity.status(body.getCode()).body(body);
    }
}
