package com.studytrack.badges.service;

import com.studytrack.badges.dto.BadgeAwardResultDTO;
import com.studytrack.badges.dto.BadgeDTO;
import com.studytrack.badges.dto.CommonResponse;
import com.studytrack.badges.dto.LeaderboardDTO;
import com.studytrack.badges.dto.UserBadgeProgressDTO;
import com.studytrack.badges.dto.UserBadgesDTO;
import com.studytrack.badges.exception.BadgeEngineException;
import com.studytrack.badges.exception.ErrorType;
import com.studytrack.badges.exception.InvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 徽章引擎对请求层暴露的入口。
 * 每个操作都返回 {@link CommonResponse}，不向外抛出任何异常；参数解析也在这里完成，
 * 校验错误在任何 I/O 之前返回。
 */
@Service
public class BadgeFacade {

    private static final Logger log = LoggerFactory.getLogger(BadgeFacade.class);

    private final BadgeQueryService badgeQueryService;
    private final BadgeAwardService badgeAwardService;
    private final BadgeLeaderboardService badgeLeaderboardService;

    public BadgeFacade(BadgeQueryService badgeQueryService,
                       BadgeAwardService badgeAwardService,
                       BadgeLeaderboardService badgeLeaderboardService) {
        this.badgeQueryService = badgeQueryService;
        this.badgeAwardService = badgeAwardService;
        this.badgeLeaderboardService = badgeLeaderboardService;
    }

    public CommonResponse<List<BadgeDTO>> getBadgeCatalog() {
        return execute("getBadgeCatalog",
                badgeQueryService::getBadgeCatalog,
                list -> "Retrieved " + list.size() + " badges");
    }

    public CommonResponse<UserBadgesDTO> getUserBadges(String userId) {
        return execute("getUserBadges",
                () -> badgeQueryService.getUserBadges(parseUserId(userId)),
                dto -> "Retrieved user badges");
    }

    public CommonResponse<List<UserBadgeProgressDTO>> getBadgeProgress(String userId) {
        return execute("getBadgeProgress",
                () -> badgeQueryService.getBadgeProgress(parseUserId(userId)),
                list -> "Retrieved badge progress");
    }

    public CommonResponse<BadgeAwardResultDTO> checkAndAward(String userId) {
        return execute("checkAndAward",
                () -> badgeAwardService.checkAndAward(parseUserId(userId)),
                result -> {
                    String message = "Awarded " + result.getBadgeCount() + " new badges";
                    if (!result.getFailedBadgeIds().isEmpty()) {
                        message += ", failed to persist " + result.getFailedBadgeIds();
                    }
                    return message;
                });
    }

    public CommonResponse<LeaderboardDTO> getLeaderboard(String limit) {
        return execute("getLeaderboard",
                () -> badgeLeaderboardService.getLeaderboard(parseLimit(limit)),
                dto -> "Retrieved badge leaderboard");
    }

    private <T> CommonResponse<T> execute(String operation, Supplier<T> call, Function<T, String> message) {
        try {
            T data = call.get();
            return CommonResponse.success(data, message.apply(data));
        } catch (InvalidArgumentException e) {
            return CommonResponse.error(e.getErrorType(), e.getMessage());
        } catch (BadgeEngineException e) {
            switch (e.getErrorType()) {
                case DATA_UNAVAILABLE -> log.warn("{} failed: {}", operation, e.getMessage(), e);
                default -> log.error("{} failed: {}", operation, e.getMessage(), e);
            }
            return CommonResponse.error(e.getErrorType(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", operation, e);
            return CommonResponse.error(ErrorType.INTERNAL_ERROR, "Internal error during " + operation);
        }
    }

    private UUID parseUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidArgumentException("Missing required field: user_id");
        }
        try {
            return UUID.fromString(userId.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Invalid user_id: " + userId);
        }
    }

    private int parseLimit(String limit) {
        String invalid = "Invalid limit parameter. Must be a number between 1 and "
                + badgeLeaderboardService.getMaxLimit();
        if (limit == null) {
            throw new InvalidArgumentException(invalid);
        }
        try {
            return Integer.parseInt(limit.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException(invalid);
        }
    }
}
