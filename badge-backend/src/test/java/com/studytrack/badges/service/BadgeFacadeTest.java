package com.studytrack.badges.service;

import com.studytrack.badges.dto.BadgeAwardResultDTO;
import com.studytrack.badges.dto.BadgeDTO;
import com.studytrack.badges.dto.CommonResponse;
import com.studytrack.badges.dto.LeaderboardDTO;
import com.studytrack.badges.dto.UserBadgesDTO;
import com.studytrack.badges.exception.DataUnavailableException;
import com.studytrack.badges.exception.ErrorType;
import com.studytrack.badges.exception.InvalidArgumentException;
import com.studytrack.badges.exception.PersistenceFailureException;
import com.studytrack.badges.exception.UnknownRequirementKindException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class BadgeFacadeTest {

    @Mock
    private BadgeQueryService badgeQueryService;

    @Mock
    private BadgeAwardService badgeAwardService;

    @Mock
    private BadgeLeaderboardService badgeLeaderboardService;

    @InjectMocks
    private BadgeFacade badgeFacade;

    private final UUID userId = UUID.randomUUID();

    @Test
    void testGetUserBadges_Success() {
        when(badgeQueryService.getUserBadges(userId)).thenReturn(UserBadgesDTO.empty());

        CommonResponse<UserBadgesDTO> response = badgeFacade.getUserBadges(userId.toString());

        assertTrue(response.getSuccess());
        assertEquals(200, response.getCode());
        assertNull(response.getError());
        assertEquals(0, response.getData().getTotalBadges());
    }

    @Test
    void testGetUserBadges_DataUnavailable() {
        when(badgeQueryService.getUserBadges(userId))
                .thenThrow(new DataUnavailableException("Failed to read badges", new RuntimeException()));

        CommonResponse<UserBadgesDTO> response = badgeFacade.getUserBadges(userId.toString());

        assertFalse(response.getSuccess());
        assertEquals(503, response.getCode());
        assertEquals(ErrorType.DATA_UNAVAILABLE, response.getError());
        assertNull(response.getData());
    }

    // 非法的 user_id 在任何查询之前被拒绝
    @Test
    void testGetUserBadges_InvalidUserId() {
        CommonResponse<UserBadgesDTO> missing = badgeFacade.getUserBadges(" ");
        CommonResponse<UserBadgesDTO> malformed = badgeFacade.getUserBadges("not-a-uuid");

        assertEquals(400, missing.getCode());
        assertEquals(ErrorType.INVALID_ARGUMENT, malformed.getError());
        verifyNoInteractions(badgeQueryService);
    }

    @Test
    void testCheckAndAward_MessageReportsCountAndFailures() {
        BadgeDTO badge = new BadgeDTO();
        badge.setId("first_session");
        when(badgeAwardService.checkAndAward(userId))
                .thenReturn(new BadgeAwardResultDTO(List.of(badge), List.of("7_day_streak")));

        CommonResponse<BadgeAwardResultDTO> response = badgeFacade.checkAndAward(userId.toString());

        assertTrue(response.getSuccess());
        assertEquals("Awarded 1 new badges, failed to persist [7_day_streak]", response.getMessage());
        assertEquals(1, response.getData().getBadgeCount());
    }

    @Test
    void testCheckAndAward_NothingNewIsSuccess() {
        when(badgeAwardService.checkAndAward(userId)).thenReturn(BadgeAwardResultDTO.none());

        CommonResponse<BadgeAwardResultDTO> response = badgeFacade.checkAndAward(userId.toString());

        assertTrue(response.getSuccess());
        assertEquals("Awarded 0 new badges", response.getMessage());
    }

    @Test
    void testCheckAndAward_ErrorsMapToCodes() {
        when(badgeAwardService.checkAndAward(userId))
                .thenThrow(new PersistenceFailureException("all writes failed"))
                .thenThrow(new UnknownRequirementKindException("level"));

        CommonResponse<BadgeAwardResultDTO> persistence = badgeFacade.checkAndAward(userId.toString());
        CommonResponse<BadgeAwardResultDTO> catalog = badgeFacade.checkAndAward(userId.toString());

        assertEquals(ErrorType.PERSISTENCE_FAILURE, persistence.getError());
        assertEquals(500, persistence.getCode());
        assertEquals(ErrorType.UNKNOWN_REQUIREMENT_KIND, catalog.getError());
        assertEquals(500, catalog.getCode());
    }

    // 引擎分类之外的异常同样转换为 500 响应，不向外抛出
    @Test
    void testCheckAndAward_UnexpectedExceptionBecomesInternalError() {
        when(badgeAwardService.checkAndAward(userId)).thenThrow(new IllegalStateException("boom"));

        CommonResponse<BadgeAwardResultDTO> response =
                assertDoesNotThrow(() -> badgeFacade.checkAndAward(userId.toString()));

        assertFalse(response.getSuccess());
        assertEquals(500, response.getCode());
        assertEquals(ErrorType.INTERNAL_ERROR, response.getError());
        assertEquals("Internal error during checkAndAward", response.getMessage());
    }

    @Test
    void testCheckAndAward_MissingUserId() {
        CommonResponse<BadgeAwardResultDTO> response = badgeFacade.checkAndAward(null);

        assertEquals(400, response.getCode());
        assertEquals("Missing required field: user_id", response.getMessage());
        verifyNoInteractions(badgeAwardService);
    }

    @Test
    void testGetLeaderboard_ParsesLimit() {
        LeaderboardDTO dto = new LeaderboardDTO(List.of(), 0, LocalDateTime.now());
        when(badgeLeaderboardService.getLeaderboard(25)).thenReturn(dto);

        CommonResponse<LeaderboardDTO> response = badgeFacade.getLeaderboard(" 25 ");

        assertTrue(response.getSuccess());
        assertSame(dto, response.getData());
    }

    @Test
    void testGetLeaderboard_NonNumericLimit() {
        when(badgeLeaderboardService.getMaxLimit()).thenReturn(100);

        CommonResponse<LeaderboardDTO> response = badgeFacade.getLeaderboard("abc");

        assertEquals(400, response.getCode());
        assertEquals("Invalid limit parameter. Must be a number between 1 and 100", response.getMessage());
        verify(badgeLeaderboardService, never()).getLeaderboard(anyInt());
    }

    @Test
    void testGetLeaderboard_OutOfRangeLimit() {
        when(badgeLeaderboardService.getMaxLimit()).thenReturn(100);
        when(badgeLeaderboardService.getLeaderboard(101))
                .thenThrow(new InvalidArgumentException("Limit must be between 1 and 100, got 101"));

        CommonResponse<LeaderboardDTO> response = badgeFacade.getLeaderboard("101");

        assertFalse(response.getSuccess());
        assertEquals(ErrorType.INVALID_ARGUMENT, response.getError());
    }

    @Test
    void testGetBadgeCatalog() {
        when(badgeQueryService.getBadgeCatalog()).thenReturn(List.of(new BadgeDTO(), new BadgeDTO()));

        CommonResponse<List<BadgeDTO>> response = badgeFacade.getBadgeCatalog();

        assertEquals("Retrieved 2 badges", response.getMessage());
        verify(badgeQueryService, never()).getUserBadges(any());
    }
}
