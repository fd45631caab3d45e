package com.studytrack.badges.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardDTO {
    private List<LeaderboardEntryDTO> leaderboard;
    // 至少拥有一枚徽章的用户总数，与 limit 无关
    private Integer totalUsers;
    private LocalDateTime generatedAt;
}
