package com.studytrack.badges.service;

import com.studytrack.badges.dto.LeaderboardDTO;
import com.studytrack.badges.dto.LeaderboardEntryDTO;
import com.studytrack.badges.exception.InvalidArgumentException;
import com.studytrack.badges.store.BadgeStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 徽章收集排行榜：按徽章数降序，数量相同按 userId 升序（字符串顺序）。
 * 名次采用并列共享：5,5,3 得到 1,1,3。
 */
@Service
public class BadgeLeaderboardService {

    private static final Comparator<Map.Entry<UUID, Long>> BY_COUNT_THEN_USER =
            Map.Entry.<UUID, Long>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(e -> e.getKey().toString());

    private final BadgeStore badgeStore;
    private final Clock clock;
    private final int maxLimit;

    public BadgeLeaderboardService(BadgeStore badgeStore,
                                   Clock clock,
                                   @Value("${badges.leaderboard.max-limit:100}") int maxLimit) {
        this.badgeStore = badgeStore;
        this.clock = clock;
        this.maxLimit = maxLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    /**
     * @param limit 返回的最大条数，必须在 [1, maxLimit] 之间
     * @throws InvalidArgumentException limit 越界（在任何查询之前校验）
     */
    public LeaderboardDTO getLeaderboard(int limit) {
        if (limit < 1 || limit > maxLimit) {
            throw new InvalidArgumentException("Limit must be between 1 and " + maxLimit + ", got " + limit);
        }

        Map<UUID, Long> counts = badgeStore.countAwardsByUser();

        List<Map.Entry<UUID, Long>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(BY_COUNT_THEN_USER);

        List<Map.Entry<UUID, Long>> top = ranked.size() > limit ? ranked.subList(0, limit) : ranked;
        Map<UUID, String> usernames = badgeStore.findUsernames(top.stream().map(Map.Entry::getKey).toList());

        List<LeaderboardEntryDTO> entries = new ArrayList<>(top.size());
        int rank = 0;
        Long previousCount = null;
        for (int i = 0; i < top.size(); i++) {
            Map.Entry<UUID, Long> e = top.get(i);
            // 与上一名数量不同时，名次跳到当前位置（前面并列的人数已计入 i）
            if (!e.getValue().equals(previousCount)) {
                rank = i + 1;
                previousCount = e.getValue();
            }
            entries.add(LeaderboardEntryDTO.builder()
                    .rank(rank)
                    .userId(e.getKey())
                    .username(usernames.get(e.getKey()))
                    .badgeCount(e.getValue())
                    .build());
        }

        return new LeaderboardDTO(entries, counts.size(), LocalDateTime.now(clock));
    }
}
