package com.studytrack.badges.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaderboardEntryDTO {
    /** 排名，并列共享名次（1,1,3） */
    private Integer rank;

    private UUID userId;

    /** 昵称，用户表中不存在时为 null */
    private String username;

    private Long badgeCount;
}
