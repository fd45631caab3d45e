package com.studytrack.badges.service;

import com.studytrack.badges.badge.ActivityStats;

import java.util.UUID;

public interface ActivityStatsService {

    /**
     * 根据用户全部学习记录计算统计快照。读取失败时抛出 DataUnavailableException，绝不返回全零结果。
     */
    ActivityStats computeStats(UUID userId);
}
