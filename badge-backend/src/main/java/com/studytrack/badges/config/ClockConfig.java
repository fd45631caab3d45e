package com.studytrack.badges.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 统一的时钟：颁发时间、排行榜生成时间以及"今天"的判定都以它为准
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${badges.zone-id:UTC}") String zoneId) {
        return Clock.system(ZoneId.of(zoneId));
    }
}
