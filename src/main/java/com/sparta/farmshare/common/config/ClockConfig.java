package com.sparta.farmshare.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 만료/잠금 시간 계산에 사용하는 시계
 * 테스트에서는 Clock.fixed로 교체
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
