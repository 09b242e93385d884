package com.sparta.farmshare.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정
 * BaseEntity의 createdAt / updatedAt 자동 기록
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
