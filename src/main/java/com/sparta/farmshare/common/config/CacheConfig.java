package com.sparta.farmshare.common.config;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.bank.dto.SupportedBank;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext.SerializationPair;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.List;

/**
 * Redis 캐시 설정
 *
 * 지원 은행 목록만 캐시한다 (Paystack 호출 절감)
 * 값은 타입이 고정된 JSON으로 저장해 캐시 안에 클래스 정보를 남기지 않는다
 */
@Configuration
@EnableCaching
public class CacheConfig {

    /**
     * cache: prefix로 분산 락(lock:), 토큰 블랙리스트(blacklist:)와 구분
     */
    public static final String SUPPORTED_BANKS = "cache:supportedBanks";

    // 은행 목록은 거의 바뀌지 않는다
    private static final Duration SUPPORTED_BANKS_TTL = Duration.ofHours(6);

    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory, ObjectMapper objectMapper) {
        JavaType bankListType = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, SupportedBank.class);

        RedisCacheConfiguration supportedBanks = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(SUPPORTED_BANKS_TTL)
                .disableCachingNullValues()
                .serializeKeysWith(SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(SerializationPair.fromSerializer(
                        new Jackson2JsonRedisSerializer<>(objectMapper, bankListType)));

        return RedisCacheManager.builder(connectionFactory)
                .withCacheConfiguration(SUPPORTED_BANKS, supportedBanks)
                .disableCreateOnMissingCache()
                .build();
    }
}
