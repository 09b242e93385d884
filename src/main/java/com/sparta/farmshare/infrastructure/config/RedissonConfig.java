package com.sparta.farmshare.infrastructure.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson 분산 락 설정
 * 판매자 정산(송금) 요청을 판매자 단위로 직렬화하는 데 사용
 */
@Configuration
public class RedissonConfig {

    private static final String REDIS_PROTOCOL_PREFIX = "redis://";

    // 락 용도로만 쓰므로 풀은 작게 유지
    private static final int CONNECTION_MINIMUM_IDLE_SIZE = 4;
    private static final int CONNECTION_POOL_SIZE = 16;
    private static final int CONNECT_TIMEOUT = 3000;
    private static final int COMMAND_TIMEOUT = 3000;

    @Value("${spring.data.redis.host}")
    private String redisHost;

    @Value("${spring.data.redis.port}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();

        SingleServerConfig serverConfig = config.useSingleServer()
                .setAddress(REDIS_PROTOCOL_PREFIX + redisHost + ":" + redisPort)
                .setConnectionMinimumIdleSize(CONNECTION_MINIMUM_IDLE_SIZE)
                .setConnectionPoolSize(CONNECTION_POOL_SIZE)
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setTimeout(COMMAND_TIMEOUT);

        if (StringUtils.hasText(redisPassword)) {
            serverConfig.setPassword(redisPassword);
        }

        return Redisson.create(config);
    }
}
