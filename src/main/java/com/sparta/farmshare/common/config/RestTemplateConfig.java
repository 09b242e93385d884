package com.sparta.farmshare.common.config;

import com.sparta.farmshare.common.config.properties.PaystackProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 외부 API 호출용 RestTemplate 설정
 * - paystackRestTemplate: Paystack REST API (Bearer 시크릿 키, 요청 타임아웃)
 * - googleRestTemplate: Google OAuth 토큰 교환 / 프로필 조회
 */
@Configuration
public class RestTemplateConfig {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration GOOGLE_READ_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    public RestTemplate paystackRestTemplate(RestTemplateBuilder builder, PaystackProperties properties) {
        RestTemplateBuilder configured = builder
                .rootUri(properties.baseUrl())
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(properties.timeout());

        if (StringUtils.hasText(properties.secretKey())) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.secretKey());
        }
        return configured.build();
    }

    @Bean
    public RestTemplate googleRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(CONNECT_TIMEOUT)
                .setReadTimeout(GOOGLE_READ_TIMEOUT)
                .build();
    }
}
