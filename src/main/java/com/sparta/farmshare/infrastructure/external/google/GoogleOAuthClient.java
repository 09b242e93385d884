package com.sparta.farmshare.infrastructure.external.google;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sparta.farmshare.common.config.properties.GoogleOAuthProperties;
import com.sparta.farmshare.domain.auth.exception.OAuthAuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Google OAuth 2.0 Authorization Code 흐름
 * 1. 동의 화면 URL 생성
 * 2. code → access token 교환
 * 3. access token으로 프로필 조회
 */
@Slf4j
@Component
public class GoogleOAuthClient {

    static final String AUTHORIZATION_URI = "https://accounts.google.com/o/oauth2/v2/auth";
    static final String TOKEN_URI = "https://oauth2.googleapis.com/token";
    static final String USERINFO_URI = "https://www.googleapis.com/oauth2/v3/userinfo";
    private static final String SCOPE = "openid email profile";

    private final RestTemplate restTemplate;
    private final GoogleOAuthProperties properties;

    public GoogleOAuthClient(@Qualifier("googleRestTemplate") RestTemplate restTemplate,
                             GoogleOAuthProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public String buildAuthorizationUrl(String state) {
        return UriComponentsBuilder.fromHttpUrl(AUTHORIZATION_URI)
                .queryParam("client_id", properties.clientId())
                .queryParam("redirect_uri", properties.callbackUrl())
                .queryParam("response_type", "code")
                .queryParam("scope", SCOPE)
                .queryParam("state", state)
                .queryParam("prompt", "select_account")
                .encode()
                .toUriString();
    }

    /**
     * 인가 코드로 프로필까지 조회
     * @throws OAuthAuthenticationException Google 호출 실패 또는 응답 이상
     */
    public GoogleProfile fetchProfile(String authorizationCode) {
        try {
            String accessToken = exchangeCode(authorizationCode);

            HttpHeaders headers = new HttpHeaders();
            headers.setBearerAuth(accessToken);
            GoogleProfile profile = restTemplate.exchange(
                    USERINFO_URI, HttpMethod.GET, new HttpEntity<>(headers), GoogleProfile.class).getBody();

            if (profile == null || profile.id() == null || profile.email() == null) {
                log.error("[Google OAuth] 프로필 응답 이상 - profile={}", profile);
                throw new OAuthAuthenticationException();
            }
            return profile;
        } catch (RestClientException e) {
            log.error("[Google OAuth] Google API 호출 실패", e);
            throw new OAuthAuthenticationException(e);
        }
    }

    private String exchangeCode(String authorizationCode) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("code", authorizationCode);
        form.add("client_id", properties.clientId());
        form.add("client_secret", properties.clientSecret());
        form.add("redirect_uri", properties.callbackUrl());
        form.add("grant_type", "authorization_code");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        TokenResponse response = restTemplate.postForObject(TOKEN_URI, new HttpEntity<>(form, headers), TokenResponse.class);
        if (response == null || response.accessToken() == null) {
            log.error("[Google OAuth] 토큰 교환 응답에 access_token 없음");
            throw new OAuthAuthenticationException();
        }
        return response.accessToken();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(@JsonProperty("access_token") String accessToken) {
    }
}
