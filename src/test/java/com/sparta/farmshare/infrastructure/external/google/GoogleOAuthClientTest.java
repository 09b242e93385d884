package com.sparta.farmshare.infrastructure.external.google;

import com.sparta.farmshare.common.config.properties.GoogleOAuthProperties;
import com.sparta.farmshare.domain.auth.exception.OAuthAuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

@DisplayName("Google OAuth 클라이언트 테스트")
class GoogleOAuthClientTest {

    private MockRestServiceServer server;
    private GoogleOAuthClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new GoogleOAuthClient(restTemplate, new GoogleOAuthProperties(
                "client-id", "client-secret", "https://api.farmshare.ng/api/auth/google/callback"));
    }

    @Test
    @DisplayName("동의 화면 URL에 client_id, redirect_uri, state를 담는다")
    void 동의화면_URL() {
        // when
        String url = client.buildAuthorizationUrl("c3RhdGU");

        // then
        assertThat(url).startsWith(GoogleOAuthClient.AUTHORIZATION_URI)
                .contains("client_id=client-id")
                .contains("response_type=code")
                .contains("state=c3RhdGU")
                .contains("redirect_uri=https://api.farmshare.ng/api/auth/google/callback");
    }

    @Test
    @DisplayName("인가 코드를 토큰으로 바꾼 뒤 프로필을 조회한다")
    void 프로필_조회() {
        // given
        server.expect(requestTo(GoogleOAuthClient.TOKEN_URI))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andRespond(withSuccess("""
                        {"access_token": "google-access", "token_type": "Bearer", "expires_in": 3599}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(GoogleOAuthClient.USERINFO_URI))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer google-access"))
                .andRespond(withSuccess("""
                        {"sub": "google-123", "email": "ada@farmshare.ng", "email_verified": true,
                         "name": "Ada Obi", "picture": "https://img/ada.png", "locale": "en"}
                        """, MediaType.APPLICATION_JSON));

        // when
        GoogleProfile profile = client.fetchProfile("auth-code");

        // then
        assertThat(profile.id()).isEqualTo("google-123");
        assertThat(profile.email()).isEqualTo("ada@farmshare.ng");
        assertThat(profile.picture()).isEqualTo("https://img/ada.png");
        server.verify();
    }

    @Test
    @DisplayName("토큰 교환이 거부되면 OAuth 인증 예외로 바꾼다")
    void 토큰_교환_실패() {
        // given
        server.expect(requestTo(GoogleOAuthClient.TOKEN_URI))
                .andRespond(withUnauthorizedRequest());

        // when & then
        assertThatThrownBy(() -> client.fetchProfile("bad-code"))
                .isInstanceOf(OAuthAuthenticationException.class);
    }

    @Test
    @DisplayName("프로필에 이메일이 없으면 OAuth 인증 예외")
    void 프로필_이메일_없음() {
        // given
        server.expect(requestTo(GoogleOAuthClient.TOKEN_URI))
                .andRespond(withSuccess("{\"access_token\": \"google-access\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(GoogleOAuthClient.USERINFO_URI))
                .andRespond(withSuccess("{\"sub\": \"google-123\"}", MediaType.APPLICATION_JSON));

        // when & then
        assertThatThrownBy(() -> client.fetchProfile("auth-code"))
                .isInstanceOf(OAuthAuthenticationException.class);
    }
}
