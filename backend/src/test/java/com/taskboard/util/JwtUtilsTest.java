package com.taskboard.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwtUtils 테스트")
class JwtUtilsTest {

    private Jwt.Builder jwt() {
        return Jwt.withTokenValue("token")
                .header("alg", "none")
                .subject("auth-1");
    }

    @Test
    @DisplayName("이메일은 소문자로 정규화한다")
    void extractUserInfo_LowercasesEmail() {
        Jwt token = jwt()
                .claim("email", " Member@Example.COM ")
                .claim("name", "Member")
                .build();

        JwtUtils.UserInfo info = JwtUtils.extractUserInfo(token);

        assertThat(info.authUserId()).isEqualTo("auth-1");
        assertThat(info.email()).isEqualTo("member@example.com");
        assertThat(info.name()).isEqualTo("Member");
    }

    @Test
    @DisplayName("이름이 없으면 이메일 앞부분을 사용한다")
    void extractUserInfo_NameFromEmail() {
        Jwt token = jwt()
                .claim("preferred_username", "someone@example.com")
                .build();

        JwtUtils.UserInfo info = JwtUtils.extractUserInfo(token);

        assertThat(info.email()).isEqualTo("someone@example.com");
        assertThat(info.name()).isEqualTo("someone");
    }
}
