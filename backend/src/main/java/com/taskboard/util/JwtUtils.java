package com.taskboard.util;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * JWT 토큰에서 사용자 정보를 추출하는 유틸리티 클래스
 */
public class JwtUtils {

    private JwtUtils() {
        // 유틸리티 클래스이므로 인스턴스화 방지
    }

    /**
     * JWT에서 인증 사용자 ID(sub 클레임)를 추출합니다.
     */
    public static String extractAuthUserId(Jwt jwt) {
        String subject = jwt.getSubject();
        if (subject != null) {
            return subject;
        }
        return jwt.getClaimAsString("sub");
    }

    /**
     * JWT에서 사용자 정보(authUserId, email, name)를 추출합니다.
     */
    public static UserInfo extractUserInfo(Jwt jwt) {
        String authUserId = extractAuthUserId(jwt);
        String email = extractEmail(jwt);
        String name = extractName(jwt, email);

        return new UserInfo(authUserId, email, name);
    }

    /**
     * email 클레임이 없으면 preferred_username을 사용합니다.
     * 초대 수락 시 이메일 비교에 쓰이므로 소문자로 정규화합니다.
     */
    private static String extractEmail(Jwt jwt) {
        String email = jwt.getClaimAsString("email");
        if (email == null) {
            email = jwt.getClaimAsString("preferred_username");
        }
        return email == null ? null : email.trim().toLowerCase();
    }

    /**
     * name 클레임이 없으면 이메일의 @ 앞부분, 그것도 없으면 "User"를 사용합니다.
     */
    private static String extractName(Jwt jwt, String email) {
        String name = jwt.getClaimAsString("name");
        if (name == null) {
            if (email != null && email.contains("@")) {
                name = email.split("@")[0];
            } else {
                name = "User";
            }
        }
        return name;
    }

    public record UserInfo(String authUserId, String email, String name) {
    }
}
