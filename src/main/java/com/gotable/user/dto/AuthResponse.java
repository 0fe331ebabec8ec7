package com.gotable.user.dto;

/** 회원가입/로그인 응답 - 사용자 정보와 Bearer 액세스 토큰 */
public record AuthResponse(UserResponse user, String accessToken, String tokenType) {

    private static final String BEARER = "bearer";

    public static AuthResponse bearer(UserResponse user, String accessToken) {
        return new AuthResponse(user, accessToken, BEARER);
    }
}
