package com.gotable.common.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 인증 필터 - 유효한 Bearer 토큰이 있으면 사용자 ID를
 * {@value #USER_ID_ATTRIBUTE} 요청 속성으로 노출한다.
 *
 * <p>필터 자체는 요청을 거절하지 않는다. 보호된 핸들러는 {@link LoginUser} 파라미터를
 * 선언하고, 속성이 없으면 {@link LoginUserArgumentResolver}가 401로 바꾼다.
 * 메뉴 목록, 공개 키 같은 공개 API는 토큰 없이 그대로 통과한다.</p>
 */
@Component
@RequiredArgsConstructor
public class AuthenticationFilter extends OncePerRequestFilter {

    public static final String USER_ID_ATTRIBUTE = "userId";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        jwtTokenProvider.resolveUserId(request.getHeader(HttpHeaders.AUTHORIZATION))
                .ifPresent(userId -> request.setAttribute(USER_ID_ATTRIBUTE, userId));
        chain.doFilter(request, response);
    }
}
