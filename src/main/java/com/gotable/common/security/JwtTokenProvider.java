package com.gotable.common.security;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * HMAC-SHA 서명 Bearer 토큰 발급/검증.
 *
 * <p>토큰에는 사용자 ID(subject)만 담는다. 나머지 사용자 정보는 필요한 흐름에서
 * users 테이블을 조회한다. 기본 만료 시간은 30분이다.</p>
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey key;
    private final long expiration;

    public JwtTokenProvider(
            @Value("${gotable.jwt.secret:goTableDevelopmentSecretKeyThatIsLongEnoughForHs256}") String secret,
            @Value("${gotable.jwt.expiration:1800000}") long expiration) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
    }

    /** 사용자 ID를 subject로 하는 액세스 토큰 발급 */
    public String createToken(Long userId) {
        Date now = new Date();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expiration))
                .signWith(key)
                .compact();
    }

    /**
     * {@code Authorization} 헤더 값에서 사용자 ID를 꺼낸다.
     *
     * @return 헤더가 없거나 Bearer 형식이 아니거나, 서명 불일치/만료/숫자가 아닌
     *         subject인 경우 빈 값
     */
    public Optional<Long> resolveUserId(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader) || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        try {
            String subject = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload()
                    .getSubject();
            return Optional.of(Long.parseLong(subject));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
