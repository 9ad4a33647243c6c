package isms.ismsbackend.provider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * 액세스 토큰 발급/검증. 로그인은 외부 IdP가 담당하므로 발급은 내부 도구와 테스트에서만 쓴다.
 */
@Slf4j
@Service
public class JwtProvider {

    static final String EMAIL_CLAIM = "email";
    private static final long CLOCK_SKEW_SECONDS = 30;

    private final Key signingKey;
    private final long accessTokenExpirationMillis;
    private final Clock clock;
    private final JwtParser parser;

    public JwtProvider(@Value("${secret-key}") String secretKey,
                       @Value("${jwt.access-token.expiration:86400000}") long accessTokenExpirationMillis,
                       Clock clock) {
        this.signingKey = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpirationMillis = accessTokenExpirationMillis;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setAllowedClockSkewSeconds(CLOCK_SKEW_SECONDS)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public String create(String userId, String email) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plusMillis(accessTokenExpirationMillis);

        return Jwts.builder()
                .setSubject(userId)
                .claim(EMAIL_CLAIM, email)
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * 서명/만료 검증 후 subject(userId). 검증 실패 시 empty.
     */
    public Optional<String> resolveUserId(String token) {
        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            return Optional.ofNullable(claims.getSubject());
        } catch (ExpiredJwtException e) {
            log.debug("만료된 토큰: subject={}", e.getClaims().getSubject());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("유효하지 않은 토큰: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
