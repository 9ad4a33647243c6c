package isms.ismsbackend.filter;

import isms.ismsbackend.common.AuthenticatedActor;
import isms.ismsbackend.entity.UserEntity;
import isms.ismsbackend.provider.JwtProvider;
import isms.ismsbackend.repository.UserRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Bearer 토큰의 subject로 사용자를 찾아 {@link AuthenticatedActor}를 인증 주체로 등록한다.
 * 토큰이 없거나 유효하지 않으면 인증 없이 통과시키고, 접근 거부는 SecurityConfig가 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtProvider jwtProvider;
    private final UserRepository userRepository;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.startsWith("/api-docs") || uri.startsWith("/v3/api-docs") || uri.startsWith("/swagger-ui");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        try {
            resolveUser(request).ifPresent(user -> authenticate(user, request));
        } catch (Exception e) {
            log.error("JWT 인증 처리 실패: uri={}", request.getRequestURI(), e);
            SecurityContextHolder.clearContext();
        }
        filterChain.doFilter(request, response);
    }

    private Optional<UserEntity> resolveUser(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authorization) || !authorization.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }

        return jwtProvider.resolveUserId(authorization.substring(BEARER_PREFIX.length()).trim())
                .flatMap(userId -> {
                    Optional<UserEntity> user = userRepository.findById(userId);
                    if (user.isEmpty()) {
                        log.warn("토큰 사용자 없음: userId={}", userId);
                    }
                    return user;
                });
    }

    private void authenticate(UserEntity user, HttpServletRequest request) {
        // 역할은 권한으로만 싣는다. 문서 API는 인증 여부만 본다.
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                new AuthenticatedActor(user.getId(), user.getEmail()),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name())));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
    }
}
