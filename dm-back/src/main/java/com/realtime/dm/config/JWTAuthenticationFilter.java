package com.realtime.dm.config;

import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.realtime.dm.security.JwtProvider;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Authorization: Bearer 토큰 → principal name = 사용자 UUID 문자열.
 * 토큰 발급은 외부 Identity Provider 담당이고 여기서는 검증만 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JWTAuthenticationFilter extends OncePerRequestFilter {

    private final JwtProvider jwtProvider;

    private static final String BEARER = "Bearer ";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getServletPath();
        return p.startsWith("/ws/")                                  // SockJS/STOMP 엔드포인트
                || "OPTIONS".equalsIgnoreCase(request.getMethod());  // CORS preflight
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String h = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (h != null && h.startsWith(BEARER)) {
            String token = h.substring(BEARER.length());
            try {
                Claims c = jwtProvider.parseAccessClaims(token);
                // subject 는 UUID 여야 한다 (컨트롤러에서 UUID.fromString)
                String userId = UUID.fromString(c.getSubject()).toString();

                if (SecurityContextHolder.getContext().getAuthentication() == null) {
                    var auth = new UsernamePasswordAuthenticationToken(userId, null, List.of());
                    SecurityContextHolder.getContext().setAuthentication(auth);
                }
            } catch (SecurityException | IllegalArgumentException e) {
                // 인증 미설정으로 통과 → 보호 리소스면 이후 체인에서 401
                log.warn("Invalid JWT(access): {}", e.getMessage());
            }
        }
        chain.doFilter(req, res);
    }
}
