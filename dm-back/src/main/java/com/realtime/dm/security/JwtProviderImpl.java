package com.realtime.dm.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.JwtException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.UUID;

@Component
public class JwtProviderImpl implements JwtProvider {

    private static final String HMAC_ALG = "HmacSHA256"; // HS256
    private final SecretKey accessKey;
    private final long accessExpMs;

    public JwtProviderImpl(
            @Value("${jwt.secret}") String accessSecret,
            @Value("${jwt.secret-base64:false}") boolean accessBase64,
            @Value("${jwt.expiration-ms:3600000}") long accessExpMs
    ) {
        byte[] aBytes = accessBase64
                ? Base64.getDecoder().decode(accessSecret)
                : accessSecret.getBytes(StandardCharsets.UTF_8);

        if (aBytes.length < 32) {
            throw new IllegalArgumentException("JWT secret length must be >= 32 bytes (256 bits).");
        }

        this.accessKey = new SecretKeySpec(aBytes, HMAC_ALG);
        this.accessExpMs = accessExpMs;
    }

    @Override
    public Claims parseAccessClaims(String accessToken) {
        try {
            return Jwts.parser()
                    .verifyWith(accessKey)   // 0.12.x
                    .build()
                    .parseSignedClaims(accessToken)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new SecurityException("Invalid access token", e);
        }
    }

    @Override
    public String createAccessToken(UUID userId, String username) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(userId.toString())
                .claim("name", username)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessExpMs)))
                .signWith(accessKey) // 알고리즘은 키에서 유추(HS256)
                .compact();
    }
}
