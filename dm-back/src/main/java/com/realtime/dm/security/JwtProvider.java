package com.realtime.dm.security;

import io.jsonwebtoken.Claims;

import java.util.UUID;

public interface JwtProvider {

    /** 액세스 토큰의 클레임 파싱(서명+만료 검증 포함). 실패 시 SecurityException */
    Claims parseAccessClaims(String accessToken);

    /** 테스트/로컬 개발용 발급. 운영 토큰은 외부 Identity Provider가 발급한다 */
    String createAccessToken(UUID userId, String username);
}
