package com.realtime.dm.common;

import org.springframework.stereotype.Component;

@Component
public class Normalizer {

    /** username은 소문자로 저장/조회 */
    public String normalizeUsername(String username) {
        if (username == null) return null;
        String s = username.trim().toLowerCase();
        return s.isEmpty() ? null : s;
    }

    /** 검색어: 앞뒤 공백 제거 + 소문자 */
    public String normalizeQuery(String q) {
        if (q == null) return "";
        return q.trim().toLowerCase();
    }
}
