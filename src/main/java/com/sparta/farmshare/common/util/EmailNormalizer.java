package com.sparta.farmshare.common.util;

import java.util.Locale;

/**
 * 이메일 정규화 (앞뒤 공백 제거 + 소문자)
 * 조회/저장 전에 항상 적용
 */
public class EmailNormalizer {

    private EmailNormalizer() {
    }

    public static String normalize(String email) {
        if (email == null) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
