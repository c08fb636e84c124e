package com.goormthonuniv.factcheck.util;

import org.apache.commons.lang3.StringUtils;

public final class TextUtils {

    private TextUtils() {}

    /** 앞에서 max 글자까지. null 이면 null */
    public static String truncate(String text, int max) {
        return StringUtils.left(text, max);
    }

    /** 로그/에러 메시지용 한 줄 샘플: 앞 max 글자 + 개행을 공백으로 */
    public static String headSample(String text, int max) {
        if (text == null) return "";
        return StringUtils.replaceChars(StringUtils.left(text, max), "\r\n", "  ");
    }

    /** 로그용 짧은 미리보기: 최대 max 글자 + "..." */
    public static String preview(String text, int max) {
        return StringUtils.abbreviate(StringUtils.defaultString(text), max + 3);
    }
}
