package com.goormthonuniv.factcheck.protocol;

/**
 * 사용자 입력을 CDATA 블록으로 감싼다.
 * 입력 안의 "]]>" 는 블록을 닫았다가 다시 여는 형태로 쪼개므로
 * 어떤 입력도 블록을 먼저 끝낼 수 없다.
 */
public final class CdataLiteral {

    public static final String OPEN = "<![CDATA[";
    public static final String CLOSE = "]]>";
    private static final String SPLIT_CLOSE = "]]]]><![CDATA[>";

    private CdataLiteral() {}

    public static String wrap(String text) {
        String t = text == null ? "" : text;
        return OPEN + t.replace(CLOSE, SPLIT_CLOSE) + CLOSE;
    }
}
