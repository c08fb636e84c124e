package com.goormthonuniv.factcheck.protocol;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 응답에 반드시 있어야 하는 네 개의 태그 섹션 */
public enum ResponseTag {
    RESOURCE_ANALYSIS,
    TRUTH_ANALYSIS,
    CONFIDENCE,
    SCORE;

    private final Pattern pattern =
            Pattern.compile("<" + name() + ">([\\s\\S]*?)</" + name() + ">", Pattern.CASE_INSENSITIVE);

    /** 첫 번째로 매칭된 태그 쌍의 본문(trim). 없으면 empty */
    public Optional<String> extract(String reply) {
        if (reply == null) return Optional.empty();
        Matcher m = pattern.matcher(reply);
        return m.find() ? Optional.of(m.group(1).trim()) : Optional.empty();
    }
}
