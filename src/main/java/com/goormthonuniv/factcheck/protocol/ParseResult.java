package com.goormthonuniv.factcheck.protocol;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 응답 파싱 결과. 일부만 채워진 결과나 기본값으로 메운 결과는 존재하지 않는다.
 */
public sealed interface ParseResult {

    record Success(StructuredResult result) implements ParseResult {}

    /**
     * @param missing        누락된 태그 전부(첫 번째만이 아님)
     * @param responseSample 응답 앞부분(개행 제거) 진단용
     */
    record MissingTags(Set<ResponseTag> missing, String responseSample) implements ParseResult {
        public MissingTags {
            EnumSet<ResponseTag> copy = EnumSet.noneOf(ResponseTag.class);
            copy.addAll(missing);
            missing = Collections.unmodifiableSet(copy);
        }
    }

    /** 숫자 섹션이 정수가 아니거나 0~100 범위를 벗어남 */
    record RangeInvalid(ResponseTag field, String value) implements ParseResult {}
}
