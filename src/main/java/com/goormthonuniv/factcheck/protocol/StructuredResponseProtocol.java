package com.goormthonuniv.factcheck.protocol;

import com.goormthonuniv.factcheck.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 모델 응답의 태그 섹션 추출 + 검증.
 * 1) 네 개의 태그를 각각 독립적으로(대소문자 무시) 찾는다
 * 2) 하나라도 없으면 누락된 태그 전부를 MissingTags 로 보고
 * 3) CONFIDENCE / SCORE 는 정수이면서 0~100 이어야 한다(보정하지 않음)
 */
@Component
public class StructuredResponseProtocol {

    static final int RESPONSE_SAMPLE_LENGTH = 200;

    public ParseResult parse(String reply) {
        Map<ResponseTag, String> sections = new EnumMap<>(ResponseTag.class);
        Set<ResponseTag> missing = EnumSet.noneOf(ResponseTag.class);
        for (ResponseTag tag : ResponseTag.values()) {
            Optional<String> body = tag.extract(reply);
            if (body.isPresent()) {
                sections.put(tag, body.get());
            } else {
                missing.add(tag);
            }
        }
        if (!missing.isEmpty()) {
            return new ParseResult.MissingTags(missing, TextUtils.headSample(reply, RESPONSE_SAMPLE_LENGTH));
        }

        String rawConfidence = sections.get(ResponseTag.CONFIDENCE);
        Integer confidence = parseBounded(rawConfidence);
        if (confidence == null) {
            return new ParseResult.RangeInvalid(ResponseTag.CONFIDENCE, rawConfidence);
        }
        String rawScore = sections.get(ResponseTag.SCORE);
        Integer score = parseBounded(rawScore);
        if (score == null) {
            return new ParseResult.RangeInvalid(ResponseTag.SCORE, rawScore);
        }

        return new ParseResult.Success(new StructuredResult(
                sections.get(ResponseTag.RESOURCE_ANALYSIS),
                sections.get(ResponseTag.TRUTH_ANALYSIS),
                confidence,
                score
        ));
    }

    /** 실패한 파싱 결과를 재시도 로그/원장에 남길 한 줄 메시지로 */
    public String describeFailure(ParseResult failure, String modelId) {
        if (failure instanceof ParseResult.MissingTags m) {
            String tags = m.missing().stream().map(Enum::name).collect(Collectors.joining(", "));
            return "Invalid response format from " + modelId + ": Missing tags [" + tags + "]. "
                    + "Response started with: \"" + m.responseSample() + "...\"";
        }
        if (failure instanceof ParseResult.RangeInvalid r) {
            String label = r.field() == ResponseTag.CONFIDENCE ? "confidence" : "accuracy";
            return "Invalid " + label + " score from " + modelId + ": " + r.value();
        }
        throw new IllegalArgumentException("Not a failure: " + failure);
    }

    private static Integer parseBounded(String raw) {
        int v;
        try {
            v = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        return StructuredResult.inRange(v) ? v : null;
    }
}
